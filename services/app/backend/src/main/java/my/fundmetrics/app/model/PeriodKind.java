package my.fundmetrics.app.model;

public enum PeriodKind {
	DATE,
	YEAR_MONTH,
	FISCAL_YEAR
}
