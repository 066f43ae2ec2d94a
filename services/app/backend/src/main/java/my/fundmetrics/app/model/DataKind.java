package my.fundmetrics.app.model;

/**
 * Storage families for time-series records. Each kind is read with one bulk query per batch.
 */
public enum DataKind {
	VALUATION(PeriodKind.DATE),
	TRAILING(PeriodKind.YEAR_MONTH),
	QUARTERLY(PeriodKind.YEAR_MONTH),
	ANNUAL(PeriodKind.FISCAL_YEAR),
	PRICE(PeriodKind.DATE);

	private final PeriodKind periodKind;

	DataKind(PeriodKind periodKind) {
		this.periodKind = periodKind;
	}

	public PeriodKind periodKind() {
		return periodKind;
	}
}
