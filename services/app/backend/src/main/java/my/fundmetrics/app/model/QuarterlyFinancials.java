package my.fundmetrics.app.model;

public record QuarterlyFinancials(PeriodKey period,
								  Double revenue,
								  Double revenueFreeFloat,
								  Double pat,
								  Double patFreeFloat) implements PeriodicRecord {
}
