package my.fundmetrics.app.model;

public record TrailingFinancials(PeriodKey period,
								 Double revenue,
								 Double revenueFreeFloat,
								 Double pat,
								 Double patFreeFloat) implements PeriodicRecord {
}
