package my.fundmetrics.app.model;

public record AnnualRatios(PeriodKey period, Double roce, Double roe, Double retention) implements PeriodicRecord {
}
