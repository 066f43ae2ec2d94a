package my.fundmetrics.app.model;

public record PricePoint(PeriodKey period, Double sharePrice, Double prRatio, Double peRatio) implements PeriodicRecord {
}
