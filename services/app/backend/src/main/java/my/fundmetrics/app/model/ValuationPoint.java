package my.fundmetrics.app.model;

public record ValuationPoint(PeriodKey period, Double marketCap, Double marketCapFreeFloat) implements PeriodicRecord {
}
