package my.fundmetrics.app.model;

public interface PeriodicRecord {
	PeriodKey period();
}
