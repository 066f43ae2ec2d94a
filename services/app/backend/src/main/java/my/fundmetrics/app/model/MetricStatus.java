package my.fundmetrics.app.model;

public enum MetricStatus {
	OK,
	INSUFFICIENT_DATA,
	UNDEFINED,
	NOT_AVAILABLE
}
