package my.fundmetrics.app.dto;

public enum MetricsJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED,
	CANCELLED
}
