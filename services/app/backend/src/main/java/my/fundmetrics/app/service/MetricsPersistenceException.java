package my.fundmetrics.app.service;

public class MetricsPersistenceException extends RuntimeException {
	private final Long fundId;

	public MetricsPersistenceException(Long fundId, String message, Throwable cause) {
		super(message, cause);
		this.fundId = fundId;
	}

	public Long getFundId() {
		return fundId;
	}
}
