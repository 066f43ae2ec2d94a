package my.fundmetrics.app.model;

/**
 * A metric result. Anything other than {@link MetricStatus#OK} carries 0.0.
 */
public record MetricValue(double value, MetricStatus status) {
	private static final MetricValue INSUFFICIENT = new MetricValue(0.0, MetricStatus.INSUFFICIENT_DATA);
	private static final MetricValue UNDEFINED = new MetricValue(0.0, MetricStatus.UNDEFINED);
	private static final MetricValue NOT_AVAILABLE = new MetricValue(0.0, MetricStatus.NOT_AVAILABLE);

	public static MetricValue of(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return UNDEFINED;
		}
		return new MetricValue(value, MetricStatus.OK);
	}

	public static MetricValue insufficientData() {
		return INSUFFICIENT;
	}

	public static MetricValue undefined() {
		return UNDEFINED;
	}

	public static MetricValue notAvailable() {
		return NOT_AVAILABLE;
	}

	public boolean isOk() {
		return status == MetricStatus.OK;
	}
}
