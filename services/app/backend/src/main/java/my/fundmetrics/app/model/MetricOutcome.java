package my.fundmetrics.app.model;

public enum MetricOutcome {
	COMPLETE,
	PARTIAL,
	NO_DATA,
	FAILED;

	public boolean isPartial() {
		return this == PARTIAL || this == NO_DATA;
	}

	public MetricOutcome worst(MetricOutcome other) {
		return other != null && other.ordinal() > ordinal() ? other : this;
	}
}
