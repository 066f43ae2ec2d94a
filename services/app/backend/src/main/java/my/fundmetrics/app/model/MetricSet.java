package my.fundmetrics.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * All 22 metrics of one stock at one period. Every name is always present.
 */
public final class MetricSet {
	private final Map<MetricName, MetricValue> values;
	private final FinancialBasis basis;
	private final MetricOutcome outcome;

	private MetricSet(Map<MetricName, MetricValue> values, FinancialBasis basis, MetricOutcome outcome) {
		this.values = values;
		this.basis = basis;
		this.outcome = outcome;
	}

	public static MetricSet of(Map<MetricName, MetricValue> computed, FinancialBasis basis) {
		EnumMap<MetricName, MetricValue> values = new EnumMap<>(MetricName.class);
		boolean complete = true;
		for (MetricName name : MetricName.values()) {
			MetricValue value = computed.get(name);
			if (value == null) {
				value = MetricValue.insufficientData();
			}
			values.put(name, value);
			if (value.status() == MetricStatus.INSUFFICIENT_DATA || value.status() == MetricStatus.UNDEFINED) {
				complete = false;
			}
		}
		return new MetricSet(values, basis == null ? FinancialBasis.ZERO : basis,
				complete ? MetricOutcome.COMPLETE : MetricOutcome.PARTIAL);
	}

	public static MetricSet noData() {
		return zeros(MetricValue.insufficientData(), MetricOutcome.NO_DATA);
	}

	public static MetricSet failed() {
		return zeros(MetricValue.undefined(), MetricOutcome.FAILED);
	}

	private static MetricSet zeros(MetricValue fill, MetricOutcome outcome) {
		EnumMap<MetricName, MetricValue> values = new EnumMap<>(MetricName.class);
		for (MetricName name : MetricName.values()) {
			values.put(name, fill);
		}
		return new MetricSet(values, FinancialBasis.ZERO, outcome);
	}

	public double value(MetricName name) {
		return values.get(name).value();
	}

	public MetricStatus status(MetricName name) {
		return values.get(name).status();
	}

	public Map<MetricName, MetricValue> values() {
		return Collections.unmodifiableMap(values);
	}

	public Map<MetricName, Double> asDoubles() {
		EnumMap<MetricName, Double> result = new EnumMap<>(MetricName.class);
		values.forEach((name, value) -> result.put(name, value.value()));
		return result;
	}

	public FinancialBasis basis() {
		return basis;
	}

	public MetricOutcome outcome() {
		return outcome;
	}
}
