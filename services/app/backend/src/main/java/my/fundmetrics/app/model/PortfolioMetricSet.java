package my.fundmetrics.app.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record PortfolioMetricSet(Map<MetricName, Double> values,
								 FinancialBasis weightedTotals,
								 Map<Long, Double> weights,
								 int holdingsCount,
								 int contributingHoldings,
								 Instant lastUpdated) {
	public PortfolioMetricSet {
		EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
		for (MetricName name : MetricName.values()) {
			Double value = values == null ? null : values.get(name);
			copy.put(name, value == null ? 0.0 : value);
		}
		values = Collections.unmodifiableMap(copy);
		weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
		weightedTotals = weightedTotals == null ? FinancialBasis.ZERO : weightedTotals;
	}

	public double value(MetricName name) {
		return values.get(name);
	}

	public double totalWeight() {
		return weights.values().stream().mapToDouble(Double::doubleValue).sum();
	}
}
