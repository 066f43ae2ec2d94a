package my.fundmetrics.app.service;

import my.fundmetrics.app.model.FinancialBasis;
import my.fundmetrics.app.model.HoldingMetrics;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.model.MetricSet;
import my.fundmetrics.app.model.PortfolioMetricSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-stock metric sets into fund figures. Weights are recomputed from market values on every
 * call. Margin and the current PE and PR multiples are rebuilt from weighted financial totals, as a totals
 * row would compute them, instead of averaging each holding's own ratio.
 */
@Service
public class WeightedPortfolioAggregator {
	private static final Logger logger = LoggerFactory.getLogger(WeightedPortfolioAggregator.class);

	public PortfolioMetricSet aggregate(List<HoldingMetrics> holdings) {
		List<HoldingMetrics> safeHoldings = holdings == null ? List.of() : holdings;
		List<Double> entryWeights = entryWeights(safeHoldings);
		Map<Long, Double> weights = new LinkedHashMap<>();
		for (int i = 0; i < safeHoldings.size(); i++) {
			weights.merge(safeHoldings.get(i).stockId(), entryWeights.get(i), Double::sum);
		}
		int contributing = (int) entryWeights.stream().filter(weight -> weight > 0.0).count();
		if (contributing == 0) {
			if (!safeHoldings.isEmpty()) {
				logger.warn("Total market value of {} holdings is zero; portfolio metrics default to zero",
						safeHoldings.size());
			}
			return new PortfolioMetricSet(Map.of(), FinancialBasis.ZERO, weights, safeHoldings.size(), 0,
					Instant.now());
		}

		Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
		double weightedValuation = 0.0;
		double weightedRevenue = 0.0;
		double weightedProfit = 0.0;
		for (int i = 0; i < safeHoldings.size(); i++) {
			HoldingMetrics holding = safeHoldings.get(i);
			double weight = entryWeights.get(i);
			MetricSet metrics = holding.metrics();
			if (weight <= 0.0 || metrics == null) {
				continue;
			}
			for (MetricName name : MetricName.values()) {
				if (name.aggregation() == MetricName.Aggregation.WEIGHTED_MEAN) {
					values.merge(name, metrics.value(name) * weight, Double::sum);
				}
			}
			FinancialBasis basis = metrics.basis();
			weightedValuation += basis.valuation() * weight;
			weightedRevenue += basis.trailingRevenue() * weight;
			weightedProfit += basis.trailingProfit() * weight;
		}

		values.put(MetricName.PATM, ratio(weightedProfit, weightedRevenue) * 100.0);
		values.put(MetricName.CURRENT_PE, ratio(weightedValuation, weightedProfit));
		values.put(MetricName.CURRENT_PR, ratio(weightedValuation, weightedRevenue));

		return new PortfolioMetricSet(values,
				new FinancialBasis(weightedValuation, weightedRevenue, weightedProfit),
				weights,
				safeHoldings.size(),
				contributing,
				Instant.now());
	}

	/**
	 * Market value share of each holding, in list order; holdings without a positive market value get
	 * weight zero. A stock held twice gets two entries.
	 */
	List<Double> entryWeights(List<HoldingMetrics> holdings) {
		BigDecimal total = BigDecimal.ZERO;
		for (HoldingMetrics holding : holdings) {
			if (isPositive(holding.marketValue())) {
				total = total.add(holding.marketValue());
			}
		}
		List<Double> weights = new ArrayList<>(holdings.size());
		for (HoldingMetrics holding : holdings) {
			double weight = 0.0;
			if (total.signum() > 0 && isPositive(holding.marketValue())) {
				weight = holding.marketValue().doubleValue() / total.doubleValue();
			}
			weights.add(weight);
		}
		return weights;
	}

	private static boolean isPositive(BigDecimal value) {
		return value != null && value.signum() > 0;
	}

	private static double ratio(double numerator, double denominator) {
		if (denominator == 0.0) {
			return 0.0;
		}
		double result = numerator / denominator;
		return Double.isFinite(result) ? result : 0.0;
	}
}
