package my.fundmetrics.app.service;

import my.fundmetrics.app.model.FinancialBasis;
import my.fundmetrics.app.model.HoldingMetrics;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.model.MetricSet;
import my.fundmetrics.app.model.MetricValue;
import my.fundmetrics.app.model.PortfolioMetricSet;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WeightedPortfolioAggregatorTest {
	private final WeightedPortfolioAggregator aggregator = new WeightedPortfolioAggregator();

	@Test
	void weightsFollowMarketValueAndSumToOne() {
		PortfolioMetricSet portfolio = aggregator.aggregate(List.of(
				holding(1L, "300", 0.1, new FinancialBasis(2000.0, 1000.0, 100.0)),
				holding(2L, "100", 0.3, new FinancialBasis(300.0, 100.0, 30.0)),
				holding(3L, null, 5.0, new FinancialBasis(1.0, 1.0, 1.0))));

		assertThat(portfolio.weights()).containsEntry(1L, 0.75).containsEntry(2L, 0.25).containsEntry(3L, 0.0);
		assertThat(portfolio.totalWeight()).isCloseTo(1.0, within(1e-9));
		assertThat(portfolio.holdingsCount()).isEqualTo(3);
		assertThat(portfolio.contributingHoldings()).isEqualTo(2);
		assertThat(portfolio.value(MetricName.QOQ_GROWTH)).isCloseTo(0.15, within(1e-9));
	}

	@Test
	void ratioMetricsComeFromWeightedTotals() {
		PortfolioMetricSet portfolio = aggregator.aggregate(List.of(
				holding(1L, "300", 0.0, new FinancialBasis(2000.0, 1000.0, 100.0)),
				holding(2L, "100", 0.0, new FinancialBasis(300.0, 100.0, 30.0))));

		double averageOfRatios = 0.75 * 20.0 + 0.25 * 10.0;
		assertThat(portfolio.value(MetricName.CURRENT_PE)).isCloseTo(1575.0 / 82.5, within(1e-9));
		assertThat(portfolio.value(MetricName.CURRENT_PE)).isNotCloseTo(averageOfRatios, within(0.01));
		assertThat(portfolio.value(MetricName.CURRENT_PR)).isCloseTo(1575.0 / 775.0, within(1e-9));
		assertThat(portfolio.value(MetricName.PATM)).isCloseTo(82.5 / 775.0 * 100.0, within(1e-9));
		assertThat(portfolio.weightedTotals().valuation()).isCloseTo(1575.0, within(1e-9));
	}

	@Test
	void stockHeldTwiceCountsOnce() {
		PortfolioMetricSet portfolio = aggregator.aggregate(List.of(
				holding(1L, "50", 0.1, new FinancialBasis(100.0, 50.0, 5.0)),
				holding(1L, "50", 0.1, new FinancialBasis(100.0, 50.0, 5.0))));

		assertThat(portfolio.value(MetricName.QOQ_GROWTH)).isCloseTo(0.1, within(1e-9));
		assertThat(portfolio.weights()).containsOnlyKeys(1L).containsEntry(1L, 1.0);
		assertThat(portfolio.totalWeight()).isCloseTo(1.0, within(1e-9));
		assertThat(portfolio.weightedTotals().valuation()).isCloseTo(100.0, within(1e-9));
		assertThat(portfolio.contributingHoldings()).isEqualTo(2);
	}

	@Test
	void zeroTotalMarketValueGivesZeroMetrics() {
		PortfolioMetricSet portfolio = aggregator.aggregate(List.of(
				holding(1L, "0", 0.2, new FinancialBasis(10.0, 10.0, 1.0)),
				holding(2L, "-5", 0.4, new FinancialBasis(10.0, 10.0, 1.0))));

		assertThat(portfolio.contributingHoldings()).isZero();
		assertThat(portfolio.values()).hasSize(22).allSatisfy((name, value) -> assertThat(value).isZero());
		assertThat(portfolio.totalWeight()).isZero();
	}

	@Test
	void emptyFundGivesZeroMetrics() {
		PortfolioMetricSet portfolio = aggregator.aggregate(List.of());

		assertThat(portfolio.holdingsCount()).isZero();
		assertThat(portfolio.value(MetricName.CURRENT_PE)).isZero();
	}

	private static HoldingMetrics holding(Long stockId, String marketValue, double qoq, FinancialBasis basis) {
		MetricSet metrics = MetricSet.of(Map.of(MetricName.QOQ_GROWTH, MetricValue.of(qoq)), basis);
		return new HoldingMetrics(stockId, "Stock " + stockId, marketValue == null ? null : new BigDecimal(marketValue),
				metrics);
	}
}
