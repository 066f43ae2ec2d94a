package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.model.FinancialBasis;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.model.MetricSet;
import my.fundmetrics.app.model.MetricValue;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.QuarterlyFinancials;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.model.TrailingFinancials;
import my.fundmetrics.app.model.ValuationPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Computes the 22 per-stock metrics for one period from an in-memory bundle. Never performs I/O and never
 * throws: missing inputs produce {@code INSUFFICIENT_DATA} or {@code UNDEFINED} values of 0.0, and an
 * unexpected failure yields an all-zero {@link MetricSet#failed()}.
 */
@Service
public class MetricsCalculator {
	private static final Logger logger = LoggerFactory.getLogger(MetricsCalculator.class);

	static final int CAGR_RECORDS = 24;
	static final int CAGR_YEARS = 6;
	static final int RATIO_HISTORY = 20;
	static final int TWO_YEAR_WINDOW = 8;
	static final int FIVE_YEAR_WINDOW = 20;
	static final int TEN_QUARTER_WINDOW = 10;
	static final int YEAR_OVER_YEAR_OFFSET = 3;

	private final double bondRate;

	@Autowired
	public MetricsCalculator(AppProperties properties) {
		this(properties.metrics().bondRate());
	}

	public MetricsCalculator(double bondRate) {
		this.bondRate = bondRate;
	}

	public MetricSet compute(String stockName, PeriodKey period, TimeSeriesBundle bundle) {
		try {
			return computeUnchecked(period, bundle, stockName);
		} catch (RuntimeException ex) {
			logger.error("Metric calculation failed for {} at {}; defaulting to zero", stockName, period, ex);
			return MetricSet.failed();
		}
	}

	private MetricSet computeUnchecked(PeriodKey period, TimeSeriesBundle bundle, String stockName) {
		if (bundle == null) {
			logger.warn("No data for {} at {}", stockName, period);
			return MetricSet.noData();
		}
		List<TrailingFinancials> trailing = TimeSeriesBundle.atOrBefore(bundle.trailing(), period);
		List<QuarterlyFinancials> quarters = TimeSeriesBundle.atOrBefore(bundle.quarterly(), period);
		List<ValuationPoint> valuations = TimeSeriesBundle.atOrBefore(bundle.valuations(), period);
		if (trailing.isEmpty() && quarters.isEmpty() && valuations.isEmpty()) {
			logger.warn("No data for {} at {}", stockName, period);
			return MetricSet.noData();
		}

		Map<MetricName, MetricValue> values = new EnumMap<>(MetricName.class);
		values.put(MetricName.PATM, patm(trailing));
		values.put(MetricName.QOQ_GROWTH, quarterGrowth(quarters, 1));
		values.put(MetricName.YOY_GROWTH, quarterGrowth(quarters, YEAR_OVER_YEAR_OFFSET));
		values.put(MetricName.REVENUE_6YR_CAGR, cagr(trailing, TrailingFinancials::revenue));
		values.put(MetricName.PAT_6YR_CAGR, cagr(trailing, TrailingFinancials::pat));

		List<Double> peRatios = ratioHistory(valuations, trailing, TrailingFinancials::pat);
		RatioWindow pe = ratioWindow(peRatios);
		values.put(MetricName.CURRENT_PE, pe.current);
		values.put(MetricName.PE_2YR_AVG, pe.twoYearAverage);
		values.put(MetricName.PE_5YR_AVG, pe.fiveYearAverage);
		values.put(MetricName.PE_2YR_REVAL_DEVAL, revaluation(pe.twoYearAverage, pe.current));
		values.put(MetricName.PE_5YR_REVAL_DEVAL, revaluation(pe.fiveYearAverage, pe.current));

		List<Double> prRatios = ratioHistory(valuations, trailing, TrailingFinancials::revenue);
		RatioWindow pr = ratioWindow(prRatios);
		values.put(MetricName.CURRENT_PR, pr.current);
		values.put(MetricName.PR_2YR_AVG, pr.twoYearAverage);
		values.put(MetricName.PR_5YR_AVG, pr.fiveYearAverage);
		values.put(MetricName.PR_2YR_REVAL_DEVAL, revaluation(pr.twoYearAverage, pr.current));
		values.put(MetricName.PR_5YR_REVAL_DEVAL, revaluation(pr.fiveYearAverage, pr.current));
		if (prRatios.size() >= TEN_QUARTER_WINDOW) {
			List<Double> window = prRatios.subList(0, TEN_QUARTER_WINDOW);
			values.put(MetricName.PR_10Q_LOW, MetricValue.of(window.stream().mapToDouble(Double::doubleValue).min()
					.orElse(0.0)));
			values.put(MetricName.PR_10Q_HIGH, MetricValue.of(window.stream().mapToDouble(Double::doubleValue).max()
					.orElse(0.0)));
		} else {
			values.put(MetricName.PR_10Q_LOW, MetricValue.insufficientData());
			values.put(MetricName.PR_10Q_HIGH, MetricValue.insufficientData());
		}

		// no benchmark return series is modelled yet
		values.put(MetricName.ALPHA_BOND_CAGR, MetricValue.notAvailable());
		values.put(MetricName.ALPHA_ABSOLUTE, MetricValue.notAvailable());

		values.put(MetricName.PE_YIELD, peYield(pe.current));
		values.put(MetricName.GROWTH_RATE, compositeGrowth(trailing));
		values.put(MetricName.BOND_RATE, MetricValue.of(bondRate));

		return MetricSet.of(values, basis(valuations, trailing));
	}

	private MetricValue patm(List<TrailingFinancials> trailing) {
		if (trailing.isEmpty()) {
			return MetricValue.insufficientData();
		}
		TrailingFinancials latest = trailing.get(0);
		if (latest.pat() == null || isZero(latest.revenue())) {
			return MetricValue.undefined();
		}
		return MetricValue.of(latest.pat() / latest.revenue() * 100.0);
	}

	/**
	 * Growth of the latest quarterly revenue against the quarter {@code offset} records back.
	 */
	private MetricValue quarterGrowth(List<QuarterlyFinancials> quarters, int offset) {
		if (quarters.size() <= offset) {
			return MetricValue.insufficientData();
		}
		return growth(quarters.get(0).revenue(), quarters.get(offset).revenue());
	}

	private MetricValue cagr(List<TrailingFinancials> trailing, Function<TrailingFinancials, Double> field) {
		if (trailing.size() < CAGR_RECORDS) {
			return MetricValue.insufficientData();
		}
		Double end = field.apply(trailing.get(0));
		Double start = field.apply(trailing.get(CAGR_RECORDS - 1));
		if (start == null || end == null || start <= 0 || end <= 0) {
			return MetricValue.undefined();
		}
		return MetricValue.of(Math.pow(end / start, 1.0 / CAGR_YEARS) - 1.0);
	}

	/**
	 * Valuation divided by the trailing figure in force at each valuation date, most recent first.
	 */
	private List<Double> ratioHistory(List<ValuationPoint> valuations,
									  List<TrailingFinancials> trailing,
									  Function<TrailingFinancials, Double> denominator) {
		List<Double> ratios = new ArrayList<>();
		if (trailing.isEmpty()) {
			return ratios;
		}
		int limit = Math.min(RATIO_HISTORY, valuations.size());
		for (int i = 0; i < limit; i++) {
			ValuationPoint valuation = valuations.get(i);
			if (valuation.marketCap() == null) {
				continue;
			}
			TimeSeriesBundle.latestAtOrBefore(trailing, valuation.period())
					.map(denominator)
					.filter(value -> !isZero(value))
					.ifPresent(value -> ratios.add(valuation.marketCap() / value));
		}
		return ratios;
	}

	private RatioWindow ratioWindow(List<Double> ratios) {
		MetricValue current = ratios.isEmpty() ? MetricValue.insufficientData() : MetricValue.of(ratios.get(0));
		return new RatioWindow(current, average(ratios, TWO_YEAR_WINDOW), average(ratios, FIVE_YEAR_WINDOW));
	}

	/**
	 * Mean of exactly {@code window} ratios; shorter histories are not averaged.
	 */
	private MetricValue average(List<Double> ratios, int window) {
		if (ratios.size() < window) {
			return MetricValue.insufficientData();
		}
		double sum = 0.0;
		for (int i = 0; i < window; i++) {
			sum += ratios.get(i);
		}
		return MetricValue.of(sum / window);
	}

	private MetricValue revaluation(MetricValue average, MetricValue current) {
		if (!average.isOk()) {
			return average;
		}
		if (!current.isOk()) {
			return current;
		}
		if (average.value() == 0.0 || current.value() == 0.0) {
			return MetricValue.undefined();
		}
		return MetricValue.of((average.value() - current.value()) / current.value());
	}

	private MetricValue peYield(MetricValue currentPe) {
		if (!currentPe.isOk()) {
			return currentPe;
		}
		if (currentPe.value() == 0.0) {
			return MetricValue.undefined();
		}
		return MetricValue.of(1.0 / currentPe.value() * 100.0);
	}

	/**
	 * Mean of revenue and profit growth between the two latest trailing records; a side that cannot be
	 * computed counts as zero growth.
	 */
	private MetricValue compositeGrowth(List<TrailingFinancials> trailing) {
		if (trailing.size() < 2) {
			return MetricValue.insufficientData();
		}
		TrailingFinancials current = trailing.get(0);
		TrailingFinancials previous = trailing.get(1);
		double revenueGrowth = growth(current.revenue(), previous.revenue()).value();
		double patGrowth = growth(current.pat(), previous.pat()).value();
		return MetricValue.of((revenueGrowth + patGrowth) / 2.0);
	}

	private MetricValue growth(Double current, Double previous) {
		if (current == null || isZero(previous)) {
			return MetricValue.undefined();
		}
		return MetricValue.of((current - previous) / previous);
	}

	private FinancialBasis basis(List<ValuationPoint> valuations, List<TrailingFinancials> trailing) {
		double valuation = valuations.isEmpty() ? 0.0 : orZero(valuations.get(0).marketCap());
		double revenue = trailing.isEmpty() ? 0.0 : orZero(trailing.get(0).revenue());
		double profit = trailing.isEmpty() ? 0.0 : orZero(trailing.get(0).pat());
		return new FinancialBasis(valuation, revenue, profit);
	}

	private static boolean isZero(Double value) {
		return value == null || value == 0.0;
	}

	private static double orZero(Double value) {
		return value == null ? 0.0 : value;
	}

	private record RatioWindow(MetricValue current, MetricValue twoYearAverage, MetricValue fiveYearAverage) {
	}
}
