package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.Fund;
import my.fundmetrics.app.domain.FundHolding;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.model.HoldingMetrics;
import my.fundmetrics.app.model.MetricOutcome;
import my.fundmetrics.app.model.MetricRecord;
import my.fundmetrics.app.model.MetricSet;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PeriodicRecord;
import my.fundmetrics.app.model.PortfolioMetricSet;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.repository.FundHoldingRepository;
import my.fundmetrics.app.repository.FundRepository;
import my.fundmetrics.app.repository.StockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.BooleanSupplier;

/**
 * Runs the metric pipeline for a fund: one bulk cache load, data-parallel per-stock computation,
 * weighted aggregation and one persistence cycle. Stocks are isolated from each other's failures;
 * batches over several funds can be cancelled between funds.
 */
@Service
public class MetricsCalculationService {
	private static final Logger logger = LoggerFactory.getLogger(MetricsCalculationService.class);

	private final FundRepository fundRepository;
	private final FundHoldingRepository holdingRepository;
	private final StockRepository stockRepository;
	private final TimeSeriesCacheLoader cacheLoader;
	private final MetricsCalculator calculator;
	private final WeightedPortfolioAggregator aggregator;
	private final MetricsPersistenceService persistenceService;
	private final ExecutorService workerPool;
	private final int periodLimit;

	public MetricsCalculationService(FundRepository fundRepository,
									 FundHoldingRepository holdingRepository,
									 StockRepository stockRepository,
									 TimeSeriesCacheLoader cacheLoader,
									 MetricsCalculator calculator,
									 WeightedPortfolioAggregator aggregator,
									 MetricsPersistenceService persistenceService,
									 @Qualifier("metricsWorkerPool") ExecutorService workerPool,
									 AppProperties properties) {
		this.fundRepository = fundRepository;
		this.holdingRepository = holdingRepository;
		this.stockRepository = stockRepository;
		this.cacheLoader = cacheLoader;
		this.calculator = calculator;
		this.aggregator = aggregator;
		this.persistenceService = persistenceService;
		this.workerPool = workerPool;
		this.periodLimit = properties.metrics().periodLimit();
	}

	public FundCalculationResult calculateFund(Long fundId, ProgressListener listener) {
		Fund fund = fundRepository.findById(fundId)
				.orElseThrow(() -> new IllegalArgumentException("Fund not found: " + fundId));
		return calculateFund(fund, listener);
	}

	/**
	 * Calculates every active fund in name order. Cancellation is checked before each fund; a fund that
	 * fails is recorded on its result and the batch moves on.
	 */
	public BatchCalculationResult calculateAll(ProgressListener listener, BooleanSupplier cancelRequested) {
		ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
		List<Fund> funds = fundRepository.findByActiveTrueOrderByNameAsc();
		List<FundCalculationResult> results = new ArrayList<>();
		boolean cancelled = false;
		for (int i = 0; i < funds.size(); i++) {
			Fund fund = funds.get(i);
			if (cancelRequested != null && cancelRequested.getAsBoolean()) {
				cancelled = true;
				logger.info("Metric batch cancelled after {} of {} funds", i, funds.size());
				progress.onProgress(new ProgressUpdate(ProgressUpdate.Level.FUND, fund.getName(), i, funds.size(),
						null, ProgressUpdate.STATUS_CANCELLED));
				break;
			}
			progress.onProgress(new ProgressUpdate(ProgressUpdate.Level.FUND, fund.getName(), i, funds.size(), null,
					ProgressUpdate.STATUS_RUNNING));
			FundCalculationResult result;
			FundRun run = null;
			try {
				run = computeFund(fund, progress);
				result = persist(fund, run);
			} catch (MetricsPersistenceException ex) {
				logger.warn("Fund {} was not stored: {}", fund.getFundCode(), ex.getMessage());
				result = run.result().withError(ex.getMessage());
			} catch (RuntimeException ex) {
				String error = "Error ref " + reference(fund, ex);
				result = run == null
						? new FundCalculationResult(fund.getFundId(), fund.getName(), 0, 0, 0, 0, 0, null, error)
						: run.result().withError(error);
			}
			results.add(result);
			progress.onProgress(new ProgressUpdate(ProgressUpdate.Level.FUND, fund.getName(), i + 1, funds.size(),
					null, result.persisted() ? ProgressUpdate.STATUS_COMPLETED : ProgressUpdate.STATUS_FAILED));
		}
		BatchCalculationResult batch = new BatchCalculationResult(results, funds.size(), cancelled);
		logger.info("Metric batch finished: {} funds, {} entities ok, {} partial, {} failed, {} funds not stored",
				results.size(), batch.succeeded(), batch.partial(), batch.failed(), batch.failedFunds());
		return batch;
	}

	FundCalculationResult calculateFund(Fund fund, ProgressListener listener) {
		ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
		return persist(fund, computeFund(fund, progress));
	}

	private FundCalculationResult persist(Fund fund, FundRun run) {
		persistenceService.persistMetrics(fund.getFundId(), run.records());
		persistenceService.persistSummary(fund.getFundId(), run.result().portfolio());
		logger.info("Fund {}: {} holdings ({} ok, {} partial, {} failed), {} metric records stored",
				fund.getFundCode(), run.result().holdings(), run.result().succeeded(), run.result().partial(),
				run.result().failed(), run.records().size());
		return run.result();
	}

	private FundRun computeFund(Fund fund, ProgressListener progress) {
		List<FundHolding> holdings = holdingRepository.findByFundId(fund.getFundId());
		List<Long> stockIds = holdings.stream().map(FundHolding::getStockId).distinct().toList();
		Map<Long, String> names = new HashMap<>();
		if (!stockIds.isEmpty()) {
			for (Stock stock : stockRepository.findAllById(stockIds)) {
				names.put(stock.getStockId(), stock.getCompanyName());
			}
		}
		Map<Long, TimeSeriesBundle> bundles = cacheLoader.load(stockIds);

		Map<Long, CompletableFuture<StockResult>> futures = new LinkedHashMap<>();
		for (Long stockId : stockIds) {
			String name = names.getOrDefault(stockId, "stock " + stockId);
			TimeSeriesBundle bundle = bundles.getOrDefault(stockId, TimeSeriesBundle.empty(stockId));
			futures.put(stockId, CompletableFuture.supplyAsync(() -> computeStock(stockId, name, bundle), workerPool));
		}

		Map<Long, StockResult> results = new LinkedHashMap<>();
		int processed = 0;
		for (Map.Entry<Long, CompletableFuture<StockResult>> entry : futures.entrySet()) {
			Long stockId = entry.getKey();
			String name = names.getOrDefault(stockId, "stock " + stockId);
			StockResult result;
			try {
				result = entry.getValue().join();
			} catch (CompletionException ex) {
				logger.error("Metric calculation failed for {} in fund {}", name, fund.getFundCode(), ex.getCause());
				result = StockResult.failed();
			}
			results.put(stockId, result);
			processed += 1;
			progress.onProgress(new ProgressUpdate(ProgressUpdate.Level.ENTITY, fund.getName(), processed,
					stockIds.size(), name, ProgressUpdate.STATUS_RUNNING));
		}

		List<MetricRecord> records = new ArrayList<>();
		List<HoldingMetrics> holdingMetrics = new ArrayList<>();
		int succeeded = 0;
		int partial = 0;
		int failed = 0;
		for (Map.Entry<Long, StockResult> entry : results.entrySet()) {
			StockResult result = entry.getValue();
			records.addAll(result.records());
			switch (result.outcome()) {
				case COMPLETE -> succeeded += 1;
				case PARTIAL, NO_DATA -> partial += 1;
				case FAILED -> failed += 1;
			}
		}
		boolean byMarketValue = holdings.stream().anyMatch(holding -> isPositive(holding.getMarketValue()));
		if (!byMarketValue && !holdings.isEmpty()) {
			logger.warn("Fund {} has no market values; weighting holdings by holding percentage", fund.getFundCode());
		}
		for (FundHolding holding : holdings) {
			StockResult result = results.get(holding.getStockId());
			holdingMetrics.add(new HoldingMetrics(holding.getStockId(),
					names.getOrDefault(holding.getStockId(), "stock " + holding.getStockId()),
					byMarketValue ? holding.getMarketValue() : holding.getHoldingPercentage(),
					result == null ? MetricSet.failed() : result.latest()));
		}
		PortfolioMetricSet portfolio = aggregator.aggregate(holdingMetrics);

		progress.onProgress(new ProgressUpdate(ProgressUpdate.Level.ENTITY, fund.getName(), processed,
				stockIds.size(), null, ProgressUpdate.STATUS_COMPLETED));
		return new FundRun(new FundCalculationResult(fund.getFundId(), fund.getName(), holdings.size(), succeeded,
				partial, failed, records.size(), portfolio, null), records);
	}

	/**
	 * Metric sets for each trailing and quarterly period of one stock, most recent first. The stock's
	 * outcome is that of its latest set, unless any set failed.
	 */
	StockResult computeStock(Long stockId, String name, TimeSeriesBundle bundle) {
		try {
			List<MetricRecord> records = new ArrayList<>();
			for (PeriodKey period : limit(periodsOf(bundle.trailing()))) {
				records.add(new MetricRecord(stockId, period, MetricRecord.TYPE_TTM,
						calculator.compute(name, period, bundle)));
			}
			for (PeriodKey period : limit(periodsOf(bundle.quarterly()))) {
				records.add(new MetricRecord(stockId, period, MetricRecord.TYPE_QUARTERLY,
						calculator.compute(name, period, bundle)));
			}
			MetricSet latest = records.isEmpty()
					? calculator.compute(name, null, bundle)
					: records.get(0).metrics();
			boolean anyFailed = records.stream()
					.anyMatch(record -> record.metrics().outcome() == MetricOutcome.FAILED);
			return new StockResult(records, latest, anyFailed ? MetricOutcome.FAILED : latest.outcome());
		} catch (RuntimeException ex) {
			logger.error("Metric calculation failed for {}; defaulting to zero", name, ex);
			return StockResult.failed();
		}
	}

	private static boolean isPositive(BigDecimal value) {
		return value != null && value.signum() > 0;
	}

	private static <T extends PeriodicRecord> List<PeriodKey> periodsOf(List<T> records) {
		return records.stream().map(PeriodicRecord::period).distinct().toList();
	}

	private List<PeriodKey> limit(List<PeriodKey> periods) {
		if (periodLimit <= 0 || periods.size() <= periodLimit) {
			return periods;
		}
		return periods.subList(0, periodLimit);
	}

	private String reference(Fund fund, Exception ex) {
		String reference = "MC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Metric calculation failed (ref={}, fundId={}, error={})", reference, fund.getFundId(),
				ex.getMessage(), ex);
		return reference;
	}

	private record FundRun(FundCalculationResult result, List<MetricRecord> records) {
	}

	record StockResult(List<MetricRecord> records, MetricSet latest, MetricOutcome outcome) {
		static StockResult failed() {
			return new StockResult(List.of(), MetricSet.failed(), MetricOutcome.FAILED);
		}
	}
}
