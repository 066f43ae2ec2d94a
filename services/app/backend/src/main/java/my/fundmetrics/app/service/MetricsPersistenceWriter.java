package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.FundMetricsSummary;
import my.fundmetrics.app.domain.MetricColumns;
import my.fundmetrics.app.domain.StockMetricsLog;
import my.fundmetrics.app.model.MetricRecord;
import my.fundmetrics.app.model.PortfolioMetricSet;
import my.fundmetrics.app.repository.FundMetricsSummaryRepository;
import my.fundmetrics.app.repository.StockMetricsLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One read-then-split upsert cycle per call. Each method runs in its own transaction so a conflict rolls
 * back the whole cycle and can be retried.
 */
@Service
public class MetricsPersistenceWriter {
	private final StockMetricsLogRepository metricsLogRepository;
	private final FundMetricsSummaryRepository summaryRepository;

	public MetricsPersistenceWriter(StockMetricsLogRepository metricsLogRepository,
									FundMetricsSummaryRepository summaryRepository) {
		this.metricsLogRepository = metricsLogRepository;
		this.summaryRepository = summaryRepository;
	}

	@Transactional
	public UpsertResult upsert(Long fundId, List<MetricRecord> records) {
		if (records == null || records.isEmpty()) {
			return new UpsertResult(0, 0);
		}
		Map<String, MetricRecord> batch = new LinkedHashMap<>();
		Set<Long> stockIds = new LinkedHashSet<>();
		for (MetricRecord record : records) {
			batch.put(key(record.stockId(), record.period().label(), record.periodType()), record);
			stockIds.add(record.stockId());
		}

		Map<String, StockMetricsLog> existing = new HashMap<>();
		for (StockMetricsLog row : metricsLogRepository.findByFundIdAndStockIdIn(fundId, stockIds)) {
			existing.put(key(row.getStockId(), row.getPeriodKey(), row.getPeriodType()), row);
		}

		LocalDateTime now = LocalDateTime.now();
		List<StockMetricsLog> toSave = new ArrayList<>();
		int inserted = 0;
		int updated = 0;
		for (Map.Entry<String, MetricRecord> entry : batch.entrySet()) {
			MetricRecord record = entry.getValue();
			StockMetricsLog row = existing.get(entry.getKey());
			if (row == null) {
				row = new StockMetricsLog();
				row.setFundId(fundId);
				row.setStockId(record.stockId());
				row.setPeriodKey(record.period().label());
				row.setPeriodType(record.periodType());
				inserted++;
			} else {
				updated++;
			}
			row.setMetrics(MetricColumns.from(record.metrics().asDoubles()));
			row.setOutcome(record.metrics().outcome().name());
			row.setCalculatedAt(now);
			toSave.add(row);
		}
		metricsLogRepository.saveAll(toSave);
		return new UpsertResult(inserted, updated);
	}

	@Transactional
	public FundMetricsSummary replaceSummary(Long fundId, PortfolioMetricSet portfolio) {
		FundMetricsSummary summary = summaryRepository.findById(fundId).orElseGet(() -> {
			FundMetricsSummary created = new FundMetricsSummary();
			created.setFundId(fundId);
			return created;
		});
		summary.setMetrics(MetricColumns.from(portfolio.values()));
		summary.setWeightedValuation(portfolio.weightedTotals().valuation());
		summary.setWeightedRevenue(portfolio.weightedTotals().trailingRevenue());
		summary.setWeightedProfit(portfolio.weightedTotals().trailingProfit());
		summary.setHoldingsCount(portfolio.holdingsCount());
		summary.setContributingHoldings(portfolio.contributingHoldings());
		summary.setLastUpdated(LocalDateTime.ofInstant(portfolio.lastUpdated(), ZoneId.systemDefault()));
		return summaryRepository.save(summary);
	}

	private static String key(Long stockId, String periodKey, String periodType) {
		return stockId + "|" + periodKey + "|" + periodType;
	}

	public record UpsertResult(int inserted, int updated) {
		public int total() {
			return inserted + updated;
		}
	}
}
