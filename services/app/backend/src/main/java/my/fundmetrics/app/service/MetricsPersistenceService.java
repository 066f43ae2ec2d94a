package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.FundMetricsSummary;
import my.fundmetrics.app.model.MetricRecord;
import my.fundmetrics.app.model.PortfolioMetricSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes metric writes per fund and retries a conflicting write cycle once before giving up.
 */
@Service
public class MetricsPersistenceService {
	private static final Logger logger = LoggerFactory.getLogger(MetricsPersistenceService.class);
	private static final int MAX_ATTEMPTS = 2;

	private final MetricsPersistenceWriter writer;
	private final Map<Long, ReentrantLock> fundLocks = new ConcurrentHashMap<>();

	public MetricsPersistenceService(MetricsPersistenceWriter writer) {
		this.writer = writer;
	}

	public MetricsPersistenceWriter.UpsertResult persistMetrics(Long fundId, List<MetricRecord> records) {
		return withFundLock(fundId, "metric records", () -> writer.upsert(fundId, records));
	}

	public FundMetricsSummary persistSummary(Long fundId, PortfolioMetricSet portfolio) {
		return withFundLock(fundId, "fund summary", () -> writer.replaceSummary(fundId, portfolio));
	}

	private <T> T withFundLock(Long fundId, String what, Supplier<T> write) {
		ReentrantLock lock = fundLocks.computeIfAbsent(fundId, id -> new ReentrantLock());
		lock.lock();
		try {
			return withRetry(fundId, what, write);
		} finally {
			lock.unlock();
		}
	}

	private <T> T withRetry(Long fundId, String what, Supplier<T> write) {
		DataAccessException lastFailure = null;
		for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
			try {
				return write.get();
			} catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
				lastFailure = ex;
				if (attempt < MAX_ATTEMPTS) {
					logger.warn("Conflict writing {} for fund {}; retrying: {}", what, fundId, ex.getMessage());
				}
			}
		}
		throw new MetricsPersistenceException(fundId,
				"Failed to write " + what + " for fund " + fundId + " after " + MAX_ATTEMPTS + " attempts",
				lastFailure);
	}
}
