package my.fundmetrics.app.service;

import jakarta.annotation.PreDestroy;
import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.MetricsCalculationSession;
import my.fundmetrics.app.dto.MetricsJobResponseDto;
import my.fundmetrics.app.dto.MetricsJobStatus;
import my.fundmetrics.app.repository.MetricsCalculationSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Runs metric calculations in the background. Progress is kept in memory and mirrored to
 * {@code metrics_calculation_sessions}; finished jobs are forgotten after the configured TTL.
 */
@Service
public class MetricsJobService {
	private static final Logger logger = LoggerFactory.getLogger(MetricsJobService.class);
	private static final int ENTITY_PROGRESS_INTERVAL = 25;

	private final MetricsCalculationService calculationService;
	private final MetricsCalculationSessionRepository sessionRepository;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor;
	private final Semaphore concurrency;
	private final Duration jobTtl;

	public MetricsJobService(MetricsCalculationService calculationService,
							 MetricsCalculationSessionRepository sessionRepository,
							 AppProperties properties) {
		this.calculationService = calculationService;
		this.sessionRepository = sessionRepository;
		int maxConcurrentJobs = Math.max(1, properties.metrics().maxConcurrentJobs());
		this.executor = Executors.newFixedThreadPool(maxConcurrentJobs);
		this.concurrency = new Semaphore(maxConcurrentJobs);
		this.jobTtl = Duration.ofMinutes(properties.metrics().jobTtlMinutes());
	}

	/**
	 * @param fundId a single fund, or {@code null} for every active fund
	 */
	public MetricsJobResponseDto start(Long fundId) {
		cleanupExpired();
		String sessionId = UUID.randomUUID().toString();
		JobState job = new JobState(sessionId, fundId, Instant.now());
		jobs.put(sessionId, job);
		save(job);
		executor.submit(() -> runJob(sessionId));
		return toDto(job);
	}

	public MetricsJobResponseDto get(String sessionId) {
		cleanupExpired();
		JobState job = jobs.get(sessionId);
		if (job != null) {
			return toDto(job);
		}
		return sessionRepository.findById(sessionId)
				.map(this::toDto)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Metrics job not found"));
	}

	/**
	 * Requests cancellation. A running batch stops before its next fund; the fund in progress completes.
	 */
	public MetricsJobResponseDto cancel(String sessionId) {
		JobState job = jobs.get(sessionId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Metrics job not found");
		}
		job.cancelRequested = true;
		if (job.status == MetricsJobStatus.PENDING) {
			job.status = MetricsJobStatus.CANCELLED;
			job.finishedAt = Instant.now();
			save(job);
		}
		logger.info("Cancellation requested for metrics job {}", sessionId);
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String sessionId) {
		JobState job = jobs.get(sessionId);
		if (job == null || job.status == MetricsJobStatus.CANCELLED) {
			return;
		}
		try {
			concurrency.acquire();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			job.status = MetricsJobStatus.FAILED;
			job.error = failWithReference(job, ex);
			job.finishedAt = Instant.now();
			save(job);
			return;
		}
		try {
			job.status = MetricsJobStatus.RUNNING;
			save(job);
			if (job.fundId != null) {
				job.totalFunds = 1;
				FundCalculationResult result = calculationService.calculateFund(job.fundId,
						update -> onProgress(job, update));
				job.processedFunds = 1;
				record(job, result);
				job.status = MetricsJobStatus.DONE;
			} else {
				BatchCalculationResult result = calculationService.calculateAll(update -> onProgress(job, update),
						() -> job.cancelRequested);
				job.totalFunds = result.totalFunds();
				job.processedFunds = result.funds().size();
				result.funds().forEach(fund -> record(job, fund));
				job.status = result.cancelled() ? MetricsJobStatus.CANCELLED : MetricsJobStatus.DONE;
				if (result.failedFunds() > 0) {
					job.error = result.failedFunds() + " fund(s) could not be stored";
				}
			}
			job.progress = 100.0;
		} catch (Exception ex) {
			job.status = MetricsJobStatus.FAILED;
			job.error = failWithReference(job, ex);
		} finally {
			job.finishedAt = Instant.now();
			job.currentStockName = null;
			save(job);
			concurrency.release();
		}
	}

	private void onProgress(JobState job, ProgressUpdate update) {
		if (update.level() == ProgressUpdate.Level.FUND) {
			job.totalFunds = update.totalCount();
			job.processedFunds = update.processedCount();
			job.currentFundName = update.fundName();
			job.progress = update.percentage();
			save(job);
			return;
		}
		job.currentFundName = update.fundName();
		job.currentStockName = update.currentEntityName();
		if (job.fundId != null) {
			job.progress = update.percentage();
		}
		if (update.processedCount() % ENTITY_PROGRESS_INTERVAL == 0
				|| update.processedCount() == update.totalCount()) {
			save(job);
		}
	}

	private void record(JobState job, FundCalculationResult result) {
		job.succeeded += result.succeeded();
		job.partial += result.partial();
		job.failed += result.failed();
	}

	private void save(JobState job) {
		try {
			MetricsCalculationSession session = new MetricsCalculationSession();
			session.setSessionId(job.sessionId);
			session.setStatus(job.status.name());
			session.setFundId(job.fundId);
			session.setTotalFunds(job.totalFunds);
			session.setProcessedFunds(job.processedFunds);
			session.setCurrentFundName(job.currentFundName);
			session.setCurrentStockName(job.currentStockName);
			session.setProgressPercentage(job.progress);
			session.setSucceededEntities(job.succeeded);
			session.setPartialEntities(job.partial);
			session.setFailedEntities(job.failed);
			session.setErrorMessage(job.error);
			session.setStartedAt(LocalDateTime.ofInstant(job.createdAt, ZoneId.systemDefault()));
			session.setCompletedAt(job.finishedAt == null ? null
					: LocalDateTime.ofInstant(job.finishedAt, ZoneId.systemDefault()));
			sessionRepository.save(session);
		} catch (RuntimeException ex) {
			logger.warn("Failed to store progress of metrics job {}: {}", job.sessionId, ex.getMessage());
		}
	}

	private MetricsJobResponseDto toDto(JobState job) {
		return new MetricsJobResponseDto(
				job.sessionId,
				job.status,
				job.fundId,
				job.totalFunds,
				job.processedFunds,
				job.currentFundName,
				job.currentStockName,
				job.progress,
				job.succeeded,
				job.partial,
				job.failed,
				job.error
		);
	}

	private MetricsJobResponseDto toDto(MetricsCalculationSession session) {
		return new MetricsJobResponseDto(
				session.getSessionId(),
				MetricsJobStatus.valueOf(session.getStatus()),
				session.getFundId(),
				orZero(session.getTotalFunds()),
				orZero(session.getProcessedFunds()),
				session.getCurrentFundName(),
				session.getCurrentStockName(),
				session.getProgressPercentage() == null ? 0.0 : session.getProgressPercentage(),
				orZero(session.getSucceededEntities()),
				orZero(session.getPartialEntities()),
				orZero(session.getFailedEntities()),
				session.getErrorMessage()
		);
	}

	private static int orZero(Integer value) {
		return value == null ? 0 : value;
	}

	private void cleanupExpired() {
		Instant now = Instant.now();
		jobs.entrySet().removeIf(entry -> {
			Instant finishedAt = entry.getValue().finishedAt;
			return finishedAt != null && finishedAt.plus(jobTtl).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String message = ex == null ? null : ex.getMessage();
		String reference = "MC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Metrics job failed (ref={}, sessionId={}, fundId={}, error={})",
				reference, job.sessionId, job.fundId, message, ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String sessionId;
		private final Long fundId;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile MetricsJobStatus status;
		private volatile boolean cancelRequested;
		private volatile int totalFunds;
		private volatile int processedFunds;
		private volatile String currentFundName;
		private volatile String currentStockName;
		private volatile double progress;
		private volatile int succeeded;
		private volatile int partial;
		private volatile int failed;
		private volatile String error;

		private JobState(String sessionId, Long fundId, Instant createdAt) {
			this.sessionId = sessionId;
			this.fundId = fundId;
			this.createdAt = createdAt;
			this.status = MetricsJobStatus.PENDING;
		}
	}
}
