package my.portfolioanalyst.app.service;

import jakarta.annotation.PreDestroy;
import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.dto.AnalysisJobResponseDto;
import my.portfolioanalyst.app.dto.AnalysisJobStatus;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs analyses in the background and tracks their per-holding progress. A job is kept for the
 * configured TTL after it ends; a job still unfinished when its TTL runs out is cancelled.
 * Cancelling interrupts the dispatch, so holdings still in flight end up {@code TIMED_OUT} in the
 * partial report.
 */
@Service
public class AnalysisJobService {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisJobService.class);

	private final PortfolioAnalysisService analysisService;
	private final Duration jobTtl;
	private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor = Executors.newCachedThreadPool();
	private final Semaphore runSlots;

	public AnalysisJobService(PortfolioAnalysisService analysisService, AnalysisSettings settings) {
		this.analysisService = analysisService;
		this.jobTtl = settings.jobTtl();
		this.runSlots = new Semaphore(settings.maxConcurrentJobs());
	}

	public AnalysisJobResponseDto start(AnalysisRequest request) {
		if (request == null || request.holdings().isEmpty()) {
			throw new IllegalArgumentException("At least one holding is required");
		}
		evictExpired();
		AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), request);
		FutureTask<Void> task = new FutureTask<>(() -> execute(job), null);
		job.task = task;
		jobs.put(job.id, job);
		executor.execute(task);
		logger.info("Queued analysis job {} for {} holding(s)", job.id, job.totalHoldings);
		return job.snapshot();
	}

	public AnalysisJobResponseDto get(String jobId) {
		evictExpired();
		return find(jobId).snapshot();
	}

	/**
	 * Cancels a pending or running job. Cancelling a job that already ended leaves it unchanged.
	 */
	public AnalysisJobResponseDto cancel(String jobId) {
		AnalysisJob job = find(jobId);
		if (job.cancel()) {
			logger.info("Cancelled analysis job {} after {} of {} holding(s)",
					job.id, job.finished.size(), job.totalHoldings);
		}
		return job.snapshot();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private AnalysisJob find(String jobId) {
		AnalysisJob job = jobId == null ? null : jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Analysis job not found");
		}
		return job;
	}

	private void execute(AnalysisJob job) {
		try {
			runSlots.acquire();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			if (job.status.get() != AnalysisJobStatus.CANCELLED) {
				job.fail(errorReference(job, ex));
			}
			return;
		}
		try {
			if (!job.status.compareAndSet(AnalysisJobStatus.PENDING, AnalysisJobStatus.RUNNING)) {
				return;
			}
			AnalysisReport report = analysisService.analyze(job.request, job);
			job.result = report;
			if (job.status.compareAndSet(AnalysisJobStatus.RUNNING, AnalysisJobStatus.DONE)) {
				job.finishedAt = Instant.now();
			}
		} catch (RuntimeException ex) {
			if (job.status.get() == AnalysisJobStatus.CANCELLED) {
				logger.info("Analysis job {} stopped after cancellation: {}", job.id, ex.getMessage());
			} else {
				job.fail(errorReference(job, ex));
			}
		} finally {
			runSlots.release();
		}
	}

	private void evictExpired() {
		Instant now = Instant.now();
		jobs.values().removeIf(job -> {
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			if (!base.plus(jobTtl).isBefore(now)) {
				return false;
			}
			if (job.cancel()) {
				logger.warn("Analysis job {} exceeded its TTL of {} and was cancelled ({} of {} holding(s) done)",
						job.id, jobTtl, job.finished.size(), job.totalHoldings);
			}
			return true;
		});
	}

	private String errorReference(AnalysisJob job, Exception ex) {
		String reference = "AN-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Analysis job failed (ref={}, jobId={}, holdings={}/{}, mode={}, error={})",
				reference, job.id, job.finished.size(), job.totalHoldings, job.request.mode(), ex.getMessage(), ex);
		return "Error ref " + reference;
	}

	private static final class AnalysisJob implements AnalysisProgressListener {
		private final String id;
		private final AnalysisRequest request;
		private final Instant createdAt = Instant.now();
		private final AtomicReference<AnalysisJobStatus> status = new AtomicReference<>(AnalysisJobStatus.PENDING);
		// holding key -> whether its run failed
		private final Map<String, Boolean> finished = new ConcurrentHashMap<>();

		private volatile int totalHoldings;
		private volatile FutureTask<Void> task;
		private volatile Instant finishedAt;
		private volatile AnalysisReport result;
		private volatile String error;

		private AnalysisJob(String id, AnalysisRequest request) {
			this.id = id;
			this.request = request;
			this.totalHoldings = request.holdings().size();
		}

		@Override
		public void dispatchStarted(int holdingCount) {
			totalHoldings = holdingCount;
		}

		@Override
		public void holdingFinished(AnalysisResult result) {
			finished.put(result.key(), result.isFailure());
		}

		private boolean cancel() {
			AnalysisJobStatus current = status.get();
			while (!current.isTerminal()) {
				if (status.compareAndSet(current, AnalysisJobStatus.CANCELLED)) {
					finishedAt = Instant.now();
					task.cancel(true);
					return true;
				}
				current = status.get();
			}
			return false;
		}

		private void fail(String reference) {
			if (status.compareAndSet(AnalysisJobStatus.RUNNING, AnalysisJobStatus.FAILED)
					|| status.compareAndSet(AnalysisJobStatus.PENDING, AnalysisJobStatus.FAILED)) {
				error = reference;
				finishedAt = Instant.now();
			}
		}

		private AnalysisJobResponseDto snapshot() {
			int failed = (int) finished.values().stream().filter(Boolean::booleanValue).count();
			return new AnalysisJobResponseDto(id, status.get(), totalHoldings, finished.size(), failed, result, error);
		}
	}
}
