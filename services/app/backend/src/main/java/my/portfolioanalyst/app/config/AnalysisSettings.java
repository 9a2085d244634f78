package my.portfolioanalyst.app.config;

import java.time.Duration;

/**
 * Immutable pipeline configuration handed to the analysis components at construction.
 * A zero {@code deadline} means dispatches wait until every entity reaches a terminal state.
 */
public record AnalysisSettings(
		int maxRetries,
		double confidenceThreshold,
		int workerPoolSize,
		Duration deadline,
		int maxHoldings,
		double temperature,
		boolean followUpEnabled,
		int followUpMaxRetries,
		int maxPreviousOutputChars,
		Duration jobTtl,
		int maxConcurrentJobs
) {
	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
	public static final int DEFAULT_WORKER_POOL_SIZE = 5;
	public static final int DEFAULT_MAX_HOLDINGS = 200;
	public static final double DEFAULT_TEMPERATURE = 0.5;
	public static final int DEFAULT_FOLLOW_UP_MAX_RETRIES = 2;
	public static final int DEFAULT_MAX_PREVIOUS_OUTPUT_CHARS = 4000;
	public static final Duration DEFAULT_JOB_TTL = Duration.ofMinutes(60);
	public static final int DEFAULT_MAX_CONCURRENT_JOBS = 1;

	public AnalysisSettings {
		maxRetries = Math.max(1, maxRetries);
		confidenceThreshold = Math.min(1.0, Math.max(0.0, confidenceThreshold));
		workerPoolSize = Math.max(1, workerPoolSize);
		deadline = deadline == null || deadline.isNegative() ? Duration.ZERO : deadline;
		maxHoldings = Math.max(1, maxHoldings);
		followUpMaxRetries = Math.max(1, followUpMaxRetries);
		maxPreviousOutputChars = Math.max(200, maxPreviousOutputChars);
		jobTtl = jobTtl == null || jobTtl.isNegative() || jobTtl.isZero() ? DEFAULT_JOB_TTL : jobTtl;
		maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
	}

	public static AnalysisSettings defaults() {
		return new AnalysisSettings(
				DEFAULT_MAX_RETRIES,
				DEFAULT_CONFIDENCE_THRESHOLD,
				DEFAULT_WORKER_POOL_SIZE,
				Duration.ZERO,
				DEFAULT_MAX_HOLDINGS,
				DEFAULT_TEMPERATURE,
				false,
				DEFAULT_FOLLOW_UP_MAX_RETRIES,
				DEFAULT_MAX_PREVIOUS_OUTPUT_CHARS,
				DEFAULT_JOB_TTL,
				DEFAULT_MAX_CONCURRENT_JOBS
		);
	}

	public boolean hasDeadline() {
		return !deadline.isZero();
	}

	public AnalysisSettings withMaxRetries(int value) {
		return new AnalysisSettings(value, confidenceThreshold, workerPoolSize, deadline, maxHoldings, temperature,
				followUpEnabled, followUpMaxRetries, maxPreviousOutputChars, jobTtl, maxConcurrentJobs);
	}

	public AnalysisSettings withDeadline(Duration value) {
		return new AnalysisSettings(maxRetries, confidenceThreshold, workerPoolSize, value, maxHoldings, temperature,
				followUpEnabled, followUpMaxRetries, maxPreviousOutputChars, jobTtl, maxConcurrentJobs);
	}

	public AnalysisSettings withWorkerPoolSize(int value) {
		return new AnalysisSettings(maxRetries, confidenceThreshold, value, deadline, maxHoldings, temperature,
				followUpEnabled, followUpMaxRetries, maxPreviousOutputChars, jobTtl, maxConcurrentJobs);
	}

	public AnalysisSettings withMaxHoldings(int value) {
		return new AnalysisSettings(maxRetries, confidenceThreshold, workerPoolSize, deadline, value, temperature,
				followUpEnabled, followUpMaxRetries, maxPreviousOutputChars, jobTtl, maxConcurrentJobs);
	}

	public AnalysisSettings withJobTtl(Duration value) {
		return new AnalysisSettings(maxRetries, confidenceThreshold, workerPoolSize, deadline, maxHoldings, temperature,
				followUpEnabled, followUpMaxRetries, maxPreviousOutputChars, value, maxConcurrentJobs);
	}
}
