package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisResult;

/**
 * Receives each holding's result as soon as its run ends. Called from worker threads, possibly more than
 * once for the same holding when a run finishes right at the deadline; implementations must be
 * thread-safe and idempotent per holding key.
 */
@FunctionalInterface
public interface AnalysisProgressListener {
	AnalysisProgressListener NONE = result -> {
	};

	void holdingFinished(AnalysisResult result);

	/**
	 * Called once before any holding runs with the number of holdings actually dispatched.
	 */
	default void dispatchStarted(int holdingCount) {
	}
}
