package my.portfolioanalyst.app.service;

/**
 * Raised when per-entity results cannot be combined into one report, e.g. two results for the same holding key.
 */
public class AnalysisAggregationException extends IllegalStateException {
	public AnalysisAggregationException(String message) {
		super(message);
	}
}
