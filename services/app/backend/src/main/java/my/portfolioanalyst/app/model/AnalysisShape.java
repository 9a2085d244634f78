package my.portfolioanalyst.app.model;

/**
 * Required-field contract an LLM payload is validated against.
 */
public enum AnalysisShape {
	/** Whole-portfolio analysis: an {@code analyses} array with one entry per holding. */
	SINGLE,
	/** One holding: recommendation, confidence, risk notes and sources. */
	PER_HOLDING
}
