package my.portfolioanalyst.app.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Normalized per-holding analysis produced by a passing validation. {@code symbol} is only set for
 * entries of a whole-portfolio payload.
 */
public record ValidatedAnalysis(
		String symbol,
		Recommendation recommendation,
		BigDecimal estimatedReturn,
		double confidence,
		String riskNotes,
		List<String> sources,
		String followUpQuestion
) {
	public ValidatedAnalysis {
		sources = sources == null ? List.of() : List.copyOf(sources);
	}
}
