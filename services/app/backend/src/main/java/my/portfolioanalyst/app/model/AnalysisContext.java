package my.portfolioanalyst.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one prompt: either the whole portfolio or a single focus holding, plus auxiliary facts
 * such as market indices.
 */
public record AnalysisContext(
		List<Holding> holdings,
		Holding focus,
		Map<String, String> facts
) {
	public AnalysisContext {
		holdings = holdings == null ? List.of() : List.copyOf(holdings);
		facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
	}

	public static AnalysisContext portfolio(List<Holding> holdings, Map<String, String> facts) {
		return new AnalysisContext(holdings, null, facts);
	}

	public static AnalysisContext holding(Holding holding, Map<String, String> facts) {
		if (holding == null) {
			throw new IllegalArgumentException("Holding is required");
		}
		return new AnalysisContext(List.of(holding), holding, facts);
	}

	public boolean isPortfolio() {
		return focus == null;
	}

	public AnalysisShape shape() {
		return isPortfolio() ? AnalysisShape.SINGLE : AnalysisShape.PER_HOLDING;
	}

	public String label() {
		return isPortfolio() ? "portfolio(" + holdings.size() + " holdings)" : focus.key();
	}

	/**
	 * Identifiers a portfolio answer must name, one per holding: {@code EXCHANGE:SYMBOL}, or the bare symbol
	 * for holdings without exchange.
	 */
	public List<String> expectedKeys() {
		return holdings.stream().map(Holding::key).toList();
	}
}
