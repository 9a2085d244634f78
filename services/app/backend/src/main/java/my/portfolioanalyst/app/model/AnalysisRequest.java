package my.portfolioanalyst.app.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One analysis run. {@code followUp} and {@code deliver} fall back to configuration when null;
 * a null deadline uses the configured default. A non-empty {@code previousHoldings} snapshot narrows
 * the run to holdings whose price moved at least {@code minVariationPercent} against it.
 */
public record AnalysisRequest(
		List<Holding> holdings,
		DispatchMode mode,
		Map<String, String> facts,
		Boolean followUp,
		Boolean deliver,
		Duration deadline,
		List<Holding> previousHoldings,
		BigDecimal minVariationPercent
) {
	public AnalysisRequest {
		holdings = holdings == null ? List.of() : holdings;
		mode = mode == null ? DispatchMode.PER_ENTITY : mode;
		facts = facts == null ? Map.of() : facts;
		previousHoldings = previousHoldings == null ? List.of() : previousHoldings;
	}

	public AnalysisRequest(List<Holding> holdings, DispatchMode mode, Map<String, String> facts,
						   Boolean followUp, Boolean deliver, Duration deadline) {
		this(holdings, mode, facts, followUp, deliver, deadline, List.of(), null);
	}

	public static AnalysisRequest of(List<Holding> holdings, DispatchMode mode) {
		return new AnalysisRequest(holdings, mode, Map.of(), null, null, null);
	}

	public boolean filtersByPriceMovement() {
		return !previousHoldings.isEmpty();
	}
}
