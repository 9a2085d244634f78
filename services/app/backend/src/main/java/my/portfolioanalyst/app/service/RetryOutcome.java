package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.AnalysisStatus;
import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.model.RetryState;
import my.portfolioanalyst.app.model.ValidatedAnalysis;
import my.portfolioanalyst.app.model.ValidationOutcome;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Terminal result of one {@link RetryController} run, before it is split into per-holding results.
 */
public record RetryOutcome(
		AnalysisStatus status,
		RetryState finalState,
		int attempts,
		ValidationOutcome lastOutcome,
		String error
) {
	public static RetryOutcome accepted(int attempts, ValidationOutcome outcome) {
		return new RetryOutcome(AnalysisStatus.ACCEPTED, RetryState.ACCEPTED, attempts, outcome, null);
	}

	public static RetryOutcome exhausted(int attempts, ValidationOutcome lastOutcome) {
		return new RetryOutcome(AnalysisStatus.EXHAUSTED, RetryState.EXHAUSTED, attempts, lastOutcome, null);
	}

	public static RetryOutcome invocationFailed(RetryState state, int attempts, ValidationOutcome lastOutcome, String error) {
		return new RetryOutcome(AnalysisStatus.LLM_ERROR, state, attempts, lastOutcome, error);
	}

	public static RetryOutcome timedOut(RetryState state, int attempts, ValidationOutcome lastOutcome) {
		return new RetryOutcome(AnalysisStatus.TIMED_OUT, state, attempts, lastOutcome, null);
	}

	/**
	 * One result per holding of the context, in context order. Portfolio analyses are matched to
	 * holdings by holding key, ignoring case.
	 */
	public List<AnalysisResult> results(AnalysisContext context) {
		List<AnalysisResult> results = new ArrayList<>(context.holdings().size());
		if (status == AnalysisStatus.ACCEPTED) {
			Map<String, ValidatedAnalysis> byKey = new HashMap<>();
			for (ValidatedAnalysis analysis : lastOutcome.analyses()) {
				String key = analysis.symbol() == null ? null : analysis.symbol().toUpperCase(Locale.ROOT);
				byKey.putIfAbsent(key, analysis);
			}
			for (Holding holding : context.holdings()) {
				ValidatedAnalysis analysis = context.isPortfolio()
						? byKey.get(holding.key().toUpperCase(Locale.ROOT))
						: lastOutcome.analyses().get(0);
				if (analysis == null) {
					results.add(AnalysisResult.exhausted(holding, attempts, lastOutcome));
				} else {
					results.add(AnalysisResult.accepted(holding, analysis, attempts, lastOutcome));
				}
			}
			return results;
		}
		for (Holding holding : context.holdings()) {
			results.add(switch (status) {
				case EXHAUSTED -> AnalysisResult.exhausted(holding, attempts, lastOutcome);
				case LLM_ERROR -> AnalysisResult.invocationFailed(holding, attempts, error);
				default -> AnalysisResult.timedOut(holding, attempts);
			});
		}
		return results;
	}
}
