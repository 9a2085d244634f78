package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.DispatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class Aggregator {
	private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);
	static final String UNSPECIFIED_SECTOR = "UNSPECIFIED";

	private final double confidenceThreshold;
	private final Clock clock;

	@Autowired
	public Aggregator(AnalysisSettings settings) {
		this(settings, Clock.systemUTC());
	}

	Aggregator(AnalysisSettings settings, Clock clock) {
		this.confidenceThreshold = settings.confidenceThreshold();
		this.clock = clock;
	}

	public AnalysisReport combine(List<AnalysisResult> results) {
		return combine(DispatchMode.PER_ENTITY, results);
	}

	/**
	 * Folds per-entity results into one report. Overall confidence is the mean over accepted results
	 * only; failed entities are kept with their diagnostics and force a follow-up.
	 *
	 * @throws AnalysisAggregationException when two results share a holding key
	 */
	public AnalysisReport combine(DispatchMode mode, List<AnalysisResult> results) {
		Map<String, AnalysisResult> byKey = new LinkedHashMap<>();
		for (AnalysisResult result : results == null ? List.<AnalysisResult>of() : results) {
			if (result == null) {
				throw new AnalysisAggregationException("Result list contains a null entry");
			}
			if (byKey.putIfAbsent(result.key(), result) != null) {
				throw new AnalysisAggregationException("Duplicate result for holding " + result.key());
			}
		}

		double confidenceSum = 0.0;
		int accepted = 0;
		int failed = 0;
		boolean askedFollowUp = false;
		Map<String, BigDecimal> sectorSummary = new LinkedHashMap<>();
		List<String> questions = new ArrayList<>();
		for (AnalysisResult result : byKey.values()) {
			if (!result.isAccepted()) {
				failed++;
				continue;
			}
			accepted++;
			confidenceSum += result.confidence() == null ? 0.0 : result.confidence();
			String sector = result.holding().sector() == null ? UNSPECIFIED_SECTOR : result.holding().sector();
			sectorSummary.merge(sector, result.holding().marketValue(), BigDecimal::add);
			if (result.followUpQuestion() != null && !result.followUpQuestion().isBlank()) {
				askedFollowUp = true;
				questions.add(result.symbol() + ": " + result.followUpQuestion().trim());
			}
		}

		double overallConfidence = accepted == 0 ? 0.0 : confidenceSum / accepted;
		boolean needsFollowUp = accepted == 0
				|| failed > 0
				|| overallConfidence < confidenceThreshold
				|| askedFollowUp;
		if (needsFollowUp) {
			logger.info("Report needs follow-up (accepted={}, failed={}, overallConfidence={})",
					accepted, failed, String.format("%.2f", overallConfidence));
		}
		return new AnalysisReport(
				mode,
				byKey,
				overallConfidence,
				sectorSummary,
				needsFollowUp,
				String.join("; ", questions),
				accepted,
				failed,
				Instant.now(clock)
		);
	}
}
