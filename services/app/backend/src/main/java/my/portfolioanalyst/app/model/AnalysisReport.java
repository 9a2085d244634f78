package my.portfolioanalyst.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio-level report over one dispatch. Results are keyed by holding key in input order.
 */
public record AnalysisReport(
		@JsonProperty("mode") DispatchMode mode,
		@JsonProperty("results") Map<String, AnalysisResult> results,
		@JsonProperty("overall_confidence") double overallConfidence,
		@JsonProperty("sector_summary") Map<String, BigDecimal> sectorSummary,
		@JsonProperty("needs_follow_up") boolean needsFollowUp,
		@JsonProperty("follow_up_question") String followUpQuestion,
		@JsonProperty("accepted_count") int acceptedCount,
		@JsonProperty("failed_count") int failedCount,
		@JsonProperty("generated_at") Instant generatedAt
) {
	public AnalysisReport {
		results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
		sectorSummary = sectorSummary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sectorSummary));
		followUpQuestion = followUpQuestion == null ? "" : followUpQuestion;
	}

	public List<AnalysisResult> resultList() {
		return new ArrayList<>(results.values());
	}

	public List<AnalysisResult> failures() {
		return results.values().stream().filter(AnalysisResult::isFailure).toList();
	}

	public AnalysisResult result(String key) {
		return results.get(key);
	}
}
