package my.portfolioanalyst.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pass/fail verdict of one validation. Issues keep the validator's field order so the corrective
 * prompt is deterministic; warnings record lenient adjustments such as confidence clamping.
 */
public record ValidationOutcome(
		@JsonProperty("valid") boolean valid,
		@JsonProperty("issues") List<FieldIssue> issues,
		@JsonProperty("warnings") List<String> warnings,
		@JsonIgnore List<ValidatedAnalysis> analyses
) {
	public ValidationOutcome {
		issues = issues == null ? List.of() : List.copyOf(issues);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
		analyses = analyses == null ? List.of() : List.copyOf(analyses);
	}

	public static ValidationOutcome passed(List<ValidatedAnalysis> analyses, List<String> warnings) {
		return new ValidationOutcome(true, List.of(), warnings, analyses);
	}

	public static ValidationOutcome failed(List<FieldIssue> issues, List<String> warnings) {
		if (issues == null || issues.isEmpty()) {
			throw new IllegalArgumentException("A failed validation needs at least one issue");
		}
		return new ValidationOutcome(false, issues, warnings, List.of());
	}

	public static ValidationOutcome extractionFailed(String detail) {
		return failed(List.of(FieldIssue.noJson(detail)), List.of());
	}

	public List<String> missingFields() {
		return issues.stream().map(FieldIssue::field).distinct().toList();
	}
}
