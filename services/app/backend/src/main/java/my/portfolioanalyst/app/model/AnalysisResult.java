package my.portfolioanalyst.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome for one entity. Accepted results carry the recommendation fields; failures carry
 * {@code error}, {@code error_code} and {@code missing_fields} plus the last validation outcome.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResult(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("status") AnalysisStatus status,
		@JsonProperty("recommendation") Recommendation recommendation,
		@JsonProperty("estimated_return") BigDecimal estimatedReturn,
		@JsonProperty("confidence") Double confidence,
		@JsonProperty("risk_notes") String riskNotes,
		@JsonProperty("sources") List<String> sources,
		@JsonProperty("follow_up_question") String followUpQuestion,
		@JsonProperty("attempts") int attempts,
		@JsonProperty("error") String error,
		@JsonProperty("error_code") String errorCode,
		@JsonProperty("missing_fields") List<String> missingFields,
		@JsonProperty("diagnostics") ValidationOutcome diagnostics,
		@JsonProperty("holding") Holding holding
) {
	public AnalysisResult {
		if (holding == null) {
			throw new IllegalArgumentException("Holding is required");
		}
		if (status == null) {
			throw new IllegalArgumentException("Status is required");
		}
		symbol = holding.symbol();
		sources = sources == null ? null : List.copyOf(sources);
		missingFields = missingFields == null ? null : List.copyOf(missingFields);
	}

	public static AnalysisResult accepted(Holding holding,
										  ValidatedAnalysis analysis,
										  int attempts,
										  ValidationOutcome outcome) {
		ValidationOutcome diagnostics = outcome == null || outcome.warnings().isEmpty() ? null : outcome;
		return new AnalysisResult(
				holding.symbol(),
				AnalysisStatus.ACCEPTED,
				analysis.recommendation(),
				analysis.estimatedReturn(),
				analysis.confidence(),
				analysis.riskNotes(),
				analysis.sources(),
				analysis.followUpQuestion(),
				attempts,
				null,
				null,
				null,
				diagnostics,
				holding
		);
	}

	public static AnalysisResult exhausted(Holding holding, int attempts, ValidationOutcome lastOutcome) {
		return failed(holding, AnalysisStatus.EXHAUSTED,
				"Validation failed after " + attempts + " attempt(s)",
				lastOutcome == null ? List.of() : lastOutcome.missingFields(),
				lastOutcome,
				attempts);
	}

	public static AnalysisResult invocationFailed(Holding holding, int attempts, String message) {
		String detail = message == null || message.isBlank() ? "unknown error" : message;
		return failed(holding, AnalysisStatus.LLM_ERROR, "LLM invocation failed: " + detail, List.of(), null, attempts);
	}

	public static AnalysisResult timedOut(Holding holding, int attempts) {
		return failed(holding, AnalysisStatus.TIMED_OUT, "Analysis did not finish before the deadline",
				List.of(), null, attempts);
	}

	public static AnalysisResult failed(Holding holding,
										AnalysisStatus status,
										String error,
										List<String> missingFields,
										ValidationOutcome diagnostics,
										int attempts) {
		if (!status.isFailure()) {
			throw new IllegalArgumentException("Failure result needs a failure status, got " + status);
		}
		return new AnalysisResult(
				holding.symbol(),
				status,
				null,
				null,
				null,
				null,
				null,
				null,
				attempts,
				error,
				status.errorCode(),
				missingFields == null ? List.of() : missingFields,
				diagnostics,
				holding
		);
	}

	public AnalysisResult withoutFollowUpQuestion() {
		return new AnalysisResult(symbol, status, recommendation, estimatedReturn, confidence, riskNotes,
				sources, null, attempts, error, errorCode, missingFields, diagnostics, holding);
	}

	public AnalysisResult withAttempts(int totalAttempts) {
		return new AnalysisResult(symbol, status, recommendation, estimatedReturn, confidence, riskNotes,
				sources, followUpQuestion, totalAttempts, error, errorCode, missingFields, diagnostics, holding);
	}

	public boolean hasFollowUpQuestion() {
		return followUpQuestion != null && !followUpQuestion.isBlank();
	}

	@JsonIgnore
	public boolean isAccepted() {
		return status == AnalysisStatus.ACCEPTED;
	}

	@JsonIgnore
	public boolean isFailure() {
		return status.isFailure();
	}

	public String key() {
		return holding.key();
	}
}
