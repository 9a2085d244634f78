package my.portfolioanalyst.app.model;

import tools.jackson.databind.JsonNode;

/**
 * Result of pulling a JSON object out of raw LLM text: the parsed object, or a failure marker that
 * keeps the raw text for the corrective prompt.
 */
public record ExtractedPayload(
		JsonNode json,
		Strategy strategy,
		String rawText,
		String failureReason
) {
	public enum Strategy {
		WHOLE_TEXT,
		FENCED_BLOCK,
		BRACE_SCAN
	}

	public static ExtractedPayload success(JsonNode json, Strategy strategy, String rawText) {
		return new ExtractedPayload(json, strategy, rawText, null);
	}

	public static ExtractedPayload failure(String rawText, String reason) {
		return new ExtractedPayload(null, null, rawText == null ? "" : rawText, reason);
	}

	public boolean isExtracted() {
		return json != null;
	}
}
