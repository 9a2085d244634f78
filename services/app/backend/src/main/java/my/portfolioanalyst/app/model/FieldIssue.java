package my.portfolioanalyst.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FieldIssue(
		@JsonProperty("field") String field,
		@JsonProperty("reason") Reason reason,
		@JsonProperty("detail") String detail
) {
	public static final String ENTIRE_PAYLOAD = "entire payload";

	public enum Reason {
		MISSING("missing"),
		WRONG_TYPE("wrong type"),
		OUT_OF_ENUM("out of enum"),
		NO_JSON("no JSON found");

		private final String label;

		Reason(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}
	}

	public static FieldIssue missing(String field) {
		return new FieldIssue(field, Reason.MISSING, null);
	}

	public static FieldIssue wrongType(String field, String detail) {
		return new FieldIssue(field, Reason.WRONG_TYPE, detail);
	}

	public static FieldIssue outOfEnum(String field, String detail) {
		return new FieldIssue(field, Reason.OUT_OF_ENUM, detail);
	}

	public static FieldIssue noJson(String detail) {
		return new FieldIssue(ENTIRE_PAYLOAD, Reason.NO_JSON, detail);
	}

	/**
	 * Single prompt line, e.g. {@code confidence: wrong type (expected a number, got "high")}.
	 */
	public String describe() {
		if (detail == null || detail.isBlank()) {
			return field + ": " + reason.label();
		}
		return field + ": " + reason.label() + " (" + detail + ")";
	}
}
