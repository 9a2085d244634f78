package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisShape;
import my.portfolioanalyst.app.model.ExtractedPayload;
import my.portfolioanalyst.app.model.FieldIssue;
import my.portfolioanalyst.app.model.Recommendation;
import my.portfolioanalyst.app.model.ValidatedAnalysis;
import my.portfolioanalyst.app.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks an extracted payload against the required-field contract of an {@link AnalysisShape}.
 * <p>
 * Per-holding objects need {@code recommendation}, {@code confidence}, {@code risk_notes} and
 * {@code sources}; {@code estimated_return} and {@code follow_up_question} are optional. A portfolio
 * payload wraps those objects in an {@code analyses} array, each entry naming its holding key in {@code symbol}.
 * Issues are reported in field order. An out-of-range confidence is clamped into [0, 1] and reported
 * as a warning rather than an issue.
 */
@Component
public class SchemaValidator {
	private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);
	private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
	private static final int MAX_DETAIL_VALUE_CHARS = 40;

	static final String RECOMMENDATION = "recommendation";
	static final String CONFIDENCE = "confidence";
	static final String RISK_NOTES = "risk_notes";
	static final String SOURCES = "sources";
	static final String ESTIMATED_RETURN = "estimated_return";
	static final String FOLLOW_UP_QUESTION = "follow_up_question";
	static final String ANALYSES = "analyses";
	static final String SYMBOL = "symbol";

	public ValidationOutcome validate(ExtractedPayload payload, AnalysisShape shape) {
		return validate(payload, shape, List.of());
	}

	public ValidationOutcome validate(ExtractedPayload payload, AnalysisShape shape, List<String> expectedKeys) {
		if (payload == null || !payload.isExtracted()) {
			String reason = payload == null ? "no response" : payload.failureReason();
			return ValidationOutcome.extractionFailed(reason);
		}
		List<FieldIssue> issues = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		List<ValidatedAnalysis> analyses = new ArrayList<>();
		if (shape == AnalysisShape.PER_HOLDING) {
			ValidatedAnalysis analysis = validateEntry(payload.json(), "", null, issues, warnings);
			if (analysis != null) {
				analyses.add(analysis);
			}
		} else {
			validatePortfolio(payload.json(), expectedKeys, issues, warnings, analyses);
		}
		if (!issues.isEmpty()) {
			return ValidationOutcome.failed(issues, warnings);
		}
		return ValidationOutcome.passed(analyses, warnings);
	}

	private void validatePortfolio(JsonNode root,
								   List<String> expectedKeys,
								   List<FieldIssue> issues,
								   List<String> warnings,
								   List<ValidatedAnalysis> analyses) {
		JsonNode entries = root.get(ANALYSES);
		if (entries == null || entries.isNull()) {
			issues.add(FieldIssue.missing(ANALYSES));
			return;
		}
		if (!entries.isArray()) {
			issues.add(FieldIssue.wrongType(ANALYSES, "expected an array, got " + describe(entries)));
			return;
		}
		Set<String> covered = new HashSet<>();
		int index = 0;
		for (JsonNode entry : entries) {
			String prefix = ANALYSES + "[" + index + "].";
			index++;
			if (!entry.isObject()) {
				issues.add(FieldIssue.wrongType(prefix.substring(0, prefix.length() - 1),
						"expected an object, got " + describe(entry)));
				continue;
			}
			String symbol = null;
			JsonNode symbolNode = entry.get(SYMBOL);
			if (symbolNode == null || symbolNode.isNull() || (symbolNode.isTextual() && symbolNode.asText().isBlank())) {
				issues.add(FieldIssue.missing(prefix + SYMBOL));
			} else if (!symbolNode.isTextual()) {
				issues.add(FieldIssue.wrongType(prefix + SYMBOL, "expected a string, got " + describe(symbolNode)));
			} else {
				symbol = symbolNode.asText().trim();
				covered.add(symbol.toUpperCase(Locale.ROOT));
			}
			ValidatedAnalysis analysis = validateEntry(entry, prefix, symbol, issues, warnings);
			if (analysis != null && symbol != null) {
				analyses.add(analysis);
			}
		}
		if (expectedKeys == null) {
			return;
		}
		for (String expected : expectedKeys) {
			if (expected != null && !covered.contains(expected.trim().toUpperCase(Locale.ROOT))) {
				issues.add(FieldIssue.missing(ANALYSES + "." + expected.trim()));
			}
		}
	}

	private ValidatedAnalysis validateEntry(JsonNode node,
											String prefix,
											String symbol,
											List<FieldIssue> issues,
											List<String> warnings) {
		int before = issues.size();

		Recommendation recommendation = null;
		JsonNode recommendationNode = node.get(RECOMMENDATION);
		if (isAbsent(recommendationNode)) {
			issues.add(FieldIssue.missing(prefix + RECOMMENDATION));
		} else if (!recommendationNode.isTextual()) {
			issues.add(FieldIssue.wrongType(prefix + RECOMMENDATION, "expected a string, got " + describe(recommendationNode)));
		} else {
			recommendation = Recommendation.parse(recommendationNode.asText()).orElse(null);
			if (recommendation == null) {
				issues.add(FieldIssue.outOfEnum(prefix + RECOMMENDATION,
						"expected BUY, SELL or RETAIN, got " + describe(recommendationNode)));
			}
		}

		double confidence = 0.0;
		JsonNode confidenceNode = node.get(CONFIDENCE);
		if (isAbsent(confidenceNode)) {
			issues.add(FieldIssue.missing(prefix + CONFIDENCE));
		} else {
			BigDecimal parsed = numberOrNull(confidenceNode);
			if (parsed == null) {
				issues.add(FieldIssue.wrongType(prefix + CONFIDENCE, "expected a number, got " + describe(confidenceNode)));
			} else {
				confidence = clampConfidence(prefix + CONFIDENCE, parsed.doubleValue(), warnings);
			}
		}

		String riskNotes = null;
		JsonNode riskNode = node.get(RISK_NOTES);
		if (isAbsent(riskNode) || (riskNode.isTextual() && riskNode.asText().isBlank())) {
			issues.add(FieldIssue.missing(prefix + RISK_NOTES));
		} else if (!riskNode.isTextual()) {
			issues.add(FieldIssue.wrongType(prefix + RISK_NOTES, "expected a string, got " + describe(riskNode)));
		} else {
			riskNotes = riskNode.asText().trim();
		}

		List<String> sources = new ArrayList<>();
		JsonNode sourcesNode = node.get(SOURCES);
		if (isAbsent(sourcesNode)) {
			issues.add(FieldIssue.missing(prefix + SOURCES));
		} else if (!sourcesNode.isArray()) {
			issues.add(FieldIssue.wrongType(prefix + SOURCES, "expected an array of strings, got " + describe(sourcesNode)));
		} else {
			int index = 0;
			for (JsonNode source : sourcesNode) {
				if (!source.isTextual()) {
					issues.add(FieldIssue.wrongType(prefix + SOURCES + "[" + index + "]",
							"expected a string, got " + describe(source)));
				} else if (!source.asText().isBlank()) {
					sources.add(source.asText().trim());
				}
				index++;
			}
		}

		BigDecimal estimatedReturn = null;
		JsonNode returnNode = node.get(ESTIMATED_RETURN);
		if (!isAbsent(returnNode)) {
			estimatedReturn = numberOrNull(returnNode);
			if (estimatedReturn == null) {
				issues.add(FieldIssue.wrongType(prefix + ESTIMATED_RETURN, "expected a number, got " + describe(returnNode)));
			}
		}

		String followUpQuestion = null;
		JsonNode followUpNode = node.get(FOLLOW_UP_QUESTION);
		if (!isAbsent(followUpNode)) {
			if (!followUpNode.isTextual()) {
				issues.add(FieldIssue.wrongType(prefix + FOLLOW_UP_QUESTION,
						"expected a string, got " + describe(followUpNode)));
			} else if (!followUpNode.asText().isBlank()) {
				followUpQuestion = followUpNode.asText().trim();
			}
		}

		if (issues.size() > before) {
			return null;
		}
		return new ValidatedAnalysis(symbol, recommendation, estimatedReturn, confidence, riskNotes, sources,
				followUpQuestion);
	}

	private double clampConfidence(String field, double value, List<String> warnings) {
		if (value >= 0.0 && value <= 1.0) {
			return value;
		}
		double clamped = Math.min(1.0, Math.max(0.0, value));
		String warning = field + " " + value + " clamped to " + clamped;
		logger.warn("Confidence out of range: {}", warning);
		warnings.add(warning);
		return clamped;
	}

	private boolean isAbsent(JsonNode node) {
		return node == null || node.isNull() || node.isMissingNode();
	}

	private BigDecimal numberOrNull(JsonNode value) {
		if (value.isNumber()) {
			return value.decimalValue();
		}
		if (!value.isTextual()) {
			return null;
		}
		String trimmed = value.asText().trim();
		if (!NUMERIC.matcher(trimmed).matches()) {
			return null;
		}
		try {
			return new BigDecimal(trimmed);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	private String describe(JsonNode node) {
		if (node.isTextual()) {
			String text = node.asText();
			if (text.length() > MAX_DETAIL_VALUE_CHARS) {
				text = text.substring(0, MAX_DETAIL_VALUE_CHARS) + "...";
			}
			return "\"" + text + "\"";
		}
		return node.getNodeType().name().toLowerCase(Locale.ROOT);
	}
}
