package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.ExtractedPayload;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first JSON object out of free-form model output. Candidates are tried in order:
 * the whole text, the first fenced code block, then the first balanced {@code {...}} span.
 * Never throws; a miss yields a failure marker that keeps the raw text.
 */
@Component
public class ResponseExtractor {
	private static final Logger logger = LoggerFactory.getLogger(ResponseExtractor.class);
	private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL);

	private final ObjectMapper objectMapper;

	public ResponseExtractor() {
		this(JsonMapper.builder().build());
	}

	@Autowired
	public ResponseExtractor(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public @NonNull ExtractedPayload extract(String rawText) {
		if (rawText == null || rawText.isBlank()) {
			return ExtractedPayload.failure(rawText, "response was empty");
		}
		String trimmed = rawText.trim();
		JsonNode whole = parseObject(trimmed);
		if (whole != null) {
			return ExtractedPayload.success(whole, ExtractedPayload.Strategy.WHOLE_TEXT, rawText);
		}
		Matcher matcher = FENCED_BLOCK.matcher(rawText);
		if (matcher.find()) {
			JsonNode fenced = parseObject(matcher.group(1).trim());
			if (fenced != null) {
				return ExtractedPayload.success(fenced, ExtractedPayload.Strategy.FENCED_BLOCK, rawText);
			}
		}
		// An unbalanced or unparseable span moves the scan to the next opening brace, nested ones included.
		int start = rawText.indexOf('{');
		while (start >= 0) {
			int end = matchingBrace(rawText, start);
			if (end >= 0) {
				JsonNode scanned = parseObject(rawText.substring(start, end + 1));
				if (scanned != null) {
					return ExtractedPayload.success(scanned, ExtractedPayload.Strategy.BRACE_SCAN, rawText);
				}
			}
			start = rawText.indexOf('{', start + 1);
		}
		logger.debug("No JSON object found in response ({} chars)", rawText.length());
		return ExtractedPayload.failure(rawText, "no JSON object could be parsed from the response");
	}

	private JsonNode parseObject(String candidate) {
		if (candidate == null || !candidate.startsWith("{") || !candidate.endsWith("}")) {
			return null;
		}
		try {
			JsonNode node = objectMapper.readTree(candidate);
			return node != null && node.isObject() ? node : null;
		} catch (JacksonException ex) {
			logger.trace("Candidate is not valid JSON: {}", ex.getOriginalMessage());
			return null;
		}
	}

	// Braces inside string literals and escaped quotes do not count.
	private static int matchingBrace(String text, int start) {
		int depth = 0;
		boolean inString = false;
		boolean escaped = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (inString) {
				if (escaped) {
					escaped = false;
				} else if (c == '\\') {
					escaped = true;
				} else if (c == '"') {
					inString = false;
				}
				continue;
			}
			if (c == '"') {
				inString = true;
			} else if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}
}
