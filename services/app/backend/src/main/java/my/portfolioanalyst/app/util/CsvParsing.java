package my.portfolioanalyst.app.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Delimiter of the header line: {@code ;} when it has more semicolons than commas, else {@code ,}.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int newline = sample.indexOf('\n');
		String header = newline < 0 ? sample : sample.substring(0, newline);
		long commas = header.chars().filter(c -> c == ',').count();
		long semicolons = header.chars().filter(c -> c == ';').count();
		return semicolons > commas ? ';' : ',';
	}

	/**
	 * Strict UTF-8 first, ISO-8859-1 when the bytes are not valid UTF-8. A leading BOM is dropped.
	 */
	public static String decode(byte[] payload) {
		if (payload == null) {
			return "";
		}
		try {
			String utf8 = StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(payload))
					.toString();
			return stripBom(utf8);
		} catch (CharacterCodingException ex) {
			return stripBom(new String(payload, StandardCharsets.ISO_8859_1));
		}
	}

	public static String normalizeHeader(String header) {
		if (header == null) {
			return "";
		}
		return stripBom(header).trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
	}
}
