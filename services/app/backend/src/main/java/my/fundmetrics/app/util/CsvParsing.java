package my.fundmetrics.app.util;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

public final class CsvParsing {
	private static final Set<String> EMPTY_MARKERS = Set.of("-", "--", "NA", "N/A", "NAN", "NULL", "NONE");

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

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		String firstLine = sample.lines().findFirst().orElse(sample);
		long commas = firstLine.chars().filter(ch -> ch == ',').count();
		long semicolons = firstLine.chars().filter(ch -> ch == ';').count();
		long tabs = firstLine.chars().filter(ch -> ch == '\t').count();
		if (tabs > commas && tabs > semicolons) {
			return '\t';
		}
		if (semicolons > commas) {
			return ';';
		}
		return ',';
	}

	/**
	 * Decodes strict UTF-8 and falls back to ISO-8859-1 for legacy spreadsheet exports.
	 */
	public static String decode(byte[] payload) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return stripBom(decoder.decode(ByteBuffer.wrap(payload)).toString());
		} catch (CharacterCodingException ex) {
			return new String(payload, StandardCharsets.ISO_8859_1);
		}
	}

	/**
	 * Reads a spreadsheet number: currency symbols, thousands separators and blanks are stripped and a value
	 * in parentheses is negative. Returns null for empty markers and anything unreadable.
	 */
	public static BigDecimal parseNumber(String raw) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim();
		if (value.isEmpty() || EMPTY_MARKERS.contains(value.toUpperCase(Locale.ROOT))) {
			return null;
		}
		boolean negative = false;
		if (value.startsWith("(") && value.endsWith(")")) {
			negative = true;
			value = value.substring(1, value.length() - 1);
		}
		value = value.replace("\u20B9", "")
				.replace("$", "")
				.replace("Rs.", "")
				.replace(",", "")
				.replace("%", "")
				.replaceAll("\\s+", "");
		if (value.isEmpty()) {
			return null;
		}
		try {
			BigDecimal parsed = new BigDecimal(value);
			return negative ? parsed.negate() : parsed;
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public static String csv(Object value) {
		if (value == null) {
			return "";
		}
		String raw = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
		if (raw.contains(",") || raw.contains("\"") || raw.contains("\n")) {
			return "\"" + raw.replace("\"", "\"\"") + "\"";
		}
		return raw;
	}
}
