package my.fundmetrics.app.importer;

import my.fundmetrics.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a fund's holdings list. Rows for the same stock are summed.
 */
public class HoldingsCsvParser {
	private static final Pattern ISIN_RE = Pattern.compile("^[A-Z]{2}[A-Z0-9]{9}[0-9]$");

	public List<HoldingRow> parse(byte[] payload) {
		String content = CsvParsing.decode(payload);
		String sample = content.substring(0, Math.min(content.length(), 2048));
		char delimiter = CsvParsing.sniffDelimiter(sample);

		Map<String, Aggregation> agg = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader()
		)) {
			Map<String, String> headers = new HashMap<>();
			for (String header : parser.getHeaderMap().keySet()) {
				if (header != null && !header.isBlank()) {
					headers.put(header.trim().toLowerCase(Locale.ROOT), header);
				}
			}
			if (!headers.containsKey("accord_code") && !headers.containsKey("isin")) {
				throw new IllegalArgumentException("Holdings CSV header must include 'accord_code' or 'isin'");
			}
			for (CSVRecord record : parser) {
				String accordCode = trimUpper(get(record, headers, "accord_code"));
				String isin = trimUpper(get(record, headers, "isin"));
				if (!isin.isEmpty() && !ISIN_RE.matcher(isin).matches()) {
					isin = "";
				}
				if (accordCode.isEmpty() && isin.isEmpty()) {
					continue;
				}
				String key = accordCode.isEmpty() ? "isin:" + isin : accordCode;
				String name = get(record, headers, "company_name").trim();
				BigDecimal percentage = CsvParsing.parseNumber(get(record, headers, "holding_percentage"));
				BigDecimal value = CsvParsing.parseNumber(get(record, headers, "market_value"));

				Aggregation existing = agg.get(key);
				if (existing == null) {
					agg.put(key, new Aggregation(accordCode, isin, name, percentage, value));
				} else {
					agg.put(key, existing.add(name, percentage, value));
				}
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read holdings CSV: " + exc.getMessage(), exc);
		}

		List<HoldingRow> rows = new ArrayList<>();
		for (Aggregation aggregation : agg.values()) {
			rows.add(new HoldingRow(
					aggregation.accordCode.isEmpty() ? null : aggregation.accordCode,
					aggregation.isin.isEmpty() ? null : aggregation.isin,
					aggregation.name.isEmpty() ? null : aggregation.name,
					aggregation.percentage,
					aggregation.value
			));
		}
		return rows;
	}

	private String get(CSVRecord record, Map<String, String> headers, String key) {
		String header = headers.get(key);
		if (header == null || !record.isSet(header)) {
			return "";
		}
		String value = record.get(header);
		return value == null ? "" : value;
	}

	private String trimUpper(String value) {
		return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
	}

	private record Aggregation(String accordCode, String isin, String name, BigDecimal percentage, BigDecimal value) {
		private Aggregation add(String otherName, BigDecimal otherPercentage, BigDecimal otherValue) {
			return new Aggregation(accordCode, isin, name.isEmpty() ? otherName : name,
					sum(percentage, otherPercentage), sum(value, otherValue));
		}

		private static BigDecimal sum(BigDecimal left, BigDecimal right) {
			if (left == null) {
				return right;
			}
			return right == null ? left : left.add(right);
		}
	}
}
