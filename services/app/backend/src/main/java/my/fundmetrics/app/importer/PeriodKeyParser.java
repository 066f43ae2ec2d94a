package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PeriodKind;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses period labels from the period header row. Formats are tried in order: calendar dates,
 * six digit year-month codes, then {@code YYYY-YY} fiscal years.
 */
public final class PeriodKeyParser {
	private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[ T].*)?$");
	private static final Pattern SLASHED_ISO_DATE = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})$");
	private static final Pattern DAY_FIRST_DATE = Pattern.compile("^(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})$");
	private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})(\\d{2})(?:\\.0+)?$");
	private static final Pattern FISCAL_YEAR = Pattern.compile("^(?:FY\\s*)?(\\d{4})\\s*-\\s*(\\d{2})$");

	private PeriodKeyParser() {
	}

	public static Optional<PeriodKey> parse(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		String value = raw.trim().toUpperCase(Locale.ROOT);
		if (value.isEmpty()) {
			return Optional.empty();
		}
		Optional<PeriodKey> date = parseDate(value);
		if (date.isPresent()) {
			return date;
		}
		Matcher matcher = YEAR_MONTH.matcher(value);
		if (matcher.matches()) {
			int year = Integer.parseInt(matcher.group(1));
			int month = Integer.parseInt(matcher.group(2));
			if (year >= 1900 && year <= 2100 && month >= 1 && month <= 12) {
				return Optional.of(PeriodKey.yearMonth(year, month));
			}
			return Optional.empty();
		}
		matcher = FISCAL_YEAR.matcher(value);
		if (matcher.matches()) {
			int startYear = Integer.parseInt(matcher.group(1));
			int endYear = Integer.parseInt(matcher.group(2));
			if ((startYear + 1) % 100 == endYear) {
				return Optional.of(PeriodKey.fiscalYear(startYear));
			}
		}
		return Optional.empty();
	}

	/**
	 * Parses a label and keeps it only when it has the expected variant.
	 */
	public static Optional<PeriodKey> parse(String raw, PeriodKind expected) {
		return parse(raw).filter(key -> expected == null || key.kind() == expected);
	}

	/**
	 * Restores a key from its stored label.
	 */
	public static PeriodKey fromLabel(PeriodKind kind, String label) {
		return parse(label, kind)
				.orElseThrow(() -> new IllegalArgumentException("Invalid " + kind + " period label: " + label));
	}

	private static Optional<PeriodKey> parseDate(String value) {
		Matcher matcher = ISO_DATE.matcher(value);
		if (matcher.matches()) {
			return date(matcher.group(1), matcher.group(2), matcher.group(3));
		}
		matcher = SLASHED_ISO_DATE.matcher(value);
		if (matcher.matches()) {
			return date(matcher.group(1), matcher.group(2), matcher.group(3));
		}
		matcher = DAY_FIRST_DATE.matcher(value);
		if (matcher.matches()) {
			return date(matcher.group(3), matcher.group(2), matcher.group(1));
		}
		return Optional.empty();
	}

	private static Optional<PeriodKey> date(String year, String month, String day) {
		try {
			LocalDate date = LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
			return Optional.of(PeriodKey.date(date));
		} catch (DateTimeException ex) {
			return Optional.empty();
		}
	}
}
