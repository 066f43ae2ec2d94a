package my.fundmetrics.app.model;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.Objects;

/**
 * Semantic time label of a time-series column. Natural order is chronological (oldest first);
 * registries and bundles hold keys in reverse order.
 */
public final class PeriodKey implements Comparable<PeriodKey> {
	private static final Comparator<PeriodKey> ORDER = Comparator
			.comparing(PeriodKey::endDate)
			.thenComparing(PeriodKey::kind)
			.thenComparing(PeriodKey::label);

	private final PeriodKind kind;
	private final LocalDate endDate;
	private final String label;

	private PeriodKey(PeriodKind kind, LocalDate endDate, String label) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.endDate = Objects.requireNonNull(endDate, "endDate");
		this.label = Objects.requireNonNull(label, "label");
	}

	public static PeriodKey date(LocalDate date) {
		return new PeriodKey(PeriodKind.DATE, date, date.toString());
	}

	public static PeriodKey yearMonth(int year, int month) {
		YearMonth yearMonth = YearMonth.of(year, month);
		return new PeriodKey(PeriodKind.YEAR_MONTH, yearMonth.atEndOfMonth(),
				String.format("%04d%02d", year, month));
	}

	/**
	 * Fiscal year starting in April of {@code startYear}, labelled {@code YYYY-YY}.
	 */
	public static PeriodKey fiscalYear(int startYear) {
		int endYear = startYear + 1;
		LocalDate end = LocalDate.of(endYear, Month.MARCH, 31);
		return new PeriodKey(PeriodKind.FISCAL_YEAR, end, String.format("%04d-%02d", startYear, endYear % 100));
	}

	public PeriodKind kind() {
		return kind;
	}

	/**
	 * Last calendar day covered by the period.
	 */
	public LocalDate endDate() {
		return endDate;
	}

	public YearMonth yearMonth() {
		return YearMonth.from(endDate);
	}

	public String label() {
		return label;
	}

	public boolean isAtOrBefore(PeriodKey other) {
		return !yearMonth().isAfter(other.yearMonth());
	}

	@Override
	public int compareTo(PeriodKey other) {
		return ORDER.compare(this, other);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		PeriodKey that = (PeriodKey) o;
		return kind == that.kind && label.equals(that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, label);
	}

	@Override
	public String toString() {
		return label;
	}
}
