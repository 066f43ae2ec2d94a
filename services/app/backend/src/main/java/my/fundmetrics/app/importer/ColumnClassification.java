package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;

/**
 * What a single sheet column holds. Separators and unknown columns never carry a category or period.
 */
public record ColumnClassification(int columnIndex,
								   Kind kind,
								   Category category,
								   PeriodKey period,
								   FixedColumn fixedColumn,
								   String periodLabel) {
	public enum Kind {
		CATEGORY,
		SEPARATOR,
		UNKNOWN
	}

	public static ColumnClassification separator(int columnIndex) {
		return new ColumnClassification(columnIndex, Kind.SEPARATOR, null, null, null, "");
	}

	public static ColumnClassification unknown(int columnIndex, String periodLabel) {
		return new ColumnClassification(columnIndex, Kind.UNKNOWN, null, null, null, periodLabel);
	}

	public static ColumnClassification fixed(int columnIndex, FixedColumn fixedColumn, Category category,
											 String periodLabel) {
		return new ColumnClassification(columnIndex, Kind.CATEGORY, category, null, fixedColumn, periodLabel);
	}

	public static ColumnClassification timeSeries(int columnIndex, Category category, PeriodKey period,
												  String periodLabel) {
		return new ColumnClassification(columnIndex, Kind.CATEGORY, category, period, null, periodLabel);
	}

	public boolean isSeparator() {
		return kind == Kind.SEPARATOR;
	}

	public boolean isTimeSeries() {
		return kind == Kind.CATEGORY && category.isTimeSeries();
	}

	/**
	 * A time-series column whose period label could not be read; it is left out of the data mapping.
	 */
	public boolean isUnparseable() {
		return isTimeSeries() && period == null;
	}
}
