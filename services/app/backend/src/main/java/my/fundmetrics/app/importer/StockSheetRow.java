package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.util.CsvParsing;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * One data row of a stock sheet, keyed by meaning instead of column position.
 */
public record StockSheetRow(int rowNumber,
							Map<FixedColumn, String> fixedValues,
							Map<Category, Map<PeriodKey, BigDecimal>> series) {
	public StockSheetRow {
		fixedValues = Map.copyOf(fixedValues);
		series = Map.copyOf(series);
	}

	public String companyName() {
		return text(FixedColumn.COMPANY_NAME);
	}

	public String accordCode() {
		return text(FixedColumn.ACCORD_CODE);
	}

	public String text(FixedColumn column) {
		String value = fixedValues.get(column);
		return value == null || value.isBlank() ? null : value.trim();
	}

	public BigDecimal decimal(FixedColumn column) {
		return CsvParsing.parseNumber(fixedValues.get(column));
	}

	public BigDecimal value(Category category, PeriodKey period) {
		Map<PeriodKey, BigDecimal> values = series.get(category);
		return values == null ? null : values.get(period);
	}

	public Set<PeriodKey> periods(Category category) {
		Map<PeriodKey, BigDecimal> values = series.get(category);
		return values == null ? Set.of() : values.keySet();
	}
}
