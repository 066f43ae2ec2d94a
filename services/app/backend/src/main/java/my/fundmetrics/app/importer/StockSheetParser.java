package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.util.CsvParsing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the data rows below the header through a column classification.
 */
public class StockSheetParser {
	private static final String SAMPLE_ROW_MARKER = "XX";

	public Result parse(ColumnClassificationMap classification, List<List<String>> dataRows, int firstRowNumber) {
		List<StockSheetRow> rows = new ArrayList<>();
		int skipped = 0;
		int rowNumber = firstRowNumber;
		for (List<String> cells : dataRows) {
			rowNumber += 1;
			if (isBlank(cells)) {
				skipped += 1;
				continue;
			}
			Map<FixedColumn, String> fixedValues = new EnumMap<>(FixedColumn.class);
			Map<Category, Map<PeriodKey, BigDecimal>> series = new EnumMap<>(Category.class);
			for (ColumnClassification column : classification.columns()) {
				String raw = cell(cells, column.columnIndex());
				if (column.fixedColumn() != null) {
					fixedValues.putIfAbsent(column.fixedColumn(), raw);
				} else if (column.isTimeSeries() && column.period() != null) {
					BigDecimal value = CsvParsing.parseNumber(raw);
					if (value != null) {
						series.computeIfAbsent(column.category(), key -> new HashMap<>()).put(column.period(), value);
					}
				}
			}
			StockSheetRow row = new StockSheetRow(rowNumber, fixedValues, series);
			if (isSampleRow(row) || row.companyName() == null || row.accordCode() == null) {
				skipped += 1;
				continue;
			}
			rows.add(row);
		}
		return new Result(rows, skipped);
	}

	private boolean isSampleRow(StockSheetRow row) {
		String serial = row.text(FixedColumn.SERIAL_NO);
		return serial != null && serial.toUpperCase(Locale.ROOT).equals(SAMPLE_ROW_MARKER);
	}

	private boolean isBlank(List<String> cells) {
		return cells == null || cells.stream().allMatch(value -> value == null || value.isBlank());
	}

	private String cell(List<String> cells, int index) {
		if (index >= cells.size()) {
			return "";
		}
		String value = cells.get(index);
		return value == null ? "" : value.trim();
	}

	public record Result(List<StockSheetRow> rows, int skippedRows) {
	}
}
