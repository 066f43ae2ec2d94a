package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ColumnClassificationMap {
	private final List<ColumnClassification> columns;

	public ColumnClassificationMap(List<ColumnClassification> columns) {
		this.columns = List.copyOf(columns);
	}

	public List<ColumnClassification> columns() {
		return columns;
	}

	public ColumnClassification column(int index) {
		return columns.get(index);
	}

	public int columnCount() {
		return columns.size();
	}

	public List<Integer> separators() {
		List<Integer> result = new ArrayList<>();
		for (ColumnClassification column : columns) {
			if (column.isSeparator()) {
				result.add(column.columnIndex());
			}
		}
		return result;
	}

	public List<ColumnClassification> timeSeriesColumns() {
		return columns.stream().filter(column -> column.isTimeSeries() && column.period() != null).toList();
	}

	public List<ColumnClassification> unparseableColumns() {
		return columns.stream().filter(ColumnClassification::isUnparseable).toList();
	}

	public List<ColumnClassification> unknownColumns() {
		return columns.stream().filter(column -> column.kind() == ColumnClassification.Kind.UNKNOWN).toList();
	}

	public List<ColumnClassification> columnsOf(Category category) {
		return columns.stream().filter(column -> column.category() == category).toList();
	}

	public Optional<Integer> columnOf(FixedColumn fixedColumn) {
		return columns.stream()
				.filter(column -> column.fixedColumn() == fixedColumn)
				.map(ColumnClassification::columnIndex)
				.findFirst();
	}

	/**
	 * Distinct periods per category in column order.
	 */
	public Map<Category, List<PeriodKey>> discoveredPeriods() {
		Map<Category, Set<PeriodKey>> collected = new EnumMap<>(Category.class);
		for (ColumnClassification column : timeSeriesColumns()) {
			collected.computeIfAbsent(column.category(), key -> new LinkedHashSet<>()).add(column.period());
		}
		Map<Category, List<PeriodKey>> result = new EnumMap<>(Category.class);
		collected.forEach((category, keys) -> result.put(category, List.copyOf(keys)));
		return result;
	}
}
