package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides per column which category and period a stock sheet column holds, using only the fixed header rows.
 * A category label may be repeated on every column of its block or written once on the first column;
 * unlabelled columns that follow continue the block until a separator. Where the category row is blank,
 * a recognised label on the subcategory row starts a new block (the price sheet keeps PR and PE there).
 */
public class HeaderClassifier {
	private static final Logger logger = LoggerFactory.getLogger(HeaderClassifier.class);

	private final HeaderLayout layout;

	public HeaderClassifier() {
		this(HeaderLayout.DEFAULT);
	}

	public HeaderClassifier(HeaderLayout layout) {
		this.layout = layout;
	}

	public HeaderLayout layout() {
		return layout;
	}

	public ColumnClassificationMap classify(List<List<String>> headerRows) {
		if (headerRows == null || headerRows.size() < layout.headerRows()) {
			int found = headerRows == null ? 0 : headerRows.size();
			throw new SchemaException("header rows",
					"Expected " + layout.headerRows() + " header rows, found " + found);
		}
		int width = 0;
		for (int row = 0; row < layout.headerRows(); row++) {
			List<String> cells = headerRows.get(row);
			width = Math.max(width, cells == null ? 0 : cells.size());
		}

		List<ColumnClassification> columns = new ArrayList<>(width);
		Category openBlock = null;
		for (int col = 0; col < width; col++) {
			String categoryLabel = cell(headerRows, layout.categoryRow(), col);
			String subcategoryLabel = cell(headerRows, layout.subcategoryRow(), col);
			String periodLabel = cell(headerRows, layout.periodRow(), col);

			if (categoryLabel.isEmpty() && subcategoryLabel.isEmpty() && periodLabel.isEmpty()) {
				columns.add(ColumnClassification.separator(col));
				openBlock = null;
				continue;
			}
			Optional<Category> labelled = categoryForLabel(categoryLabel);
			Optional<FixedColumn> identifier = FixedColumn.identifierFor(categoryLabel, periodLabel);
			// a banner over the identity block is not a category
			if (col < layout.identityScanColumns() && openBlock == null
					&& labelled.isEmpty() && identifier.isEmpty()) {
				FixedColumn fixed = identityColumn(periodLabel, col).orElse(null);
				columns.add(ColumnClassification.fixed(col, fixed, Category.IDENTITY, periodLabel));
				continue;
			}

			if (labelled.isEmpty() && categoryLabel.isEmpty()) {
				labelled = categoryForLabel(subcategoryLabel);
			}
			if (labelled.isPresent()) {
				openBlock = labelled.get();
				columns.add(timeSeriesColumn(col, openBlock, periodLabel));
				continue;
			}
			if (identifier.isPresent()) {
				columns.add(ColumnClassification.fixed(col, identifier.get(), Category.IDENTIFIERS, periodLabel));
				openBlock = null;
				continue;
			}
			if (categoryLabel.isEmpty() && openBlock != null) {
				columns.add(timeSeriesColumn(col, openBlock, periodLabel));
				continue;
			}
			logger.debug("Column {} not recognised (category='{}', period='{}')", col, categoryLabel, periodLabel);
			columns.add(ColumnClassification.unknown(col, periodLabel));
			openBlock = null;
		}

		ColumnClassificationMap map = new ColumnClassificationMap(columns);
		requireIdentity(map, FixedColumn.COMPANY_NAME, "company_name");
		requireIdentity(map, FixedColumn.ACCORD_CODE, "accord_code");
		logger.info("Classified {} columns: {} time-series, {} unparseable, {} separators, {} unknown",
				width, map.timeSeriesColumns().size(), map.unparseableColumns().size(), map.separators().size(),
				map.unknownColumns().size());
		return map;
	}

	/**
	 * Most specific match wins: free float before plain, explicit ratio names before abbreviations.
	 */
	public static Optional<Category> categoryForLabel(String label) {
		String value = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
		if (value.isEmpty()) {
			return Optional.empty();
		}
		boolean freeFloat = value.contains("free float");
		if (value.contains("market cap")) {
			return Optional.of(freeFloat ? Category.MARKET_CAP_FREE_FLOAT : Category.MARKET_CAP);
		}
		if (value.contains("ttm")) {
			if (isRevenue(value)) {
				return Optional.of(freeFloat ? Category.TTM_REVENUE_FREE_FLOAT : Category.TTM_REVENUE);
			}
			if (isProfit(value)) {
				return Optional.of(freeFloat ? Category.TTM_PAT_FREE_FLOAT : Category.TTM_PAT);
			}
		}
		if (value.contains("quarterly")) {
			if (isRevenue(value)) {
				return Optional.of(freeFloat ? Category.QUARTERLY_REVENUE_FREE_FLOAT : Category.QUARTERLY_REVENUE);
			}
			if (isProfit(value)) {
				return Optional.of(freeFloat ? Category.QUARTERLY_PAT_FREE_FLOAT : Category.QUARTERLY_PAT);
			}
		}
		if (value.contains("roce")) {
			return Optional.of(Category.ROCE);
		}
		if (value.contains("roe")) {
			return Optional.of(Category.ROE);
		}
		if (value.contains("retention") || value.contains("dividend")) {
			return Optional.of(Category.RETENTION);
		}
		if (value.contains("share price")) {
			return Optional.of(Category.SHARE_PRICE);
		}
		if (value.contains("price to revenue") || value.contains("p/r")) {
			return Optional.of(Category.PR_RATIO);
		}
		if (value.contains("price to earnings") || value.contains("p/e")) {
			return Optional.of(Category.PE_RATIO);
		}
		Set<String> tokens = Arrays.stream(value.split("[^a-z]+"))
				.filter(token -> !token.isEmpty())
				.collect(Collectors.toSet());
		if (value.equals("pr") || (tokens.contains("pr") && tokens.contains("ratio"))) {
			return Optional.of(Category.PR_RATIO);
		}
		if (value.equals("pe") || (tokens.contains("pe") && tokens.contains("ratio"))) {
			return Optional.of(Category.PE_RATIO);
		}
		return Optional.empty();
	}

	private static boolean isRevenue(String value) {
		return value.contains("revenue") || value.contains("net sales");
	}

	private static boolean isProfit(String value) {
		return value.contains("pat") || value.contains("profit after tax");
	}

	private ColumnClassification timeSeriesColumn(int col, Category category, String periodLabel) {
		PeriodKey period = PeriodKeyParser.parse(periodLabel, category.periodKind()).orElse(null);
		if (period == null) {
			logger.warn("Unparseable period '{}' in column {} ({}); column skipped", periodLabel, col, category);
		}
		return ColumnClassification.timeSeries(col, category, period, periodLabel);
	}

	private Optional<FixedColumn> identityColumn(String periodLabel, int col) {
		for (FixedColumn column : FixedColumn.of(Category.IDENTITY)) {
			if (isUniqueLabel(column) && column.label().equalsIgnoreCase(periodLabel)) {
				return Optional.of(column);
			}
		}
		String lower = periodLabel.toLowerCase(Locale.ROOT);
		if (lower.contains("company name")) {
			return Optional.of(FixedColumn.COMPANY_NAME);
		}
		if (lower.contains("accord code")) {
			return Optional.of(FixedColumn.ACCORD_CODE);
		}
		return FixedColumn.identityAt(col);
	}

	private static boolean isUniqueLabel(FixedColumn column) {
		return FixedColumn.of(Category.IDENTITY).stream()
				.filter(other -> other.label().equals(column.label()))
				.count() == 1;
	}

	private void requireIdentity(ColumnClassificationMap map, FixedColumn column, String name) {
		Optional<Integer> index = map.columnOf(column);
		if (index.isEmpty() || index.get() >= layout.identityScanColumns()) {
			throw new SchemaException(name, "Required column '" + name + "' not found in the first "
					+ layout.identityScanColumns() + " columns");
		}
	}

	private static String cell(List<List<String>> rows, int row, int col) {
		List<String> cells = rows.get(row);
		if (cells == null || col >= cells.size()) {
			return "";
		}
		String value = cells.get(col);
		if (value == null) {
			return "";
		}
		String trimmed = value.trim();
		return trimmed.equalsIgnoreCase("nan") ? "" : trimmed;
	}
}
