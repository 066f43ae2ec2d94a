package my.fundmetrics.app.importer;

/**
 * Fixed header rows of a stock sheet. Row indexes are zero based.
 */
public record HeaderLayout(int headerRows,
						   int titleRow,
						   int categoryRow,
						   int subcategoryRow,
						   int periodRow,
						   int identityScanColumns) {
	public static final HeaderLayout DEFAULT = new HeaderLayout(8, 2, 5, 6, 7, 14);

	public HeaderLayout {
		if (headerRows <= Math.max(categoryRow, Math.max(subcategoryRow, periodRow))) {
			throw new IllegalArgumentException("Header rows must cover the category, subcategory and period rows");
		}
	}
}
