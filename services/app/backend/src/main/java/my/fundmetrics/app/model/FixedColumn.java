package my.fundmetrics.app.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Columns of the two non-time-series blocks, in sheet order.
 */
public enum FixedColumn {
	SERIAL_NO(Category.IDENTITY, "S. No.", ""),
	COMPANY_NAME(Category.IDENTITY, "Company Name", ""),
	ACCORD_CODE(Category.IDENTITY, "Accord Code", ""),
	SECTOR(Category.IDENTITY, "Sector", ""),
	CAP(Category.IDENTITY, "Cap", ""),
	FREE_FLOAT(Category.IDENTITY, "Free Float", ""),
	REVENUE_6YR_CAGR(Category.IDENTITY, "6 Year CAGR", "Revenue"),
	REVENUE_TTM(Category.IDENTITY, "TTM", "Revenue"),
	PAT_6YR_CAGR(Category.IDENTITY, "6 Year CAGR", "PAT"),
	PAT_TTM(Category.IDENTITY, "TTM", "PAT"),
	PE_CURRENT(Category.IDENTITY, "Current", "PE"),
	PE_2YR_AVG(Category.IDENTITY, "2 Yr Avg", "PE"),
	PE_REVAL_DEVAL(Category.IDENTITY, "Reval/deval", "PE"),
	BSE_CODE(Category.IDENTIFIERS, "BSE Code", ""),
	NSE_SYMBOL(Category.IDENTIFIERS, "NSE Code", ""),
	ISIN(Category.IDENTIFIERS, "ISIN", "");

	private static final List<FixedColumn> IDENTITY_COLUMNS = List.of(SERIAL_NO, COMPANY_NAME, ACCORD_CODE, SECTOR,
			CAP, FREE_FLOAT, REVENUE_6YR_CAGR, REVENUE_TTM, PAT_6YR_CAGR, PAT_TTM, PE_CURRENT, PE_2YR_AVG,
			PE_REVAL_DEVAL);
	private static final List<FixedColumn> IDENTIFIER_COLUMNS = List.of(BSE_CODE, NSE_SYMBOL, ISIN);

	private final Category category;
	private final String label;
	private final String subLabel;

	FixedColumn(Category category, String label, String subLabel) {
		this.category = category;
		this.label = label;
		this.subLabel = subLabel;
	}

	public static List<FixedColumn> of(Category category) {
		if (category == Category.IDENTITY) {
			return IDENTITY_COLUMNS;
		}
		if (category == Category.IDENTIFIERS) {
			return IDENTIFIER_COLUMNS;
		}
		return List.of();
	}

	public static Optional<FixedColumn> identityAt(int offset) {
		if (offset < 0 || offset >= IDENTITY_COLUMNS.size()) {
			return Optional.empty();
		}
		return Optional.of(IDENTITY_COLUMNS.get(offset));
	}

	/**
	 * Matches an identifier column by the keyword in its category or period label.
	 */
	public static Optional<FixedColumn> identifierFor(String categoryLabel, String periodLabel) {
		String category = lower(categoryLabel);
		String period = lower(periodLabel);
		if (category.contains("bse") || period.contains("bse")) {
			return Optional.of(BSE_CODE);
		}
		if (category.contains("nse") || period.contains("nse")) {
			return Optional.of(NSE_SYMBOL);
		}
		if (category.contains("isin") || period.contains("isin")) {
			return Optional.of(ISIN);
		}
		return Optional.empty();
	}

	private static String lower(String value) {
		return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
	}

	public Category category() {
		return category;
	}

	public String label() {
		return label;
	}

	public String subLabel() {
		return subLabel;
	}
}
