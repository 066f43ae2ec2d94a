package my.fundmetrics.app.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of column families in a stock sheet. Declaration order is the canonical export block order
 * and must not be changed: every column position downstream is derived from it.
 */
public enum Category {
	IDENTITY(null, null, "Company Details", ""),
	MARKET_CAP(DataKind.VALUATION, "market_cap", "Market Cap", "Market Cap"),
	MARKET_CAP_FREE_FLOAT(DataKind.VALUATION, "market_cap_free_float", "Market Cap", "Market Cap Free Float"),
	TTM_REVENUE(DataKind.TRAILING, "ttm_revenue", "TTM Revenue", "TTM Revenue"),
	TTM_REVENUE_FREE_FLOAT(DataKind.TRAILING, "ttm_revenue_free_float", "TTM Revenue", "TTM Revenue Free Float"),
	TTM_PAT(DataKind.TRAILING, "ttm_pat", "TTM PAT", "TTM PAT"),
	TTM_PAT_FREE_FLOAT(DataKind.TRAILING, "ttm_pat_free_float", "TTM PAT", "TTM PAT Free Float"),
	QUARTERLY_REVENUE(DataKind.QUARTERLY, "quarterly_revenue", "Quarterly Revenue", "Quarterly Revenue"),
	QUARTERLY_REVENUE_FREE_FLOAT(DataKind.QUARTERLY, "quarterly_revenue_free_float", "Quarterly Revenue",
			"Quarterly Revenue Free Float"),
	QUARTERLY_PAT(DataKind.QUARTERLY, "quarterly_pat", "Quarterly PAT", "Quarterly PAT"),
	QUARTERLY_PAT_FREE_FLOAT(DataKind.QUARTERLY, "quarterly_pat_free_float", "Quarterly PAT",
			"Quarterly PAT Free Float"),
	ROCE(DataKind.ANNUAL, "roce", "Annual Ratios", "ROCE (%)"),
	ROE(DataKind.ANNUAL, "roe", "Annual Ratios", "ROE (%)"),
	RETENTION(DataKind.ANNUAL, "retention", "Annual Ratios", "Retention (%)"),
	SHARE_PRICE(DataKind.PRICE, "share_price", "Price Data", "Share Price"),
	PR_RATIO(DataKind.PRICE, "pr_ratio", "Price Data", "PR Ratio"),
	PE_RATIO(DataKind.PRICE, "pe_ratio", "Price Data", "PE Ratio"),
	IDENTIFIERS(null, null, "Identifiers", "");

	private final DataKind dataKind;
	private final String field;
	private final String title;
	private final String label;

	Category(DataKind dataKind, String field, String title, String label) {
		this.dataKind = dataKind;
		this.field = field;
		this.title = title;
		this.label = label;
	}

	public static List<Category> canonicalOrder() {
		return List.of(values());
	}

	public static List<Category> timeSeries() {
		return Arrays.stream(values()).filter(Category::isTimeSeries).toList();
	}

	public static List<Category> ofKind(DataKind kind) {
		return Arrays.stream(values()).filter(category -> category.dataKind == kind).toList();
	}

	public static Optional<Category> fromKey(String key) {
		if (key == null || key.isBlank()) {
			return Optional.empty();
		}
		String normalized = key.trim().toUpperCase(Locale.ROOT);
		return Arrays.stream(values()).filter(category -> category.name().equals(normalized)).findFirst();
	}

	public boolean isTimeSeries() {
		return dataKind != null;
	}

	public DataKind dataKind() {
		return dataKind;
	}

	public PeriodKind periodKind() {
		return dataKind == null ? null : dataKind.periodKind();
	}

	/**
	 * Column name of this category's value inside its time-series table.
	 */
	public String field() {
		return field;
	}

	public String title() {
		return title;
	}

	/**
	 * Label written on the category row of an exported header; classifies back to this category.
	 */
	public String label() {
		return label;
	}
}
