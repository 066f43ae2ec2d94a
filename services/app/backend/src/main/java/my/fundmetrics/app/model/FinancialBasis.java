package my.fundmetrics.app.model;

/**
 * Latest valuation and trailing financials a metric set was computed from. Portfolio ratio metrics are
 * rebuilt from weighted sums of these figures.
 */
public record FinancialBasis(double valuation, double trailingRevenue, double trailingProfit) {
	public static final FinancialBasis ZERO = new FinancialBasis(0.0, 0.0, 0.0);
}
