package my.fundmetrics.app.model;

public enum MetricName {
	PATM("patm", Aggregation.RATIO_OF_TOTALS),
	QOQ_GROWTH("qoq_growth", Aggregation.WEIGHTED_MEAN),
	YOY_GROWTH("yoy_growth", Aggregation.WEIGHTED_MEAN),
	REVENUE_6YR_CAGR("revenue_6yr_cagr", Aggregation.WEIGHTED_MEAN),
	PAT_6YR_CAGR("pat_6yr_cagr", Aggregation.WEIGHTED_MEAN),
	CURRENT_PE("current_pe", Aggregation.RATIO_OF_TOTALS),
	PE_2YR_AVG("pe_2yr_avg", Aggregation.WEIGHTED_MEAN),
	PE_5YR_AVG("pe_5yr_avg", Aggregation.WEIGHTED_MEAN),
	PE_2YR_REVAL_DEVAL("pe_2yr_reval_deval", Aggregation.WEIGHTED_MEAN),
	PE_5YR_REVAL_DEVAL("pe_5yr_reval_deval", Aggregation.WEIGHTED_MEAN),
	CURRENT_PR("current_pr", Aggregation.RATIO_OF_TOTALS),
	PR_2YR_AVG("pr_2yr_avg", Aggregation.WEIGHTED_MEAN),
	PR_5YR_AVG("pr_5yr_avg", Aggregation.WEIGHTED_MEAN),
	PR_2YR_REVAL_DEVAL("pr_2yr_reval_deval", Aggregation.WEIGHTED_MEAN),
	PR_5YR_REVAL_DEVAL("pr_5yr_reval_deval", Aggregation.WEIGHTED_MEAN),
	PR_10Q_LOW("pr_10q_low", Aggregation.WEIGHTED_MEAN),
	PR_10Q_HIGH("pr_10q_high", Aggregation.WEIGHTED_MEAN),
	ALPHA_BOND_CAGR("alpha_bond_cagr", Aggregation.WEIGHTED_MEAN),
	ALPHA_ABSOLUTE("alpha_absolute", Aggregation.WEIGHTED_MEAN),
	PE_YIELD("pe_yield", Aggregation.WEIGHTED_MEAN),
	GROWTH_RATE("growth_rate", Aggregation.WEIGHTED_MEAN),
	BOND_RATE("bond_rate", Aggregation.WEIGHTED_MEAN);

	private final String key;
	private final Aggregation aggregation;

	MetricName(String key, Aggregation aggregation) {
		this.key = key;
		this.aggregation = aggregation;
	}

	public String key() {
		return key;
	}

	public Aggregation aggregation() {
		return aggregation;
	}

	public enum Aggregation {
		/** Sum of metric times holding weight. */
		WEIGHTED_MEAN,
		/** Recomputed from weighted financial totals, never averaged. */
		RATIO_OF_TOTALS
	}
}
