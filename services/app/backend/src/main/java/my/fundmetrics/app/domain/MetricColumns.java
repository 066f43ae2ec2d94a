package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import my.fundmetrics.app.model.MetricName;

import java.util.EnumMap;
import java.util.Map;

/**
 * The 22 metric columns shared by per-stock metric rows and fund summaries.
 */
@Embeddable
public class MetricColumns {
	@Column(name = "patm")
	private Double patm;

	@Column(name = "qoq_growth")
	private Double qoqGrowth;

	@Column(name = "yoy_growth")
	private Double yoyGrowth;

	@Column(name = "revenue_6yr_cagr")
	private Double revenue6yrCagr;

	@Column(name = "pat_6yr_cagr")
	private Double pat6yrCagr;

	@Column(name = "current_pe")
	private Double currentPe;

	@Column(name = "pe_2yr_avg")
	private Double pe2yrAvg;

	@Column(name = "pe_5yr_avg")
	private Double pe5yrAvg;

	@Column(name = "pe_2yr_reval_deval")
	private Double pe2yrRevalDeval;

	@Column(name = "pe_5yr_reval_deval")
	private Double pe5yrRevalDeval;

	@Column(name = "current_pr")
	private Double currentPr;

	@Column(name = "pr_2yr_avg")
	private Double pr2yrAvg;

	@Column(name = "pr_5yr_avg")
	private Double pr5yrAvg;

	@Column(name = "pr_2yr_reval_deval")
	private Double pr2yrRevalDeval;

	@Column(name = "pr_5yr_reval_deval")
	private Double pr5yrRevalDeval;

	@Column(name = "pr_10q_low")
	private Double pr10qLow;

	@Column(name = "pr_10q_high")
	private Double pr10qHigh;

	@Column(name = "alpha_bond_cagr")
	private Double alphaBondCagr;

	@Column(name = "alpha_absolute")
	private Double alphaAbsolute;

	@Column(name = "pe_yield")
	private Double peYield;

	@Column(name = "growth_rate")
	private Double growthRate;

	@Column(name = "bond_rate")
	private Double bondRate;

	public static MetricColumns from(Map<MetricName, Double> values) {
		MetricColumns columns = new MetricColumns();
		for (MetricName name : MetricName.values()) {
			columns.set(name, values == null ? null : values.get(name));
		}
		return columns;
	}

	public Double get(MetricName name) {
		return switch (name) {
			case PATM -> patm;
			case QOQ_GROWTH -> qoqGrowth;
			case YOY_GROWTH -> yoyGrowth;
			case REVENUE_6YR_CAGR -> revenue6yrCagr;
			case PAT_6YR_CAGR -> pat6yrCagr;
			case CURRENT_PE -> currentPe;
			case PE_2YR_AVG -> pe2yrAvg;
			case PE_5YR_AVG -> pe5yrAvg;
			case PE_2YR_REVAL_DEVAL -> pe2yrRevalDeval;
			case PE_5YR_REVAL_DEVAL -> pe5yrRevalDeval;
			case CURRENT_PR -> currentPr;
			case PR_2YR_AVG -> pr2yrAvg;
			case PR_5YR_AVG -> pr5yrAvg;
			case PR_2YR_REVAL_DEVAL -> pr2yrRevalDeval;
			case PR_5YR_REVAL_DEVAL -> pr5yrRevalDeval;
			case PR_10Q_LOW -> pr10qLow;
			case PR_10Q_HIGH -> pr10qHigh;
			case ALPHA_BOND_CAGR -> alphaBondCagr;
			case ALPHA_ABSOLUTE -> alphaAbsolute;
			case PE_YIELD -> peYield;
			case GROWTH_RATE -> growthRate;
			case BOND_RATE -> bondRate;
		};
	}

	public void set(MetricName name, Double value) {
		switch (name) {
			case PATM -> patm = value;
			case QOQ_GROWTH -> qoqGrowth = value;
			case YOY_GROWTH -> yoyGrowth = value;
			case REVENUE_6YR_CAGR -> revenue6yrCagr = value;
			case PAT_6YR_CAGR -> pat6yrCagr = value;
			case CURRENT_PE -> currentPe = value;
			case PE_2YR_AVG -> pe2yrAvg = value;
			case PE_5YR_AVG -> pe5yrAvg = value;
			case PE_2YR_REVAL_DEVAL -> pe2yrRevalDeval = value;
			case PE_5YR_REVAL_DEVAL -> pe5yrRevalDeval = value;
			case CURRENT_PR -> currentPr = value;
			case PR_2YR_AVG -> pr2yrAvg = value;
			case PR_5YR_AVG -> pr5yrAvg = value;
			case PR_2YR_REVAL_DEVAL -> pr2yrRevalDeval = value;
			case PR_5YR_REVAL_DEVAL -> pr5yrRevalDeval = value;
			case PR_10Q_LOW -> pr10qLow = value;
			case PR_10Q_HIGH -> pr10qHigh = value;
			case ALPHA_BOND_CAGR -> alphaBondCagr = value;
			case ALPHA_ABSOLUTE -> alphaAbsolute = value;
			case PE_YIELD -> peYield = value;
			case GROWTH_RATE -> growthRate = value;
			case BOND_RATE -> bondRate = value;
		}
	}

	public Map<MetricName, Double> toMap() {
		Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
		for (MetricName name : MetricName.values()) {
			values.put(name, get(name));
		}
		return values;
	}
}
