package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "fund_metrics_summary")
public class FundMetricsSummary {
	@Id
	@Column(name = "fund_id")
	private Long fundId;

	@Embedded
	private MetricColumns metrics;

	@Column(name = "weighted_valuation")
	private Double weightedValuation;

	@Column(name = "weighted_revenue")
	private Double weightedRevenue;

	@Column(name = "weighted_profit")
	private Double weightedProfit;

	@Column(name = "holdings_count", nullable = false)
	private Integer holdingsCount;

	@Column(name = "contributing_holdings", nullable = false)
	private Integer contributingHoldings;

	@Column(name = "last_updated", nullable = false)
	private LocalDateTime lastUpdated;

	public Long getFundId() {
		return fundId;
	}

	public void setFundId(Long fundId) {
		this.fundId = fundId;
	}

	public MetricColumns getMetrics() {
		return metrics;
	}

	public void setMetrics(MetricColumns metrics) {
		this.metrics = metrics;
	}

	public Double getWeightedValuation() {
		return weightedValuation;
	}

	public void setWeightedValuation(Double weightedValuation) {
		this.weightedValuation = weightedValuation;
	}

	public Double getWeightedRevenue() {
		return weightedRevenue;
	}

	public void setWeightedRevenue(Double weightedRevenue) {
		this.weightedRevenue = weightedRevenue;
	}

	public Double getWeightedProfit() {
		return weightedProfit;
	}

	public void setWeightedProfit(Double weightedProfit) {
		this.weightedProfit = weightedProfit;
	}

	public Integer getHoldingsCount() {
		return holdingsCount;
	}

	public void setHoldingsCount(Integer holdingsCount) {
		this.holdingsCount = holdingsCount;
	}

	public Integer getContributingHoldings() {
		return contributingHoldings;
	}

	public void setContributingHoldings(Integer contributingHoldings) {
		this.contributingHoldings = contributingHoldings;
	}

	public LocalDateTime getLastUpdated() {
		return lastUpdated;
	}

	public void setLastUpdated(LocalDateTime lastUpdated) {
		this.lastUpdated = lastUpdated;
	}
}
