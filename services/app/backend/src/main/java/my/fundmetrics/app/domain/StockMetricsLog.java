package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "stock_metrics_log")
public class StockMetricsLog {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "metrics_id")
	private Long metricsId;

	@Column(name = "fund_id", nullable = false)
	private Long fundId;

	@Column(name = "stock_id", nullable = false)
	private Long stockId;

	@Column(name = "period_key", nullable = false)
	private String periodKey;

	@Column(name = "period_type", nullable = false)
	private String periodType;

	@Embedded
	private MetricColumns metrics;

	@Column(name = "outcome", nullable = false)
	private String outcome;

	@Column(name = "calculated_at", nullable = false)
	private LocalDateTime calculatedAt;

	public Long getMetricsId() {
		return metricsId;
	}

	public void setMetricsId(Long metricsId) {
		this.metricsId = metricsId;
	}

	public Long getFundId() {
		return fundId;
	}

	public void setFundId(Long fundId) {
		this.fundId = fundId;
	}

	public Long getStockId() {
		return stockId;
	}

	public void setStockId(Long stockId) {
		this.stockId = stockId;
	}

	public String getPeriodKey() {
		return periodKey;
	}

	public void setPeriodKey(String periodKey) {
		this.periodKey = periodKey;
	}

	public String getPeriodType() {
		return periodType;
	}

	public void setPeriodType(String periodType) {
		this.periodType = periodType;
	}

	public MetricColumns getMetrics() {
		return metrics;
	}

	public void setMetrics(MetricColumns metrics) {
		this.metrics = metrics;
	}

	public String getOutcome() {
		return outcome;
	}

	public void setOutcome(String outcome) {
		this.outcome = outcome;
	}

	public LocalDateTime getCalculatedAt() {
		return calculatedAt;
	}

	public void setCalculatedAt(LocalDateTime calculatedAt) {
		this.calculatedAt = calculatedAt;
	}
}
