package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "fund_holdings")
public class FundHolding {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "holding_id")
	private Long holdingId;

	@Column(name = "fund_id", nullable = false)
	private Long fundId;

	@Column(name = "stock_id", nullable = false)
	private Long stockId;

	@Column(name = "holding_percentage")
	private BigDecimal holdingPercentage;

	@Column(name = "market_value")
	private BigDecimal marketValue;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getHoldingId() {
		return holdingId;
	}

	public void setHoldingId(Long holdingId) {
		this.holdingId = holdingId;
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

	public BigDecimal getHoldingPercentage() {
		return holdingPercentage;
	}

	public void setHoldingPercentage(BigDecimal holdingPercentage) {
		this.holdingPercentage = holdingPercentage;
	}

	public BigDecimal getMarketValue() {
		return marketValue;
	}

	public void setMarketValue(BigDecimal marketValue) {
		this.marketValue = marketValue;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
