package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_valuations")
public class StockValuation {
	@EmbeddedId
	private StockPeriodId id;

	@Column(name = "market_cap")
	private BigDecimal marketCap;

	@Column(name = "market_cap_free_float")
	private BigDecimal marketCapFreeFloat;

	public StockPeriodId getId() {
		return id;
	}

	public void setId(StockPeriodId id) {
		this.id = id;
	}

	public BigDecimal getMarketCap() {
		return marketCap;
	}

	public void setMarketCap(BigDecimal marketCap) {
		this.marketCap = marketCap;
	}

	public BigDecimal getMarketCapFreeFloat() {
		return marketCapFreeFloat;
	}

	public void setMarketCapFreeFloat(BigDecimal marketCapFreeFloat) {
		this.marketCapFreeFloat = marketCapFreeFloat;
	}
}
