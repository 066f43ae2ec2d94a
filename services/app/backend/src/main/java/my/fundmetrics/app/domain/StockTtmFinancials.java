package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_ttm_financials")
public class StockTtmFinancials {
	@EmbeddedId
	private StockPeriodId id;

	@Column(name = "ttm_revenue")
	private BigDecimal ttmRevenue;

	@Column(name = "ttm_revenue_free_float")
	private BigDecimal ttmRevenueFreeFloat;

	@Column(name = "ttm_pat")
	private BigDecimal ttmPat;

	@Column(name = "ttm_pat_free_float")
	private BigDecimal ttmPatFreeFloat;

	public StockPeriodId getId() {
		return id;
	}

	public void setId(StockPeriodId id) {
		this.id = id;
	}

	public BigDecimal getTtmRevenue() {
		return ttmRevenue;
	}

	public void setTtmRevenue(BigDecimal ttmRevenue) {
		this.ttmRevenue = ttmRevenue;
	}

	public BigDecimal getTtmRevenueFreeFloat() {
		return ttmRevenueFreeFloat;
	}

	public void setTtmRevenueFreeFloat(BigDecimal ttmRevenueFreeFloat) {
		this.ttmRevenueFreeFloat = ttmRevenueFreeFloat;
	}

	public BigDecimal getTtmPat() {
		return ttmPat;
	}

	public void setTtmPat(BigDecimal ttmPat) {
		this.ttmPat = ttmPat;
	}

	public BigDecimal getTtmPatFreeFloat() {
		return ttmPatFreeFloat;
	}

	public void setTtmPatFreeFloat(BigDecimal ttmPatFreeFloat) {
		this.ttmPatFreeFloat = ttmPatFreeFloat;
	}
}
