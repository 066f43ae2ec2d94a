package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_quarterly_financials")
public class StockQuarterlyFinancials {
	@EmbeddedId
	private StockPeriodId id;

	@Column(name = "quarterly_revenue")
	private BigDecimal quarterlyRevenue;

	@Column(name = "quarterly_revenue_free_float")
	private BigDecimal quarterlyRevenueFreeFloat;

	@Column(name = "quarterly_pat")
	private BigDecimal quarterlyPat;

	@Column(name = "quarterly_pat_free_float")
	private BigDecimal quarterlyPatFreeFloat;

	public StockPeriodId getId() {
		return id;
	}

	public void setId(StockPeriodId id) {
		this.id = id;
	}

	public BigDecimal getQuarterlyRevenue() {
		return quarterlyRevenue;
	}

	public void setQuarterlyRevenue(BigDecimal quarterlyRevenue) {
		this.quarterlyRevenue = quarterlyRevenue;
	}

	public BigDecimal getQuarterlyRevenueFreeFloat() {
		return quarterlyRevenueFreeFloat;
	}

	public void setQuarterlyRevenueFreeFloat(BigDecimal quarterlyRevenueFreeFloat) {
		this.quarterlyRevenueFreeFloat = quarterlyRevenueFreeFloat;
	}

	public BigDecimal getQuarterlyPat() {
		return quarterlyPat;
	}

	public void setQuarterlyPat(BigDecimal quarterlyPat) {
		this.quarterlyPat = quarterlyPat;
	}

	public BigDecimal getQuarterlyPatFreeFloat() {
		return quarterlyPatFreeFloat;
	}

	public void setQuarterlyPatFreeFloat(BigDecimal quarterlyPatFreeFloat) {
		this.quarterlyPatFreeFloat = quarterlyPatFreeFloat;
	}
}
