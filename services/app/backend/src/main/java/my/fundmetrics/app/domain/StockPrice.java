package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_prices")
public class StockPrice {
	@EmbeddedId
	private StockPeriodId id;

	@Column(name = "share_price")
	private BigDecimal sharePrice;

	@Column(name = "pr_ratio")
	private BigDecimal prRatio;

	@Column(name = "pe_ratio")
	private BigDecimal peRatio;

	public StockPeriodId getId() {
		return id;
	}

	public void setId(StockPeriodId id) {
		this.id = id;
	}

	public BigDecimal getSharePrice() {
		return sharePrice;
	}

	public void setSharePrice(BigDecimal sharePrice) {
		this.sharePrice = sharePrice;
	}

	public BigDecimal getPrRatio() {
		return prRatio;
	}

	public void setPrRatio(BigDecimal prRatio) {
		this.prRatio = prRatio;
	}

	public BigDecimal getPeRatio() {
		return peRatio;
	}

	public void setPeRatio(BigDecimal peRatio) {
		this.peRatio = peRatio;
	}
}
