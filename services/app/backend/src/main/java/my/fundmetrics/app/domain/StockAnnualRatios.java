package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "stock_annual_ratios")
public class StockAnnualRatios {
	@EmbeddedId
	private StockPeriodId id;

	@Column(name = "roce")
	private BigDecimal roce;

	@Column(name = "roe")
	private BigDecimal roe;

	@Column(name = "retention")
	private BigDecimal retention;

	public StockPeriodId getId() {
		return id;
	}

	public void setId(StockPeriodId id) {
		this.id = id;
	}

	public BigDecimal getRoce() {
		return roce;
	}

	public void setRoce(BigDecimal roce) {
		this.roce = roce;
	}

	public BigDecimal getRoe() {
		return roe;
	}

	public void setRoe(BigDecimal roe) {
		this.roe = roe;
	}

	public BigDecimal getRetention() {
		return retention;
	}

	public void setRetention(BigDecimal retention) {
		this.retention = retention;
	}
}
