package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class StockPeriodId implements Serializable {
	@Column(name = "stock_id")
	private Long stockId;

	@Column(name = "period_key")
	private String periodKey;

	public StockPeriodId() {
	}

	public StockPeriodId(Long stockId, String periodKey) {
		this.stockId = stockId;
		this.periodKey = periodKey;
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

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		StockPeriodId that = (StockPeriodId) o;
		return Objects.equals(stockId, that.stockId) && Objects.equals(periodKey, that.periodKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(stockId, periodKey);
	}
}
