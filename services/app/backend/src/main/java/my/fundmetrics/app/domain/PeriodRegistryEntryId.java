package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class PeriodRegistryEntryId implements Serializable {
	@Column(name = "category")
	private String category;

	@Column(name = "period_key")
	private String periodKey;

	public PeriodRegistryEntryId() {
	}

	public PeriodRegistryEntryId(String category, String periodKey) {
		this.category = category;
		this.periodKey = periodKey;
	}

	public String getCategory() {
		return category;
	}

	public void setCategory(String category) {
		this.category = category;
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
		PeriodRegistryEntryId that = (PeriodRegistryEntryId) o;
		return Objects.equals(category, that.category) && Objects.equals(periodKey, that.periodKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(category, periodKey);
	}
}
