package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "period_registry")
public class PeriodRegistryEntry {
	@EmbeddedId
	private PeriodRegistryEntryId id;

	@Column(name = "period_kind", nullable = false)
	private String periodKind;

	@Column(name = "registered_at", nullable = false)
	private LocalDateTime registeredAt;

	public PeriodRegistryEntryId getId() {
		return id;
	}

	public void setId(PeriodRegistryEntryId id) {
		this.id = id;
	}

	public String getPeriodKind() {
		return periodKind;
	}

	public void setPeriodKind(String periodKind) {
		this.periodKind = periodKind;
	}

	public LocalDateTime getRegisteredAt() {
		return registeredAt;
	}

	public void setRegisteredAt(LocalDateTime registeredAt) {
		this.registeredAt = registeredAt;
	}
}
