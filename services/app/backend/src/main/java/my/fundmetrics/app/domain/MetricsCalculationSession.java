package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "metrics_calculation_sessions")
public class MetricsCalculationSession {
	@Id
	@Column(name = "session_id")
	private String sessionId;

	@Column(name = "status", nullable = false)
	private String status;

	@Column(name = "fund_id")
	private Long fundId;

	@Column(name = "total_funds", nullable = false)
	private Integer totalFunds;

	@Column(name = "processed_funds", nullable = false)
	private Integer processedFunds;

	@Column(name = "current_fund_name")
	private String currentFundName;

	@Column(name = "current_stock_name")
	private String currentStockName;

	@Column(name = "progress_percentage", nullable = false)
	private Double progressPercentage;

	@Column(name = "succeeded_entities", nullable = false)
	private Integer succeededEntities;

	@Column(name = "partial_entities", nullable = false)
	private Integer partialEntities;

	@Column(name = "failed_entities", nullable = false)
	private Integer failedEntities;

	@Column(name = "error_message")
	private String errorMessage;

	@Column(name = "started_at", nullable = false)
	private LocalDateTime startedAt;

	@Column(name = "completed_at")
	private LocalDateTime completedAt;

	public String getSessionId() {
		return sessionId;
	}

	public void setSessionId(String sessionId) {
		this.sessionId = sessionId;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public Long getFundId() {
		return fundId;
	}

	public void setFundId(Long fundId) {
		this.fundId = fundId;
	}

	public Integer getTotalFunds() {
		return totalFunds;
	}

	public void setTotalFunds(Integer totalFunds) {
		this.totalFunds = totalFunds;
	}

	public Integer getProcessedFunds() {
		return processedFunds;
	}

	public void setProcessedFunds(Integer processedFunds) {
		this.processedFunds = processedFunds;
	}

	public String getCurrentFundName() {
		return currentFundName;
	}

	public void setCurrentFundName(String currentFundName) {
		this.currentFundName = currentFundName;
	}

	public String getCurrentStockName() {
		return currentStockName;
	}

	public void setCurrentStockName(String currentStockName) {
		this.currentStockName = currentStockName;
	}

	public Double getProgressPercentage() {
		return progressPercentage;
	}

	public void setProgressPercentage(Double progressPercentage) {
		this.progressPercentage = progressPercentage;
	}

	public Integer getSucceededEntities() {
		return succeededEntities;
	}

	public void setSucceededEntities(Integer succeededEntities) {
		this.succeededEntities = succeededEntities;
	}

	public Integer getPartialEntities() {
		return partialEntities;
	}

	public void setPartialEntities(Integer partialEntities) {
		this.partialEntities = partialEntities;
	}

	public Integer getFailedEntities() {
		return failedEntities;
	}

	public void setFailedEntities(Integer failedEntities) {
		this.failedEntities = failedEntities;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public void setErrorMessage(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getCompletedAt() {
		return completedAt;
	}

	public void setCompletedAt(LocalDateTime completedAt) {
		this.completedAt = completedAt;
	}
}
