package my.fundmetrics.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricsJobResponseDto(
		@JsonProperty("session_id") String sessionId,
		@JsonProperty("status") MetricsJobStatus status,
		@JsonProperty("fund_id") Long fundId,
		@JsonProperty("total_funds") int totalFunds,
		@JsonProperty("processed_funds") int processedFunds,
		@JsonProperty("current_fund_name") String currentFundName,
		@JsonProperty("current_stock_name") String currentStockName,
		@JsonProperty("progress_percentage") double progressPercentage,
		@JsonProperty("succeeded_entities") int succeededEntities,
		@JsonProperty("partial_entities") int partialEntities,
		@JsonProperty("failed_entities") int failedEntities,
		@JsonProperty("error") String error
) {
}
