package my.fundmetrics.app.dto;

import java.util.Map;

public record FundCalculationResultDto(Long fundId,
									   String fundName,
									   int holdings,
									   int succeededEntities,
									   int partialEntities,
									   int failedEntities,
									   int metricRecords,
									   Map<String, Double> portfolioMetrics,
									   String error) {
}
