package my.fundmetrics.app.dto;

import java.time.LocalDateTime;
import java.util.Map;

public record FundMetricsSummaryDto(Long fundId,
									Map<String, Double> metrics,
									Double weightedValuation,
									Double weightedRevenue,
									Double weightedProfit,
									Integer holdingsCount,
									Integer contributingHoldings,
									LocalDateTime lastUpdated) {
}
