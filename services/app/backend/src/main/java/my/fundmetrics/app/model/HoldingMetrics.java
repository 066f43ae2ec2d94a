package my.fundmetrics.app.model;

import java.math.BigDecimal;

/**
 * One holding handed to the portfolio aggregator: the stock, the value its weight is derived from and
 * the stock's latest metrics.
 */
public record HoldingMetrics(Long stockId, String stockName, BigDecimal marketValue, MetricSet metrics) {
}
