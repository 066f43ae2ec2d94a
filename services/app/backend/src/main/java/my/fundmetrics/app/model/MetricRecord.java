package my.fundmetrics.app.model;

/**
 * Metrics of one stock at one period, ready to be stored for a fund.
 */
public record MetricRecord(Long stockId, PeriodKey period, String periodType, MetricSet metrics) {
	public static final String TYPE_TTM = "ttm";
	public static final String TYPE_QUARTERLY = "quarterly";
}
