package my.fundmetrics.app.service;

import my.fundmetrics.app.model.PortfolioMetricSet;

/**
 * Outcome of one fund run. {@code error} is set when the fund's results could not be stored.
 */
public record FundCalculationResult(Long fundId,
									String fundName,
									int holdings,
									int succeeded,
									int partial,
									int failed,
									int metricRecords,
									PortfolioMetricSet portfolio,
									String error) {
	public boolean persisted() {
		return error == null;
	}

	FundCalculationResult withError(String message) {
		return new FundCalculationResult(fundId, fundName, holdings, succeeded, partial, failed, metricRecords,
				portfolio, message);
	}
}
