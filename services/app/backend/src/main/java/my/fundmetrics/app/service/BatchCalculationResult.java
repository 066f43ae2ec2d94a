package my.fundmetrics.app.service;

import java.util.List;

public record BatchCalculationResult(List<FundCalculationResult> funds, int totalFunds, boolean cancelled) {
	public BatchCalculationResult {
		funds = List.copyOf(funds);
	}

	public int succeeded() {
		return funds.stream().mapToInt(FundCalculationResult::succeeded).sum();
	}

	public int partial() {
		return funds.stream().mapToInt(FundCalculationResult::partial).sum();
	}

	public int failed() {
		return funds.stream().mapToInt(FundCalculationResult::failed).sum();
	}

	public int failedFunds() {
		return (int) funds.stream().filter(result -> !result.persisted()).count();
	}
}
