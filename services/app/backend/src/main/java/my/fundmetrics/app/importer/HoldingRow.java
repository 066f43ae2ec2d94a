package my.fundmetrics.app.importer;

import java.math.BigDecimal;

public record HoldingRow(
		String accordCode,
		String isin,
		String companyName,
		BigDecimal holdingPercentage,
		BigDecimal marketValue
) {
}
