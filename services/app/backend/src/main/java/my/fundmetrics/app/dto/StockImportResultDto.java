package my.fundmetrics.app.dto;

import java.util.List;
import java.util.Map;

public record StockImportResultDto(String status,
								   Long uploadId,
								   int stocksCreated,
								   int stocksUpdated,
								   int rowsSkipped,
								   int recordsWritten,
								   Map<String, List<String>> newPeriods,
								   List<Integer> unparseableColumns) {
}
