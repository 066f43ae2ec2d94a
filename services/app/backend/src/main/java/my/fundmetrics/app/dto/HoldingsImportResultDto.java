package my.fundmetrics.app.dto;

import java.util.List;

public record HoldingsImportResultDto(Long fundId,
									  boolean fundCreated,
									  int holdingsCreated,
									  int holdingsUpdated,
									  int holdingsRemoved,
									  List<String> unknownStocks) {
}
