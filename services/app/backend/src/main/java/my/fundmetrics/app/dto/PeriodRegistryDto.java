package my.fundmetrics.app.dto;

import java.util.List;
import java.util.Map;

/**
 * Registered period labels per category, most recent first.
 */
public record PeriodRegistryDto(Map<String, List<String>> periods) {
}
