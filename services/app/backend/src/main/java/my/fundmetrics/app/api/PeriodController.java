package my.fundmetrics.app.api;

import my.fundmetrics.app.dto.PeriodRegistryDto;
import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.service.PeriodRegistryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/periods")
public class PeriodController {
	private final PeriodRegistryService periodRegistryService;

	public PeriodController(PeriodRegistryService periodRegistryService) {
		this.periodRegistryService = periodRegistryService;
	}

	@GetMapping
	public PeriodRegistryDto list() {
		return toDto(periodRegistryService.current().asMap());
	}

	/**
	 * Returns only the periods the rebuild added.
	 */
	@PostMapping("/rebuild")
	public PeriodRegistryDto rebuild() {
		return toDto(periodRegistryService.rebuildFromStorage());
	}

	private PeriodRegistryDto toDto(Map<Category, List<PeriodKey>> periods) {
		Map<String, List<String>> labels = new LinkedHashMap<>();
		for (Category category : Category.timeSeries()) {
			List<PeriodKey> keys = periods.get(category);
			if (keys != null && !keys.isEmpty()) {
				labels.put(category.name(), keys.stream().map(PeriodKey::label).toList());
			}
		}
		return new PeriodRegistryDto(labels);
	}
}
