package my.fundmetrics.app.api;

import my.fundmetrics.app.dto.FundCalculationResultDto;
import my.fundmetrics.app.dto.MetricsJobResponseDto;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.service.FundCalculationResult;
import my.fundmetrics.app.service.MetricsCalculationService;
import my.fundmetrics.app.service.MetricsJobService;
import my.fundmetrics.app.service.ProgressListener;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {
	private final MetricsCalculationService calculationService;
	private final MetricsJobService jobService;

	public MetricsController(MetricsCalculationService calculationService, MetricsJobService jobService) {
		this.calculationService = calculationService;
		this.jobService = jobService;
	}

	@PostMapping("/funds/{fundId}/calculate")
	public FundCalculationResultDto calculate(@PathVariable("fundId") Long fundId) {
		FundCalculationResult result = calculationService.calculateFund(fundId, ProgressListener.NONE);
		Map<String, Double> metrics = new LinkedHashMap<>();
		if (result.portfolio() != null) {
			for (MetricName name : MetricName.values()) {
				metrics.put(name.key(), result.portfolio().value(name));
			}
		}
		return new FundCalculationResultDto(result.fundId(), result.fundName(), result.holdings(),
				result.succeeded(), result.partial(), result.failed(), result.metricRecords(), metrics,
				result.error());
	}

	@PostMapping("/jobs")
	public MetricsJobResponseDto startJob(@RequestParam(value = "fundId", required = false) Long fundId) {
		return jobService.start(fundId);
	}

	@GetMapping("/jobs/{sessionId}")
	public MetricsJobResponseDto getJob(@PathVariable("sessionId") String sessionId) {
		return jobService.get(sessionId);
	}

	@PostMapping("/jobs/{sessionId}/cancel")
	public MetricsJobResponseDto cancelJob(@PathVariable("sessionId") String sessionId) {
		return jobService.cancel(sessionId);
	}
}
