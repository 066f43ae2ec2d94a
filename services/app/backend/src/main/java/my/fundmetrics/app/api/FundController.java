package my.fundmetrics.app.api;

import jakarta.validation.Valid;
import my.fundmetrics.app.dto.FundCreateRequest;
import my.fundmetrics.app.dto.FundDto;
import my.fundmetrics.app.dto.FundMetricsSummaryDto;
import my.fundmetrics.app.dto.HoldingsImportResultDto;
import my.fundmetrics.app.service.FundService;
import my.fundmetrics.app.service.HoldingsImportService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/funds")
public class FundController {
	private final FundService fundService;
	private final HoldingsImportService holdingsImportService;

	public FundController(FundService fundService, HoldingsImportService holdingsImportService) {
		this.fundService = fundService;
		this.holdingsImportService = holdingsImportService;
	}

	@GetMapping
	public List<FundDto> list() {
		return fundService.list();
	}

	@PostMapping
	public FundDto create(@Valid @RequestBody FundCreateRequest request) {
		return fundService.create(request);
	}

	@PostMapping(path = "/{fundCode}/holdings", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public HoldingsImportResultDto importHoldings(@PathVariable("fundCode") String fundCode,
												  @RequestParam(value = "fundName", required = false) String fundName,
												  @RequestParam("file") MultipartFile file) {
		return holdingsImportService.importHoldings(fundCode, fundName, file);
	}

	@GetMapping("/{fundId}/metrics-summary")
	public FundMetricsSummaryDto metricsSummary(@PathVariable("fundId") Long fundId) {
		return fundService.summary(fundId);
	}
}
