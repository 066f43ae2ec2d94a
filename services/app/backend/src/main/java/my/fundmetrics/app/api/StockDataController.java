package my.fundmetrics.app.api;

import my.fundmetrics.app.dto.StockImportResultDto;
import my.fundmetrics.app.service.StockExportService;
import my.fundmetrics.app.service.StockImportService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/stocks")
public class StockDataController {
	private final StockImportService importService;
	private final StockExportService exportService;

	public StockDataController(StockImportService importService, StockExportService exportService) {
		this.importService = importService;
		this.exportService = exportService;
	}

	@PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public StockImportResultDto upload(@RequestParam("file") MultipartFile file,
									   @RequestParam(value = "forceReimport", defaultValue = "false") boolean forceReimport) {
		return importService.importStockSheet(file, forceReimport);
	}

	@GetMapping("/export")
	public ResponseEntity<byte[]> export(@RequestParam(value = "periodsPerCategory", required = false) Integer periodsPerCategory) {
		String csv = exportService.exportCsv(periodsPerCategory);
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=stocks.csv")
				.contentType(MediaType.parseMediaType("text/csv"))
				.body(csv.getBytes(StandardCharsets.UTF_8));
	}
}
