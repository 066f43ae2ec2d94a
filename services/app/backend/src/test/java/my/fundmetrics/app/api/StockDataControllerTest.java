package my.fundmetrics.app.api;

import my.fundmetrics.app.dto.StockImportResultDto;
import my.fundmetrics.app.importer.SchemaException;
import my.fundmetrics.app.service.StockExportService;
import my.fundmetrics.app.service.StockImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StockDataControllerTest {
	private StockImportService importService;
	private StockExportService exportService;
	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		importService = mock(StockImportService.class);
		exportService = mock(StockExportService.class);
		mockMvc = MockMvcBuilders.standaloneSetup(new StockDataController(importService, exportService))
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void uploadReturnsImportSummary() throws Exception {
		when(importService.importStockSheet(any(), eq(true))).thenReturn(new StockImportResultDto("SUCCESS", 11L,
				2, 1, 0, 40, Map.of("ttm_revenue", List.of("2024-03-31")), List.of()));
		MockMultipartFile file = new MockMultipartFile("file", "stocks.csv", "text/csv",
				"a,b".getBytes(StandardCharsets.UTF_8));

		mockMvc.perform(multipart("/api/stocks/upload").file(file).param("forceReimport", "true"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.uploadId").value(11))
				.andExpect(jsonPath("$.recordsWritten").value(40))
				.andExpect(jsonPath("$.newPeriods.ttm_revenue[0]").value("2024-03-31"));
	}

	@Test
	void schemaErrorIsUnprocessableWithMissingColumn() throws Exception {
		when(importService.importStockSheet(any(), eq(false)))
				.thenThrow(new SchemaException("accord_code", "Required column accord_code not found"));
		MockMultipartFile file = new MockMultipartFile("file", "stocks.csv", "text/csv",
				"a,b".getBytes(StandardCharsets.UTF_8));

		mockMvc.perform(multipart("/api/stocks/upload").file(file))
				.andExpect(status().isUnprocessableEntity())
				.andExpect(jsonPath("$.missingColumn").value("accord_code"))
				.andExpect(jsonPath("$.path").value("/api/stocks/upload"));
	}

	@Test
	void invalidArgumentIsBadRequestWithoutDetails() throws Exception {
		when(exportService.exportCsv(3)).thenThrow(new IllegalArgumentException("internal detail"));

		mockMvc.perform(get("/api/stocks/export").param("periodsPerCategory", "3"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Invalid request."));
	}

	@Test
	void exportIsServedAsCsvAttachment() throws Exception {
		when(exportService.exportCsv(null)).thenReturn("S. No.,Company Name\n");

		mockMvc.perform(get("/api/stocks/export"))
				.andExpect(status().isOk())
				.andExpect(header().string("Content-Disposition", "attachment; filename=stocks.csv"))
				.andExpect(content().string("S. No.,Company Name\n"));
	}
}
