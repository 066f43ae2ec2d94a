package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockTtmFinancials;
import my.fundmetrics.app.domain.StockUploadLog;
import my.fundmetrics.app.domain.StockValuation;
import my.fundmetrics.app.dto.StockImportResultDto;
import my.fundmetrics.app.importer.SchemaException;
import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.repository.StockAnnualRatiosRepository;
import my.fundmetrics.app.repository.StockPriceRepository;
import my.fundmetrics.app.repository.StockQuarterlyFinancialsRepository;
import my.fundmetrics.app.repository.StockRepository;
import my.fundmetrics.app.repository.StockTtmFinancialsRepository;
import my.fundmetrics.app.repository.StockUploadLogRepository;
import my.fundmetrics.app.repository.StockValuationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockImportServiceTest {
	private static final int WIDTH = 18;

	@Mock
	private StockRepository stockRepository;

	@Mock
	private StockValuationRepository valuationRepository;

	@Mock
	private StockTtmFinancialsRepository ttmRepository;

	@Mock
	private StockQuarterlyFinancialsRepository quarterlyRepository;

	@Mock
	private StockAnnualRatiosRepository annualRatiosRepository;

	@Mock
	private StockPriceRepository priceRepository;

	@Mock
	private StockUploadLogRepository uploadLogRepository;

	@Mock
	private PeriodRegistryService periodRegistryService;

	private StockImportService service;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(new AppProperties.Sheet(8, 2, 5, 6, 7, 14),
				new AppProperties.Metrics(0.06, 0, 2, 2, 30));
		service = new StockImportService(stockRepository, valuationRepository, ttmRepository, quarterlyRepository,
				annualRatiosRepository, priceRepository, uploadLogRepository, periodRegistryService, properties);
	}

	@Test
	void importsStocksAndTimeSeries() {
		Stock wipro = new Stock();
		wipro.setStockId(2L);
		wipro.setAccordCode("WIP01");
		wipro.setCompanyName("Wipro Old");
		wipro.setSector("Software");
		when(stockRepository.findByAccordCodeIn(anyCollection())).thenReturn(List.of(wipro));
		when(stockRepository.saveAll(any())).thenAnswer(invocation -> {
			List<Stock> stocks = invocation.getArgument(0);
			for (Stock stock : stocks) {
				if (stock.getStockId() == null) {
					stock.setStockId(1L);
				}
			}
			return stocks;
		});
		when(periodRegistryService.register(anyMap()))
				.thenReturn(Map.of(Category.TTM_REVENUE, List.of(PeriodKey.yearMonth(2024, 3))));
		when(uploadLogRepository.save(any(StockUploadLog.class))).thenAnswer(invocation -> {
			StockUploadLog log = invocation.getArgument(0);
			log.setUploadId(42L);
			return log;
		});
		MockMultipartFile file = csvFile(sheet(true,
				data("1", "Infosys", "INF01", "IT", "500", "450", "10000"),
				data("2", "Wipro", "WIP01", "", "300", "", "NA"),
				data("XX", "Sample Ltd", "SAMPLE", "", "1", "1", "1")));

		StockImportResultDto result = service.importStockSheet(file, false);

		assertThat(result.status()).isEqualTo("imported");
		assertThat(result.uploadId()).isEqualTo(42L);
		assertThat(result.stocksCreated()).isEqualTo(1);
		assertThat(result.stocksUpdated()).isEqualTo(1);
		assertThat(result.rowsSkipped()).isEqualTo(1);
		assertThat(result.recordsWritten()).isEqualTo(4);
		assertThat(result.newPeriods()).containsEntry("TTM_REVENUE", List.of("202403"));
		assertThat(result.unparseableColumns()).isEmpty();
		assertThat(wipro.getCompanyName()).isEqualTo("Wipro");
		assertThat(wipro.getSector()).isEqualTo("Software");

		@SuppressWarnings("unchecked")
		ArgumentCaptor<List<StockTtmFinancials>> ttm = ArgumentCaptor.forClass(List.class);
		verify(ttmRepository).saveAll(ttm.capture());
		assertThat(ttm.getValue()).hasSize(3);
		assertThat(ttm.getValue())
				.filteredOn(row -> row.getId().equals(new StockPeriodId(1L, "202403")))
				.singleElement()
				.satisfies(row -> assertThat(row.getTtmRevenue()).isEqualByComparingTo(new BigDecimal("500")));

		@SuppressWarnings("unchecked")
		ArgumentCaptor<List<StockValuation>> valuations = ArgumentCaptor.forClass(List.class);
		verify(valuationRepository).saveAll(valuations.capture());
		assertThat(valuations.getValue()).singleElement()
				.satisfies(row -> assertThat(row.getId().getPeriodKey()).isEqualTo("2024-03-31"));
		verify(quarterlyRepository, never()).saveAll(any());
	}

	@Test
	void schemaErrorWritesNothing() {
		MockMultipartFile file = csvFile(sheet(false, data("1", "Infosys", "INF01", "IT", "500", "450", "10000")));

		assertThatThrownBy(() -> service.importStockSheet(file, false))
				.isInstanceOf(SchemaException.class)
				.hasMessageContaining("accord_code");

		verifyNoInteractions(periodRegistryService, stockRepository, valuationRepository, ttmRepository,
				quarterlyRepository, annualRatiosRepository, priceRepository);
		verify(uploadLogRepository, never()).save(any());
	}

	@Test
	void identicalFileIsSkippedUnlessForced() {
		StockUploadLog previous = new StockUploadLog();
		previous.setUploadId(7L);
		when(uploadLogRepository.findFirstByFileHashAndStatus(anyString(), eq("imported")))
				.thenReturn(Optional.of(previous));
		MockMultipartFile file = csvFile(sheet(true, data("1", "Infosys", "INF01", "IT", "500", "450", "10000")));

		StockImportResultDto result = service.importStockSheet(file, false);

		assertThat(result.status()).isEqualTo("skipped");
		assertThat(result.uploadId()).isEqualTo(7L);
		verifyNoInteractions(periodRegistryService, stockRepository);
	}

	@Test
	void emptyFileIsRejected() {
		MockMultipartFile file = new MockMultipartFile("file", "stocks.csv", "text/csv", new byte[0]);

		assertThatThrownBy(() -> service.importStockSheet(file, true))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("File is empty");
	}

	@Test
	void readRowsHandlesSemicolonSheets() {
		List<List<String>> rows = service.readRows("a;b;c\n1;\"2;5\";3\n".getBytes(StandardCharsets.UTF_8));

		assertThat(rows).containsExactly(List.of("a", "b", "c"), List.of("1", "2;5", "3"));
	}

	private static MockMultipartFile csvFile(String content) {
		return new MockMultipartFile("file", "stocks.csv", "text/csv", content.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Identity block, a two-period TTM revenue block and a one-period market cap block.
	 */
	@SafeVarargs
	private static String sheet(boolean withAccordCode, List<String>... dataRows) {
		List<List<String>> rows = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			rows.add(new ArrayList<>(Collections.nCopies(WIDTH, "")));
		}
		List<FixedColumn> identity = FixedColumn.of(Category.IDENTITY);
		for (int col = 0; col < identity.size(); col++) {
			rows.get(6).set(col, identity.get(col).subLabel());
			rows.get(7).set(col, identity.get(col).label());
		}
		if (!withAccordCode) {
			rows.get(7).set(2, "");
		}
		rows.get(5).set(14, "TTM Revenue");
		rows.get(7).set(14, "202403");
		rows.get(7).set(15, "202312");
		rows.get(5).set(17, "Market Cap");
		rows.get(7).set(17, "2024-03-31");
		rows.addAll(List.of(dataRows));

		StringBuilder csv = new StringBuilder();
		for (List<String> row : rows) {
			csv.append(String.join(",", row)).append("\n");
		}
		return csv.toString();
	}

	private static List<String> data(String serial, String name, String code, String sector, String ttmLatest,
									 String ttmPrevious, String marketCap) {
		List<String> row = new ArrayList<>(Collections.nCopies(WIDTH, ""));
		row.set(0, serial);
		row.set(1, name);
		row.set(2, code);
		row.set(3, sector);
		row.set(14, ttmLatest);
		row.set(15, ttmPrevious);
		row.set(17, marketCap);
		return row;
	}
}
