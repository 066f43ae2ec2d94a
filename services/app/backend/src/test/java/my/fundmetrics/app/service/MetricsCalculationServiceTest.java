package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.Fund;
import my.fundmetrics.app.domain.FundHolding;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.model.FinancialBasis;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.model.MetricRecord;
import my.fundmetrics.app.model.MetricSet;
import my.fundmetrics.app.model.MetricValue;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.model.TrailingFinancials;
import my.fundmetrics.app.repository.FundHoldingRepository;
import my.fundmetrics.app.repository.FundRepository;
import my.fundmetrics.app.repository.StockRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetricsCalculationServiceTest {
	private static final PeriodKey MARCH = PeriodKey.yearMonth(2024, 3);

	private FundRepository fundRepository;
	private FundHoldingRepository holdingRepository;
	private StockRepository stockRepository;
	private TimeSeriesCacheLoader cacheLoader;
	private MetricsCalculator calculator;
	private MetricsPersistenceService persistenceService;
	private ExecutorService workerPool;
	private MetricsCalculationService service;

	@BeforeEach
	void setUp() {
		fundRepository = mock(FundRepository.class);
		holdingRepository = mock(FundHoldingRepository.class);
		stockRepository = mock(StockRepository.class);
		cacheLoader = mock(TimeSeriesCacheLoader.class);
		calculator = mock(MetricsCalculator.class);
		persistenceService = mock(MetricsPersistenceService.class);
		workerPool = Executors.newFixedThreadPool(2);
		AppProperties properties = new AppProperties(new AppProperties.Sheet(8, 2, 5, 6, 7, 14),
				new AppProperties.Metrics(0.06, 0, 2, 2, 30));
		service = new MetricsCalculationService(fundRepository, holdingRepository, stockRepository, cacheLoader,
				calculator, new WeightedPortfolioAggregator(), persistenceService, workerPool, properties);
	}

	@AfterEach
	void tearDown() {
		workerPool.shutdownNow();
	}

	@Test
	void failingStockDoesNotStopTheFund() {
		Fund fund = fund(1L, "GROWTH", "Growth Fund");
		when(fundRepository.findById(1L)).thenReturn(Optional.of(fund));
		when(holdingRepository.findByFundId(1L)).thenReturn(List.of(
				holding(1L, 10L, "600", null),
				holding(1L, 20L, "400", null),
				holding(1L, 30L, null, "5")));
		when(stockRepository.findAllById(anyCollection())).thenReturn(List.of(
				stock(10L, "Alpha Ltd"), stock(20L, "Beta Ltd"), stock(30L, "Broken Ltd")));
		when(cacheLoader.load(anyCollection())).thenReturn(Map.of(
				10L, withTrailing(10L),
				20L, TimeSeriesBundle.empty(20L),
				30L, withTrailing(30L)));
		when(calculator.compute(eq("Alpha Ltd"), any(), any())).thenReturn(complete(new FinancialBasis(1000, 500, 50)));
		when(calculator.compute(eq("Beta Ltd"), any(), any())).thenReturn(MetricSet.noData());
		when(calculator.compute(eq("Broken Ltd"), any(), any())).thenThrow(new IllegalStateException("boom"));
		List<ProgressUpdate> updates = new ArrayList<>();

		FundCalculationResult result = service.calculateFund(1L, updates::add);

		assertThat(result.holdings()).isEqualTo(3);
		assertThat(result.succeeded()).isEqualTo(1);
		assertThat(result.partial()).isEqualTo(1);
		assertThat(result.failed()).isEqualTo(1);
		assertThat(result.metricRecords()).isEqualTo(1);
		assertThat(result.persisted()).isTrue();
		assertThat(result.portfolio().contributingHoldings()).isEqualTo(2);
		assertThat(result.portfolio().weights()).containsEntry(10L, 0.6).containsEntry(20L, 0.4).containsEntry(30L, 0.0);
		assertThat(result.portfolio().value(MetricName.QOQ_GROWTH)).isGreaterThan(0.0);

		@SuppressWarnings("unchecked")
		ArgumentCaptor<List<MetricRecord>> records = ArgumentCaptor.forClass(List.class);
		verify(persistenceService).persistMetrics(eq(1L), records.capture());
		assertThat(records.getValue()).singleElement().satisfies(record -> {
			assertThat(record.stockId()).isEqualTo(10L);
			assertThat(record.period()).isEqualTo(MARCH);
			assertThat(record.periodType()).isEqualTo(MetricRecord.TYPE_TTM);
		});
		verify(persistenceService).persistSummary(eq(1L), any());

		assertThat(updates).filteredOn(update -> update.level() == ProgressUpdate.Level.ENTITY)
				.extracting(ProgressUpdate::processedCount)
				.containsExactly(1, 2, 3, 3);
		assertThat(updates.get(updates.size() - 1).status()).isEqualTo(ProgressUpdate.STATUS_COMPLETED);
	}

	@Test
	void holdingWithoutMarketValueGetsNoWeight() {
		givenFund(holding(1L, 10L, "1000000", "50"), holding(1L, 20L, null, "50"));

		FundCalculationResult result = service.calculateFund(1L, ProgressListener.NONE);

		assertThat(result.portfolio().weights()).containsEntry(10L, 1.0).containsEntry(20L, 0.0);
		assertThat(result.portfolio().contributingHoldings()).isEqualTo(1);
	}

	@Test
	void fundWithoutMarketValuesIsWeightedByHoldingPercentage() {
		givenFund(holding(1L, 10L, null, "30"), holding(1L, 20L, null, "10"));

		FundCalculationResult result = service.calculateFund(1L, ProgressListener.NONE);

		assertThat(result.portfolio().weights()).containsEntry(10L, 0.75).containsEntry(20L, 0.25);
		assertThat(result.portfolio().totalWeight()).isCloseTo(1.0, within(1e-9));
	}

	@Test
	void unknownFundIsRejected() {
		when(fundRepository.findById(9L)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.calculateFund(9L, null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Fund not found");
	}

	@Test
	void batchStopsBetweenFundsWhenCancelled() {
		when(fundRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(
				fund(1L, "A", "Alpha Fund"), fund(2L, "B", "Beta Fund")));
		when(holdingRepository.findByFundId(any())).thenReturn(List.of());
		AtomicInteger checks = new AtomicInteger();
		List<ProgressUpdate> updates = new ArrayList<>();

		BatchCalculationResult batch = service.calculateAll(updates::add, () -> checks.incrementAndGet() > 1);

		assertThat(batch.cancelled()).isTrue();
		assertThat(batch.totalFunds()).isEqualTo(2);
		assertThat(batch.funds()).extracting(FundCalculationResult::fundId).containsExactly(1L);
		verify(persistenceService, never()).persistSummary(eq(2L), any());
		assertThat(updates.get(updates.size() - 1).status()).isEqualTo(ProgressUpdate.STATUS_CANCELLED);
		assertThat(updates.get(updates.size() - 1).fundName()).isEqualTo("Beta Fund");
	}

	@Test
	void persistenceFailureIsRecordedAndBatchContinues() {
		when(fundRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(
				fund(1L, "A", "Alpha Fund"), fund(2L, "B", "Beta Fund")));
		when(holdingRepository.findByFundId(any())).thenReturn(List.of());
		when(persistenceService.persistMetrics(eq(1L), anyList()))
				.thenThrow(new MetricsPersistenceException(1L, "Failed to write metric records for fund 1", null));

		BatchCalculationResult batch = service.calculateAll(null, () -> false);

		assertThat(batch.cancelled()).isFalse();
		assertThat(batch.funds()).hasSize(2);
		assertThat(batch.funds().get(0).persisted()).isFalse();
		assertThat(batch.funds().get(0).error()).contains("fund 1");
		assertThat(batch.funds().get(1).persisted()).isTrue();
		assertThat(batch.failedFunds()).isEqualTo(1);
	}

	@Test
	void unexpectedFundFailureGetsReference() {
		when(fundRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(fund(1L, "A", "Alpha Fund")));
		when(holdingRepository.findByFundId(1L)).thenThrow(new IllegalStateException("database gone"));

		BatchCalculationResult batch = service.calculateAll(ProgressListener.NONE, () -> false);

		assertThat(batch.funds()).singleElement()
				.satisfies(result -> assertThat(result.error()).startsWith("Error ref MC-"));
	}

	private void givenFund(FundHolding... holdings) {
		when(fundRepository.findById(1L)).thenReturn(Optional.of(fund(1L, "MIX", "Mixed Fund")));
		when(holdingRepository.findByFundId(1L)).thenReturn(List.of(holdings));
		when(stockRepository.findAllById(anyCollection())).thenReturn(List.of(stock(10L, "Alpha Ltd"), stock(20L, "Beta Ltd")));
		when(cacheLoader.load(anyCollection())).thenReturn(Map.of());
		when(calculator.compute(any(), any(), any())).thenReturn(complete(new FinancialBasis(1000, 500, 50)));
	}

	private static MetricSet complete(FinancialBasis basis) {
		Map<MetricName, MetricValue> values = new EnumMap<>(MetricName.class);
		for (MetricName name : MetricName.values()) {
			values.put(name, MetricValue.of(0.1));
		}
		return MetricSet.of(values, basis);
	}

	private static TimeSeriesBundle withTrailing(Long stockId) {
		return new TimeSeriesBundle(stockId, List.of(),
				List.of(new TrailingFinancials(MARCH, 100.0, null, 10.0, null)), List.of(), List.of(), List.of());
	}

	private static Fund fund(Long id, String code, String name) {
		Fund fund = new Fund();
		fund.setFundId(id);
		fund.setFundCode(code);
		fund.setName(name);
		fund.setActive(true);
		return fund;
	}

	private static FundHolding holding(Long fundId, Long stockId, String marketValue, String percentage) {
		FundHolding holding = new FundHolding();
		holding.setFundId(fundId);
		holding.setStockId(stockId);
		holding.setMarketValue(marketValue == null ? null : new BigDecimal(marketValue));
		holding.setHoldingPercentage(percentage == null ? null : new BigDecimal(percentage));
		return holding;
	}

	private static Stock stock(Long id, String name) {
		Stock stock = new Stock();
		stock.setStockId(id);
		stock.setCompanyName(name);
		return stock;
	}
}
