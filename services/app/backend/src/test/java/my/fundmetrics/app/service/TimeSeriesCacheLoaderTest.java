package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockTtmFinancials;
import my.fundmetrics.app.domain.StockValuation;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.repository.StockAnnualRatiosRepository;
import my.fundmetrics.app.repository.StockPriceRepository;
import my.fundmetrics.app.repository.StockQuarterlyFinancialsRepository;
import my.fundmetrics.app.repository.StockTtmFinancialsRepository;
import my.fundmetrics.app.repository.StockValuationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeSeriesCacheLoaderTest {
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

	@InjectMocks
	private TimeSeriesCacheLoader loader;

	@Test
	void loadsEveryKindWithOneQueryAndGroupsByStock() {
		when(valuationRepository.findByIdStockIdIn(anyCollection())).thenReturn(List.of(
				valuation(1L, "2023-12-31", "900"),
				valuation(1L, "2024-03-31", "1000"),
				valuation(2L, "2024-03-31", "50")));
		when(ttmRepository.findByIdStockIdIn(anyCollection())).thenReturn(List.of(
				ttm(1L, "202403", "500"),
				ttm(1L, "not-a-period", "1")));

		Map<Long, TimeSeriesBundle> bundles = loader.load(Arrays.asList(1L, 2L, 3L, null, 1L));

		assertThat(bundles).containsOnlyKeys(1L, 2L, 3L);
		TimeSeriesBundle first = bundles.get(1L);
		assertThat(first.valuations()).extracting(point -> point.period().label())
				.containsExactly("2024-03-31", "2023-12-31");
		assertThat(first.valuations().get(0).marketCap()).isEqualTo(1000.0);
		assertThat(first.trailing()).singleElement()
				.satisfies(record -> assertThat(record.period()).isEqualTo(PeriodKey.yearMonth(2024, 3)));
		assertThat(bundles.get(2L).valuations()).hasSize(1);
		assertThat(bundles.get(3L).isEmpty()).isTrue();
		verify(valuationRepository, times(1)).findByIdStockIdIn(anyCollection());
		verify(ttmRepository, times(1)).findByIdStockIdIn(anyCollection());
		verify(quarterlyRepository, times(1)).findByIdStockIdIn(anyCollection());
		verify(annualRatiosRepository, times(1)).findByIdStockIdIn(anyCollection());
		verify(priceRepository, times(1)).findByIdStockIdIn(anyCollection());
	}

	@Test
	void emptyInputRunsNoQueries() {
		assertThat(loader.load(List.of())).isEmpty();
		assertThat(loader.load(null)).isEmpty();

		verifyNoInteractions(valuationRepository, ttmRepository, quarterlyRepository, annualRatiosRepository,
				priceRepository);
	}

	private static StockValuation valuation(Long stockId, String date, String marketCap) {
		StockValuation row = new StockValuation();
		row.setId(new StockPeriodId(stockId, PeriodKey.date(LocalDate.parse(date)).label()));
		row.setMarketCap(new BigDecimal(marketCap));
		return row;
	}

	private static StockTtmFinancials ttm(Long stockId, String period, String revenue) {
		StockTtmFinancials row = new StockTtmFinancials();
		row.setId(new StockPeriodId(stockId, period));
		row.setTtmRevenue(new BigDecimal(revenue));
		return row;
	}
}
