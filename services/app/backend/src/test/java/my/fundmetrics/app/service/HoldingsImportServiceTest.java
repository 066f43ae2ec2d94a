package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.Fund;
import my.fundmetrics.app.domain.FundHolding;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.dto.HoldingsImportResultDto;
import my.fundmetrics.app.repository.FundHoldingRepository;
import my.fundmetrics.app.repository.FundRepository;
import my.fundmetrics.app.repository.StockRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HoldingsImportServiceTest {
	@Mock
	private FundService fundService;

	@Mock
	private FundRepository fundRepository;

	@Mock
	private FundHoldingRepository holdingRepository;

	@Mock
	private StockRepository stockRepository;

	@InjectMocks
	private HoldingsImportService service;

	@Test
	void replacesHoldingsOfFund() {
		Fund fund = new Fund();
		fund.setFundId(1L);
		fund.setFundCode("GROWTH");
		when(fundRepository.findByFundCode("GROWTH")).thenReturn(Optional.empty());
		when(fundService.findOrCreate("growth", "Growth Fund")).thenReturn(fund);
		when(stockRepository.findByAccordCodeIn(anyCollection())).thenReturn(List.of(stock(10L, "INF01", null)));
		when(stockRepository.findByIsinIn(anyCollection())).thenReturn(List.of(stock(20L, "WIP01", "INE075A01022")));
		FundHolding kept = holding(20L, "100");
		FundHolding dropped = holding(30L, "50");
		when(holdingRepository.findByFundId(1L)).thenReturn(List.of(kept, dropped));
		String csv = """
				accord_code,isin,company_name,market_value
				INF01,,Infosys,600
				,INE075A01022,Wipro,400
				ZZZ01,,Unknown,10
				""";
		MockMultipartFile file = new MockMultipartFile("file", "holdings.csv", "text/csv",
				csv.getBytes(StandardCharsets.UTF_8));

		HoldingsImportResultDto result = service.importHoldings("growth", "Growth Fund", file);

		assertThat(result.fundId()).isEqualTo(1L);
		assertThat(result.fundCreated()).isTrue();
		assertThat(result.holdingsCreated()).isEqualTo(1);
		assertThat(result.holdingsUpdated()).isEqualTo(1);
		assertThat(result.holdingsRemoved()).isEqualTo(1);
		assertThat(result.unknownStocks()).containsExactly("ZZZ01");
		assertThat(kept.getMarketValue()).isEqualByComparingTo("400");

		@SuppressWarnings("unchecked")
		ArgumentCaptor<Collection<FundHolding>> deleted = ArgumentCaptor.forClass(Collection.class);
		verify(holdingRepository).deleteAll(deleted.capture());
		assertThat(deleted.getValue()).containsExactly(dropped);
	}

	@Test
	void fileWithoutRowsIsRejected() {
		MockMultipartFile file = new MockMultipartFile("file", "holdings.csv", "text/csv",
				"accord_code,market_value\n".getBytes(StandardCharsets.UTF_8));

		assertThatThrownBy(() -> service.importHoldings("growth", null, file))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("no rows");
		verifyNoInteractions(fundService, holdingRepository);
	}

	private static Stock stock(Long id, String code, String isin) {
		Stock stock = new Stock();
		stock.setStockId(id);
		stock.setAccordCode(code);
		stock.setIsin(isin);
		return stock;
	}

	private static FundHolding holding(Long stockId, String marketValue) {
		FundHolding holding = new FundHolding();
		holding.setFundId(1L);
		holding.setStockId(stockId);
		holding.setMarketValue(new BigDecimal(marketValue));
		return holding;
	}
}
