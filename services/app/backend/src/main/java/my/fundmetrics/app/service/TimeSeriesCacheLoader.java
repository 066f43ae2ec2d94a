package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.StockAnnualRatios;
import my.fundmetrics.app.domain.StockPrice;
import my.fundmetrics.app.domain.StockQuarterlyFinancials;
import my.fundmetrics.app.domain.StockTtmFinancials;
import my.fundmetrics.app.domain.StockValuation;
import my.fundmetrics.app.importer.PeriodKeyParser;
import my.fundmetrics.app.model.AnnualRatios;
import my.fundmetrics.app.model.DataKind;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PricePoint;
import my.fundmetrics.app.model.QuarterlyFinancials;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.model.TrailingFinancials;
import my.fundmetrics.app.model.ValuationPoint;
import my.fundmetrics.app.repository.StockAnnualRatiosRepository;
import my.fundmetrics.app.repository.StockPriceRepository;
import my.fundmetrics.app.repository.StockQuarterlyFinancialsRepository;
import my.fundmetrics.app.repository.StockTtmFinancialsRepository;
import my.fundmetrics.app.repository.StockValuationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads time-series bundles with one query per data kind and groups the rows by stock in memory.
 */
@Service
public class TimeSeriesCacheLoader {
	private static final Logger logger = LoggerFactory.getLogger(TimeSeriesCacheLoader.class);

	private final StockValuationRepository valuationRepository;
	private final StockTtmFinancialsRepository ttmRepository;
	private final StockQuarterlyFinancialsRepository quarterlyRepository;
	private final StockAnnualRatiosRepository annualRatiosRepository;
	private final StockPriceRepository priceRepository;

	public TimeSeriesCacheLoader(StockValuationRepository valuationRepository,
								 StockTtmFinancialsRepository ttmRepository,
								 StockQuarterlyFinancialsRepository quarterlyRepository,
								 StockAnnualRatiosRepository annualRatiosRepository,
								 StockPriceRepository priceRepository) {
		this.valuationRepository = valuationRepository;
		this.ttmRepository = ttmRepository;
		this.quarterlyRepository = quarterlyRepository;
		this.annualRatiosRepository = annualRatiosRepository;
		this.priceRepository = priceRepository;
	}

	@Transactional(readOnly = true)
	public Map<Long, TimeSeriesBundle> load(Collection<Long> stockIds) {
		Set<Long> ids = new LinkedHashSet<>();
		if (stockIds != null) {
			for (Long id : stockIds) {
				if (id != null) {
					ids.add(id);
				}
			}
		}
		if (ids.isEmpty()) {
			return Map.of();
		}
		Map<Long, TimeSeriesBundle> bundles = assemble(ids,
				valuationRepository.findByIdStockIdIn(ids),
				ttmRepository.findByIdStockIdIn(ids),
				quarterlyRepository.findByIdStockIdIn(ids),
				annualRatiosRepository.findByIdStockIdIn(ids),
				priceRepository.findByIdStockIdIn(ids));
		logger.debug("Loaded time-series bundles for {} stocks", bundles.size());
		return bundles;
	}

	@Transactional(readOnly = true)
	public Map<Long, TimeSeriesBundle> loadAll(Collection<Long> stockIds) {
		return assemble(new LinkedHashSet<>(stockIds),
				valuationRepository.findAll(),
				ttmRepository.findAll(),
				quarterlyRepository.findAll(),
				annualRatiosRepository.findAll(),
				priceRepository.findAll());
	}

	private Map<Long, TimeSeriesBundle> assemble(Set<Long> ids,
												 List<StockValuation> valuations,
												 List<StockTtmFinancials> trailing,
												 List<StockQuarterlyFinancials> quarterly,
												 List<StockAnnualRatios> annualRatios,
												 List<StockPrice> prices) {
		Map<Long, List<ValuationPoint>> valuationsByStock = group(valuations, DataKind.VALUATION,
				row -> row.getId().getStockId(), row -> row.getId().getPeriodKey(),
				(period, row) -> new ValuationPoint(period, toDouble(row.getMarketCap()),
						toDouble(row.getMarketCapFreeFloat())));
		Map<Long, List<TrailingFinancials>> trailingByStock = group(trailing, DataKind.TRAILING,
				row -> row.getId().getStockId(), row -> row.getId().getPeriodKey(),
				(period, row) -> new TrailingFinancials(period, toDouble(row.getTtmRevenue()),
						toDouble(row.getTtmRevenueFreeFloat()), toDouble(row.getTtmPat()),
						toDouble(row.getTtmPatFreeFloat())));
		Map<Long, List<QuarterlyFinancials>> quarterlyByStock = group(quarterly, DataKind.QUARTERLY,
				row -> row.getId().getStockId(), row -> row.getId().getPeriodKey(),
				(period, row) -> new QuarterlyFinancials(period, toDouble(row.getQuarterlyRevenue()),
						toDouble(row.getQuarterlyRevenueFreeFloat()), toDouble(row.getQuarterlyPat()),
						toDouble(row.getQuarterlyPatFreeFloat())));
		Map<Long, List<AnnualRatios>> annualByStock = group(annualRatios, DataKind.ANNUAL,
				row -> row.getId().getStockId(), row -> row.getId().getPeriodKey(),
				(period, row) -> new AnnualRatios(period, toDouble(row.getRoce()), toDouble(row.getRoe()),
						toDouble(row.getRetention())));
		Map<Long, List<PricePoint>> pricesByStock = group(prices, DataKind.PRICE,
				row -> row.getId().getStockId(), row -> row.getId().getPeriodKey(),
				(period, row) -> new PricePoint(period, toDouble(row.getSharePrice()), toDouble(row.getPrRatio()),
						toDouble(row.getPeRatio())));

		Map<Long, TimeSeriesBundle> bundles = new LinkedHashMap<>();
		for (Long id : ids) {
			bundles.put(id, new TimeSeriesBundle(id,
					valuationsByStock.getOrDefault(id, List.of()),
					trailingByStock.getOrDefault(id, List.of()),
					quarterlyByStock.getOrDefault(id, List.of()),
					annualByStock.getOrDefault(id, List.of()),
					pricesByStock.getOrDefault(id, List.of())));
		}
		return bundles;
	}

	private <E, R> Map<Long, List<R>> group(List<E> rows,
											DataKind kind,
											Function<E, Long> stockId,
											Function<E, String> periodLabel,
											RowMapper<E, R> mapper) {
		Map<Long, List<R>> grouped = new HashMap<>();
		if (rows == null) {
			return grouped;
		}
		for (E row : rows) {
			PeriodKey period = PeriodKeyParser.parse(periodLabel.apply(row), kind.periodKind()).orElse(null);
			if (period == null) {
				logger.warn("Skipping {} record of stock {} with unreadable period '{}'",
						kind, stockId.apply(row), periodLabel.apply(row));
				continue;
			}
			grouped.computeIfAbsent(stockId.apply(row), key -> new ArrayList<>()).add(mapper.map(period, row));
		}
		return grouped;
	}

	private static Double toDouble(BigDecimal value) {
		return value == null ? null : value.doubleValue();
	}

	@FunctionalInterface
	private interface RowMapper<E, R> {
		R map(PeriodKey period, E row);
	}
}
