package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.importer.HeaderLayout;
import my.fundmetrics.app.model.BlockLayout;
import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PeriodRegistry;
import my.fundmetrics.app.model.TimeSeriesBundle;
import my.fundmetrics.app.repository.StockRepository;
import my.fundmetrics.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Re-projects stored stock data into the sheet layout. Column positions come from the current period
 * registry on every call and are never cached.
 */
@Service
public class StockExportService {
	private static final Logger logger = LoggerFactory.getLogger(StockExportService.class);

	private final PeriodRegistryService periodRegistryService;
	private final BlockLayoutProjector projector;
	private final TimeSeriesCacheLoader cacheLoader;
	private final StockRepository stockRepository;
	private final HeaderLayout headerLayout;

	public StockExportService(PeriodRegistryService periodRegistryService,
							  BlockLayoutProjector projector,
							  TimeSeriesCacheLoader cacheLoader,
							  StockRepository stockRepository,
							  AppProperties properties) {
		this.periodRegistryService = periodRegistryService;
		this.projector = projector;
		this.cacheLoader = cacheLoader;
		this.stockRepository = stockRepository;
		this.headerLayout = properties.sheet().toHeaderLayout();
	}

	/**
	 * @param periodsPerCategory keep only this many most recent periods per category; {@code null} or
	 *                           non-positive exports every registered period
	 */
	@Transactional(readOnly = true)
	public SheetExport export(Integer periodsPerCategory) {
		PeriodRegistry registry = periodRegistryService.current();
		if (periodsPerCategory != null && periodsPerCategory > 0) {
			registry = registry.limitedTo(periodsPerCategory);
		}
		BlockLayout layout = projector.project(registry);
		List<List<String>> rows = new ArrayList<>(projector.renderHeaderRows(layout, headerLayout));

		List<Stock> stocks = stockRepository.findAllByOrderByCompanyNameAsc();
		List<Long> stockIds = stocks.stream().map(Stock::getStockId).toList();
		Map<Long, TimeSeriesBundle> bundles = cacheLoader.loadAll(stockIds);
		int serial = 0;
		for (Stock stock : stocks) {
			serial += 1;
			TimeSeriesBundle bundle = bundles.getOrDefault(stock.getStockId(), TimeSeriesBundle.empty(stock.getStockId()));
			rows.add(renderRow(layout, stock, bundle, serial));
		}
		logger.info("Exported {} stocks across {} columns", stocks.size(), layout.columnCount());
		return new SheetExport(layout, rows);
	}

	@Transactional(readOnly = true)
	public String exportCsv(Integer periodsPerCategory) {
		SheetExport export = export(periodsPerCategory);
		StringBuilder builder = new StringBuilder();
		for (List<String> row : export.rows()) {
			builder.append(row.stream().map(CsvParsing::csv).collect(Collectors.joining(",")));
			builder.append('\n');
		}
		return builder.toString();
	}

	List<String> renderRow(BlockLayout layout, Stock stock, TimeSeriesBundle bundle, int serial) {
		List<String> cells = new ArrayList<>(Collections.nCopies(layout.columnCount(), ""));
		for (BlockLayout.Block block : layout.nonEmptyBlocks()) {
			if (!block.category().isTimeSeries()) {
				for (int offset = 0; offset < block.fixedColumns().size(); offset++) {
					cells.set(block.startColumn() + offset, fixedValue(block.fixedColumns().get(offset), stock, serial));
				}
				continue;
			}
			for (int offset = 0; offset < block.periods().size(); offset++) {
				PeriodKey period = block.periods().get(offset);
				cells.set(block.startColumn() + offset, format(seriesValue(block.category(), bundle, period)));
			}
		}
		return cells;
	}

	private String fixedValue(FixedColumn column, Stock stock, int serial) {
		return switch (column) {
			case SERIAL_NO -> Integer.toString(serial);
			case COMPANY_NAME -> text(stock.getCompanyName());
			case ACCORD_CODE -> text(stock.getAccordCode());
			case SECTOR -> text(stock.getSector());
			case CAP -> text(stock.getCap());
			case FREE_FLOAT -> decimal(stock.getFreeFloat());
			case REVENUE_6YR_CAGR -> decimal(stock.getRevenue6yrCagr());
			case REVENUE_TTM -> decimal(stock.getRevenueTtm());
			case PAT_6YR_CAGR -> decimal(stock.getPat6yrCagr());
			case PAT_TTM -> decimal(stock.getPatTtm());
			case PE_CURRENT -> decimal(stock.getPeCurrent());
			case PE_2YR_AVG -> decimal(stock.getPe2yrAvg());
			case PE_REVAL_DEVAL -> decimal(stock.getPeRevalDeval());
			case BSE_CODE -> text(stock.getBseCode());
			case NSE_SYMBOL -> text(stock.getNseSymbol());
			case ISIN -> text(stock.getIsin());
		};
	}

	private Double seriesValue(Category category, TimeSeriesBundle bundle, PeriodKey period) {
		return switch (category) {
			case MARKET_CAP -> TimeSeriesBundle.at(bundle.valuations(), period).map(v -> v.marketCap()).orElse(null);
			case MARKET_CAP_FREE_FLOAT -> TimeSeriesBundle.at(bundle.valuations(), period)
					.map(v -> v.marketCapFreeFloat()).orElse(null);
			case TTM_REVENUE -> TimeSeriesBundle.at(bundle.trailing(), period).map(t -> t.revenue()).orElse(null);
			case TTM_REVENUE_FREE_FLOAT -> TimeSeriesBundle.at(bundle.trailing(), period)
					.map(t -> t.revenueFreeFloat()).orElse(null);
			case TTM_PAT -> TimeSeriesBundle.at(bundle.trailing(), period).map(t -> t.pat()).orElse(null);
			case TTM_PAT_FREE_FLOAT -> TimeSeriesBundle.at(bundle.trailing(), period)
					.map(t -> t.patFreeFloat()).orElse(null);
			case QUARTERLY_REVENUE -> TimeSeriesBundle.at(bundle.quarterly(), period)
					.map(q -> q.revenue()).orElse(null);
			case QUARTERLY_REVENUE_FREE_FLOAT -> TimeSeriesBundle.at(bundle.quarterly(), period)
					.map(q -> q.revenueFreeFloat()).orElse(null);
			case QUARTERLY_PAT -> TimeSeriesBundle.at(bundle.quarterly(), period).map(q -> q.pat()).orElse(null);
			case QUARTERLY_PAT_FREE_FLOAT -> TimeSeriesBundle.at(bundle.quarterly(), period)
					.map(q -> q.patFreeFloat()).orElse(null);
			case ROCE -> TimeSeriesBundle.at(bundle.annualRatios(), period).map(a -> a.roce()).orElse(null);
			case ROE -> TimeSeriesBundle.at(bundle.annualRatios(), period).map(a -> a.roe()).orElse(null);
			case RETENTION -> TimeSeriesBundle.at(bundle.annualRatios(), period).map(a -> a.retention()).orElse(null);
			case SHARE_PRICE -> TimeSeriesBundle.at(bundle.prices(), period).map(p -> p.sharePrice()).orElse(null);
			case PR_RATIO -> TimeSeriesBundle.at(bundle.prices(), period).map(p -> p.prRatio()).orElse(null);
			case PE_RATIO -> TimeSeriesBundle.at(bundle.prices(), period).map(p -> p.peRatio()).orElse(null);
			case IDENTITY, IDENTIFIERS -> null;
		};
	}

	private static String text(String value) {
		return value == null ? "" : value;
	}

	private static String decimal(BigDecimal value) {
		return value == null ? "" : value.stripTrailingZeros().toPlainString();
	}

	private static String format(Double value) {
		return Optional.ofNullable(value).map(v -> decimal(BigDecimal.valueOf(v))).orElse("");
	}

	public record SheetExport(BlockLayout layout, List<List<String>> rows) {
	}
}
