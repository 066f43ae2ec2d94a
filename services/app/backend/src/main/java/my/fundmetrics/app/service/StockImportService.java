package my.fundmetrics.app.service;

import my.fundmetrics.app.config.AppProperties;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.domain.StockAnnualRatios;
import my.fundmetrics.app.domain.StockPeriodId;
import my.fundmetrics.app.domain.StockPrice;
import my.fundmetrics.app.domain.StockQuarterlyFinancials;
import my.fundmetrics.app.domain.StockTtmFinancials;
import my.fundmetrics.app.domain.StockUploadLog;
import my.fundmetrics.app.domain.StockValuation;
import my.fundmetrics.app.dto.StockImportResultDto;
import my.fundmetrics.app.importer.ColumnClassification;
import my.fundmetrics.app.importer.ColumnClassificationMap;
import my.fundmetrics.app.importer.HeaderClassifier;
import my.fundmetrics.app.importer.StockSheetParser;
import my.fundmetrics.app.importer.StockSheetRow;
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
import my.fundmetrics.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
public class StockImportService {
	private static final Logger logger = LoggerFactory.getLogger(StockImportService.class);
	static final String STATUS_IMPORTED = "imported";
	static final String STATUS_SKIPPED = "skipped";

	private static final Map<Category, BiConsumer<StockValuation, BigDecimal>> VALUATION_FIELDS = Map.of(
			Category.MARKET_CAP, StockValuation::setMarketCap,
			Category.MARKET_CAP_FREE_FLOAT, StockValuation::setMarketCapFreeFloat);
	private static final Map<Category, BiConsumer<StockTtmFinancials, BigDecimal>> TTM_FIELDS = Map.of(
			Category.TTM_REVENUE, StockTtmFinancials::setTtmRevenue,
			Category.TTM_REVENUE_FREE_FLOAT, StockTtmFinancials::setTtmRevenueFreeFloat,
			Category.TTM_PAT, StockTtmFinancials::setTtmPat,
			Category.TTM_PAT_FREE_FLOAT, StockTtmFinancials::setTtmPatFreeFloat);
	private static final Map<Category, BiConsumer<StockQuarterlyFinancials, BigDecimal>> QUARTERLY_FIELDS = Map.of(
			Category.QUARTERLY_REVENUE, StockQuarterlyFinancials::setQuarterlyRevenue,
			Category.QUARTERLY_REVENUE_FREE_FLOAT, StockQuarterlyFinancials::setQuarterlyRevenueFreeFloat,
			Category.QUARTERLY_PAT, StockQuarterlyFinancials::setQuarterlyPat,
			Category.QUARTERLY_PAT_FREE_FLOAT, StockQuarterlyFinancials::setQuarterlyPatFreeFloat);
	private static final Map<Category, BiConsumer<StockAnnualRatios, BigDecimal>> ANNUAL_FIELDS = Map.of(
			Category.ROCE, StockAnnualRatios::setRoce,
			Category.ROE, StockAnnualRatios::setRoe,
			Category.RETENTION, StockAnnualRatios::setRetention);
	private static final Map<Category, BiConsumer<StockPrice, BigDecimal>> PRICE_FIELDS = Map.of(
			Category.SHARE_PRICE, StockPrice::setSharePrice,
			Category.PR_RATIO, StockPrice::setPrRatio,
			Category.PE_RATIO, StockPrice::setPeRatio);

	private final StockRepository stockRepository;
	private final StockValuationRepository valuationRepository;
	private final StockTtmFinancialsRepository ttmRepository;
	private final StockQuarterlyFinancialsRepository quarterlyRepository;
	private final StockAnnualRatiosRepository annualRatiosRepository;
	private final StockPriceRepository priceRepository;
	private final StockUploadLogRepository uploadLogRepository;
	private final PeriodRegistryService periodRegistryService;
	private final HeaderClassifier headerClassifier;
	private final StockSheetParser sheetParser = new StockSheetParser();

	public StockImportService(StockRepository stockRepository,
							  StockValuationRepository valuationRepository,
							  StockTtmFinancialsRepository ttmRepository,
							  StockQuarterlyFinancialsRepository quarterlyRepository,
							  StockAnnualRatiosRepository annualRatiosRepository,
							  StockPriceRepository priceRepository,
							  StockUploadLogRepository uploadLogRepository,
							  PeriodRegistryService periodRegistryService,
							  AppProperties properties) {
		this.stockRepository = stockRepository;
		this.valuationRepository = valuationRepository;
		this.ttmRepository = ttmRepository;
		this.quarterlyRepository = quarterlyRepository;
		this.annualRatiosRepository = annualRatiosRepository;
		this.priceRepository = priceRepository;
		this.uploadLogRepository = uploadLogRepository;
		this.periodRegistryService = periodRegistryService;
		this.headerClassifier = new HeaderClassifier(properties.sheet().toHeaderLayout());
	}

	@Transactional
	public StockImportResultDto importStockSheet(MultipartFile file, boolean forceReimport) {
		String filename = file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
		byte[] payload = readFile(file);
		String fileHash = sha256(payload);
		if (!forceReimport) {
			StockUploadLog previous = uploadLogRepository.findFirstByFileHashAndStatus(fileHash, STATUS_IMPORTED)
					.orElse(null);
			if (previous != null) {
				logger.info("Skipping {}: identical file already imported as upload {}", filename,
						previous.getUploadId());
				return new StockImportResultDto(STATUS_SKIPPED, previous.getUploadId(), 0, 0, 0, 0, Map.of(),
						List.of());
			}
		}

		List<List<String>> rows = readRows(payload);
		int headerRows = headerClassifier.layout().headerRows();
		// throws before anything below writes
		ColumnClassificationMap classification = headerClassifier.classify(
				rows.subList(0, Math.min(headerRows, rows.size())));
		for (ColumnClassification column : classification.unparseableColumns()) {
			logger.warn("Column {} of {} has unparseable period '{}' and is ignored", column.columnIndex(),
					filename, column.periodLabel());
		}

		Map<Category, List<PeriodKey>> newPeriods = periodRegistryService.register(
				classification.discoveredPeriods());
		StockSheetParser.Result parsed = sheetParser.parse(classification, rows.subList(headerRows, rows.size()),
				headerRows);

		StockUpsert stocks = upsertStocks(parsed.rows());
		int recordsWritten = 0;
		recordsWritten += upsertSeries(parsed.rows(), stocks.idsByCode(), valuationRepository,
				valuationRepository::findByIdStockIdIn, StockValuation::getId, StockValuation::new,
				StockValuation::setId, VALUATION_FIELDS);
		recordsWritten += upsertSeries(parsed.rows(), stocks.idsByCode(), ttmRepository,
				ttmRepository::findByIdStockIdIn, StockTtmFinancials::getId, StockTtmFinancials::new,
				StockTtmFinancials::setId, TTM_FIELDS);
		recordsWritten += upsertSeries(parsed.rows(), stocks.idsByCode(), quarterlyRepository,
				quarterlyRepository::findByIdStockIdIn, StockQuarterlyFinancials::getId,
				StockQuarterlyFinancials::new, StockQuarterlyFinancials::setId, QUARTERLY_FIELDS);
		recordsWritten += upsertSeries(parsed.rows(), stocks.idsByCode(), annualRatiosRepository,
				annualRatiosRepository::findByIdStockIdIn, StockAnnualRatios::getId, StockAnnualRatios::new,
				StockAnnualRatios::setId, ANNUAL_FIELDS);
		recordsWritten += upsertSeries(parsed.rows(), stocks.idsByCode(), priceRepository,
				priceRepository::findByIdStockIdIn, StockPrice::getId, StockPrice::new, StockPrice::setId,
				PRICE_FIELDS);

		StockUploadLog log = new StockUploadLog();
		log.setFilename(filename);
		log.setFileHash(fileHash);
		log.setStatus(STATUS_IMPORTED);
		log.setStocksCreated(stocks.created());
		log.setStocksUpdated(stocks.updated());
		log.setRowsSkipped(parsed.skippedRows());
		log.setRecordsWritten(recordsWritten);
		log.setUploadedAt(LocalDateTime.now());
		log = uploadLogRepository.save(log);

		logger.info("Imported {}: {} stocks created, {} updated, {} rows skipped, {} time-series records",
				filename, stocks.created(), stocks.updated(), parsed.skippedRows(), recordsWritten);
		return new StockImportResultDto(STATUS_IMPORTED, log.getUploadId(), stocks.created(), stocks.updated(),
				parsed.skippedRows(), recordsWritten, labels(newPeriods),
				classification.unparseableColumns().stream().map(ColumnClassification::columnIndex).toList());
	}

	List<List<String>> readRows(byte[] payload) {
		String content = CsvParsing.decode(payload);
		String sample = content.substring(0, Math.min(content.length(), 4096));
		char delimiter = CsvParsing.sniffDelimiter(sample);
		List<List<String>> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), CSVFormat.DEFAULT.withDelimiter(delimiter))) {
			for (CSVRecord record : parser) {
				List<String> cells = new ArrayList<>(record.size());
				for (String value : record) {
					cells.add(value);
				}
				rows.add(cells);
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read stock sheet: " + exc.getMessage(), exc);
		}
		return rows;
	}

	private StockUpsert upsertStocks(List<StockSheetRow> rows) {
		Map<String, StockSheetRow> dedup = new LinkedHashMap<>();
		for (StockSheetRow row : rows) {
			dedup.put(row.accordCode(), row);
		}
		Map<String, Stock> existing = new HashMap<>();
		if (!dedup.isEmpty()) {
			for (Stock stock : stockRepository.findByAccordCodeIn(dedup.keySet())) {
				existing.put(stock.getAccordCode(), stock);
			}
		}

		LocalDateTime now = LocalDateTime.now();
		int created = 0;
		int updated = 0;
		List<Stock> toSave = new ArrayList<>();
		for (StockSheetRow row : dedup.values()) {
			Stock stock = existing.get(row.accordCode());
			if (stock == null) {
				stock = new Stock();
				stock.setAccordCode(row.accordCode());
				stock.setCreatedAt(now);
				created += 1;
			} else {
				updated += 1;
			}
			applyFixedValues(stock, row);
			stock.setUpdatedAt(now);
			toSave.add(stock);
		}
		Map<String, Long> idsByCode = new HashMap<>();
		for (Stock saved : stockRepository.saveAll(toSave)) {
			idsByCode.put(saved.getAccordCode(), saved.getStockId());
		}
		return new StockUpsert(created, updated, idsByCode);
	}

	private void applyFixedValues(Stock stock, StockSheetRow row) {
		stock.setCompanyName(row.companyName());
		setIfPresent(row.text(FixedColumn.SECTOR), stock::setSector);
		setIfPresent(row.text(FixedColumn.CAP), stock::setCap);
		setIfPresent(row.decimal(FixedColumn.FREE_FLOAT), stock::setFreeFloat);
		setIfPresent(row.decimal(FixedColumn.REVENUE_6YR_CAGR), stock::setRevenue6yrCagr);
		setIfPresent(row.decimal(FixedColumn.REVENUE_TTM), stock::setRevenueTtm);
		setIfPresent(row.decimal(FixedColumn.PAT_6YR_CAGR), stock::setPat6yrCagr);
		setIfPresent(row.decimal(FixedColumn.PAT_TTM), stock::setPatTtm);
		setIfPresent(row.decimal(FixedColumn.PE_CURRENT), stock::setPeCurrent);
		setIfPresent(row.decimal(FixedColumn.PE_2YR_AVG), stock::setPe2yrAvg);
		setIfPresent(row.decimal(FixedColumn.PE_REVAL_DEVAL), stock::setPeRevalDeval);
		setIfPresent(row.text(FixedColumn.BSE_CODE), stock::setBseCode);
		setIfPresent(row.text(FixedColumn.NSE_SYMBOL), stock::setNseSymbol);
		setIfPresent(row.text(FixedColumn.ISIN), stock::setIsin);
	}

	private static <T> void setIfPresent(T value, Consumer<T> setter) {
		if (value != null) {
			setter.accept(value);
		}
	}

	/**
	 * Upserts one data kind: one bulk read of the existing rows, then create or update each
	 * (stock, period) touched by the sheet. Only fields present in the sheet are overwritten.
	 */
	private <E> int upsertSeries(List<StockSheetRow> rows,
								 Map<String, Long> idsByCode,
								 JpaRepository<E, StockPeriodId> repository,
								 Function<Collection<Long>, List<E>> finder,
								 Function<E, StockPeriodId> idOf,
								 Supplier<E> factory,
								 BiConsumer<E, StockPeriodId> setId,
								 Map<Category, BiConsumer<E, BigDecimal>> setters) {
		Map<StockPeriodId, Map<Category, BigDecimal>> incoming = new LinkedHashMap<>();
		for (StockSheetRow row : rows) {
			Long stockId = idsByCode.get(row.accordCode());
			if (stockId == null) {
				continue;
			}
			for (Category category : setters.keySet()) {
				for (PeriodKey period : row.periods(category)) {
					BigDecimal value = row.value(category, period);
					if (value != null) {
						incoming.computeIfAbsent(new StockPeriodId(stockId, period.label()), key -> new HashMap<>())
								.put(category, value);
					}
				}
			}
		}
		if (incoming.isEmpty()) {
			return 0;
		}

		Set<Long> stockIds = new TreeSet<>();
		incoming.keySet().forEach(id -> stockIds.add(id.getStockId()));
		Map<StockPeriodId, E> existing = new HashMap<>();
		for (E entity : finder.apply(stockIds)) {
			existing.put(idOf.apply(entity), entity);
		}

		List<E> toSave = new ArrayList<>(incoming.size());
		for (Map.Entry<StockPeriodId, Map<Category, BigDecimal>> entry : incoming.entrySet()) {
			E entity = existing.get(entry.getKey());
			if (entity == null) {
				entity = factory.get();
				setId.accept(entity, entry.getKey());
			}
			for (Map.Entry<Category, BigDecimal> value : entry.getValue().entrySet()) {
				setters.get(value.getKey()).accept(entity, value.getValue());
			}
			toSave.add(entity);
		}
		repository.saveAll(toSave);
		return toSave.size();
	}

	private Map<String, List<String>> labels(Map<Category, List<PeriodKey>> periods) {
		Map<String, List<String>> result = new LinkedHashMap<>();
		periods.forEach((category, keys) -> result.put(category.name(),
				keys.stream().map(PeriodKey::label).toList()));
		return result;
	}

	private byte[] readFile(MultipartFile file) {
		try {
			byte[] payload = file.getBytes();
			if (payload.length == 0) {
				throw new IllegalArgumentException("File is empty");
			}
			return payload;
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read upload: " + exc.getMessage(), exc);
		}
	}

	private String sha256(byte[] payload) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(payload));
		} catch (Exception exc) {
			throw new IllegalArgumentException("Failed to hash upload: " + exc.getMessage(), exc);
		}
	}

	private record StockUpsert(int created, int updated, Map<String, Long> idsByCode) {
	}
}
