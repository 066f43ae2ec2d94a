package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.Fund;
import my.fundmetrics.app.domain.FundHolding;
import my.fundmetrics.app.domain.Stock;
import my.fundmetrics.app.dto.HoldingsImportResultDto;
import my.fundmetrics.app.importer.HoldingRow;
import my.fundmetrics.app.importer.HoldingsCsvParser;
import my.fundmetrics.app.repository.FundHoldingRepository;
import my.fundmetrics.app.repository.FundRepository;
import my.fundmetrics.app.repository.StockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces a fund's holdings with the rows of an uploaded holdings CSV.
 */
@Service
public class HoldingsImportService {
	private static final Logger logger = LoggerFactory.getLogger(HoldingsImportService.class);

	private final FundService fundService;
	private final FundRepository fundRepository;
	private final FundHoldingRepository holdingRepository;
	private final StockRepository stockRepository;
	private final HoldingsCsvParser parser = new HoldingsCsvParser();

	public HoldingsImportService(FundService fundService,
								 FundRepository fundRepository,
								 FundHoldingRepository holdingRepository,
								 StockRepository stockRepository) {
		this.fundService = fundService;
		this.fundRepository = fundRepository;
		this.holdingRepository = holdingRepository;
		this.stockRepository = stockRepository;
	}

	@Transactional
	public HoldingsImportResultDto importHoldings(String fundCode, String fundName, MultipartFile file) {
		byte[] payload = readFile(file);
		List<HoldingRow> rows = parser.parse(payload);
		if (rows.isEmpty()) {
			throw new IllegalArgumentException("Holdings file contains no rows");
		}
		boolean existed = fundRepository.findByFundCode(FundService.normalizeCode(fundCode)).isPresent();
		Fund fund = fundService.findOrCreate(fundCode, fundName);

		Map<String, Stock> byCode = new HashMap<>();
		Map<String, Stock> byIsin = new HashMap<>();
		List<String> codes = rows.stream().map(HoldingRow::accordCode).filter(code -> code != null).toList();
		List<String> isins = rows.stream().map(HoldingRow::isin).filter(isin -> isin != null).toList();
		if (!codes.isEmpty()) {
			stockRepository.findByAccordCodeIn(codes).forEach(stock -> byCode.put(stock.getAccordCode(), stock));
		}
		if (!isins.isEmpty()) {
			stockRepository.findByIsinIn(isins).forEach(stock -> byIsin.put(stock.getIsin(), stock));
		}

		Map<Long, HoldingRow> matched = new LinkedHashMap<>();
		List<String> unknown = new ArrayList<>();
		for (HoldingRow row : rows) {
			Stock stock = row.accordCode() == null ? null : byCode.get(row.accordCode());
			if (stock == null && row.isin() != null) {
				stock = byIsin.get(row.isin());
			}
			if (stock == null) {
				unknown.add(row.accordCode() != null ? row.accordCode() : row.isin());
				continue;
			}
			HoldingRow previous = matched.get(stock.getStockId());
			matched.put(stock.getStockId(), previous == null ? row : merge(previous, row));
		}

		Map<Long, FundHolding> existing = new HashMap<>();
		for (FundHolding holding : holdingRepository.findByFundId(fund.getFundId())) {
			existing.put(holding.getStockId(), holding);
		}

		LocalDateTime now = LocalDateTime.now();
		int created = 0;
		int updated = 0;
		List<FundHolding> toSave = new ArrayList<>();
		for (Map.Entry<Long, HoldingRow> entry : matched.entrySet()) {
			FundHolding holding = existing.remove(entry.getKey());
			if (holding == null) {
				holding = new FundHolding();
				holding.setFundId(fund.getFundId());
				holding.setStockId(entry.getKey());
				created += 1;
			} else {
				updated += 1;
			}
			holding.setHoldingPercentage(entry.getValue().holdingPercentage());
			holding.setMarketValue(entry.getValue().marketValue());
			holding.setUpdatedAt(now);
			toSave.add(holding);
		}
		holdingRepository.saveAll(toSave);
		int removed = existing.size();
		if (removed > 0) {
			holdingRepository.deleteAll(existing.values());
		}
		if (!unknown.isEmpty()) {
			logger.warn("Fund {}: {} holdings reference unknown stocks and were skipped", fund.getFundCode(),
					unknown.size());
		}
		logger.info("Fund {} holdings imported: {} created, {} updated, {} removed", fund.getFundCode(), created,
				updated, removed);
		return new HoldingsImportResultDto(fund.getFundId(), !existed, created, updated, removed, unknown);
	}

	private HoldingRow merge(HoldingRow left, HoldingRow right) {
		return new HoldingRow(left.accordCode(), left.isin(), left.companyName(),
				sum(left.holdingPercentage(), right.holdingPercentage()),
				sum(left.marketValue(), right.marketValue()));
	}

	private static BigDecimal sum(BigDecimal left, BigDecimal right) {
		if (left == null) {
			return right;
		}
		return right == null ? left : left.add(right);
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
}
