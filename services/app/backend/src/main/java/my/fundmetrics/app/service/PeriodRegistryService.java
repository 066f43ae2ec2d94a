package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.PeriodRegistryEntry;
import my.fundmetrics.app.importer.PeriodKeyParser;
import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.DataKind;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PeriodRegistry;
import my.fundmetrics.app.repository.PeriodRegistryEntryRepository;
import my.fundmetrics.app.repository.StockAnnualRatiosRepository;
import my.fundmetrics.app.repository.StockPriceRepository;
import my.fundmetrics.app.repository.StockQuarterlyFinancialsRepository;
import my.fundmetrics.app.repository.StockTtmFinancialsRepository;
import my.fundmetrics.app.repository.StockValuationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent, insert-only registry of the periods seen per category. Registering a known period is a
 * no-op, so the registry only ever grows.
 */
@Service
public class PeriodRegistryService {
	private static final Logger logger = LoggerFactory.getLogger(PeriodRegistryService.class);

	private final PeriodRegistryEntryRepository entryRepository;
	private final StockValuationRepository valuationRepository;
	private final StockTtmFinancialsRepository ttmRepository;
	private final StockQuarterlyFinancialsRepository quarterlyRepository;
	private final StockAnnualRatiosRepository annualRatiosRepository;
	private final StockPriceRepository priceRepository;

	public PeriodRegistryService(PeriodRegistryEntryRepository entryRepository,
								 StockValuationRepository valuationRepository,
								 StockTtmFinancialsRepository ttmRepository,
								 StockQuarterlyFinancialsRepository quarterlyRepository,
								 StockAnnualRatiosRepository annualRatiosRepository,
								 StockPriceRepository priceRepository) {
		this.entryRepository = entryRepository;
		this.valuationRepository = valuationRepository;
		this.ttmRepository = ttmRepository;
		this.quarterlyRepository = quarterlyRepository;
		this.annualRatiosRepository = annualRatiosRepository;
		this.priceRepository = priceRepository;
	}

	@Transactional(readOnly = true)
	public PeriodRegistry current() {
		Map<Category, List<PeriodKey>> periods = new EnumMap<>(Category.class);
		for (PeriodRegistryEntry entry : entryRepository.findAll()) {
			Optional<Category> category = Category.fromKey(entry.getId().getCategory());
			if (category.isEmpty() || !category.get().isTimeSeries()) {
				logger.warn("Ignoring registry entry with unknown category '{}'", entry.getId().getCategory());
				continue;
			}
			Optional<PeriodKey> period = PeriodKeyParser.parse(entry.getId().getPeriodKey(),
					category.get().periodKind());
			if (period.isEmpty()) {
				logger.warn("Ignoring registry entry {} with unreadable period '{}'", category.get(),
						entry.getId().getPeriodKey());
				continue;
			}
			periods.computeIfAbsent(category.get(), key -> new ArrayList<>()).add(period.get());
		}
		return PeriodRegistry.of(periods);
	}

	/**
	 * Adds the periods the registry does not hold yet and returns just those.
	 */
	@Transactional
	public Map<Category, List<PeriodKey>> register(Map<Category, ? extends Collection<PeriodKey>> discovered) {
		PeriodRegistry known = current();
		Map<Category, List<PeriodKey>> fresh = PeriodRegistry.empty().merge(known.unknown(discovered)).asMap();
		if (fresh.isEmpty()) {
			return Map.of();
		}
		LocalDateTime now = LocalDateTime.now();
		int inserted = 0;
		for (Map.Entry<Category, List<PeriodKey>> entry : fresh.entrySet()) {
			for (PeriodKey period : entry.getValue()) {
				inserted += entryRepository.insertIfAbsent(entry.getKey().name(), period.label(),
						period.kind().name(), now);
			}
		}
		logger.info("Registered {} new periods across {} categories", inserted, fresh.size());
		return fresh;
	}

	/**
	 * Unions every period already present in the time-series tables into the registry.
	 */
	@Transactional
	public Map<Category, List<PeriodKey>> rebuildFromStorage() {
		Map<Category, List<PeriodKey>> stored = new EnumMap<>(Category.class);
		for (DataKind kind : DataKind.values()) {
			List<PeriodKey> periods = new ArrayList<>();
			for (String label : distinctPeriodLabels(kind)) {
				PeriodKeyParser.parse(label, kind.periodKind()).ifPresentOrElse(periods::add,
						() -> logger.warn("Skipping stored {} period '{}'", kind, label));
			}
			for (Category category : Category.ofKind(kind)) {
				stored.put(category, periods);
			}
		}
		Map<Category, List<PeriodKey>> added = register(stored);
		logger.info("Period registry rebuilt from storage; {} categories gained periods", added.size());
		return added;
	}

	private List<String> distinctPeriodLabels(DataKind kind) {
		return switch (kind) {
			case VALUATION -> valuationRepository.findDistinctPeriodKeys();
			case TRAILING -> ttmRepository.findDistinctPeriodKeys();
			case QUARTERLY -> quarterlyRepository.findDistinctPeriodKeys();
			case ANNUAL -> annualRatiosRepository.findDistinctPeriodKeys();
			case PRICE -> priceRepository.findDistinctPeriodKeys();
		};
	}

	public boolean isEmpty() {
		return entryRepository.count() == 0;
	}
}
