package my.fundmetrics.app.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of every stored time-series record of one stock. Each list is ordered most recent
 * first and is never modified after construction, so one bundle can be shared by concurrent calculations.
 */
public final class TimeSeriesBundle {
	private final Long stockId;
	private final List<ValuationPoint> valuations;
	private final List<TrailingFinancials> trailing;
	private final List<QuarterlyFinancials> quarterly;
	private final List<AnnualRatios> annualRatios;
	private final List<PricePoint> prices;

	public TimeSeriesBundle(Long stockId,
							List<ValuationPoint> valuations,
							List<TrailingFinancials> trailing,
							List<QuarterlyFinancials> quarterly,
							List<AnnualRatios> annualRatios,
							List<PricePoint> prices) {
		this.stockId = stockId;
		this.valuations = newestFirst(valuations);
		this.trailing = newestFirst(trailing);
		this.quarterly = newestFirst(quarterly);
		this.annualRatios = newestFirst(annualRatios);
		this.prices = newestFirst(prices);
	}

	public static TimeSeriesBundle empty(Long stockId) {
		return new TimeSeriesBundle(stockId, List.of(), List.of(), List.of(), List.of(), List.of());
	}

	private static <T extends PeriodicRecord> List<T> newestFirst(List<T> records) {
		if (records == null || records.isEmpty()) {
			return List.of();
		}
		List<T> sorted = new ArrayList<>(records);
		sorted.sort(Comparator.comparing(PeriodicRecord::period).reversed());
		return List.copyOf(sorted);
	}

	/**
	 * Records whose period falls in the same month as {@code cutoff} or earlier, most recent first.
	 */
	public static <T extends PeriodicRecord> List<T> atOrBefore(List<T> records, PeriodKey cutoff) {
		if (cutoff == null) {
			return records;
		}
		List<T> result = new ArrayList<>();
		for (T record : records) {
			if (record.period().isAtOrBefore(cutoff)) {
				result.add(record);
			}
		}
		return result;
	}

	public static <T extends PeriodicRecord> Optional<T> latestAtOrBefore(List<T> records, PeriodKey cutoff) {
		for (T record : records) {
			if (cutoff == null || record.period().isAtOrBefore(cutoff)) {
				return Optional.of(record);
			}
		}
		return Optional.empty();
	}

	public static <T extends PeriodicRecord> Optional<T> at(List<T> records, PeriodKey period) {
		for (T record : records) {
			if (record.period().equals(period)) {
				return Optional.of(record);
			}
		}
		return Optional.empty();
	}

	public Long stockId() {
		return stockId;
	}

	public List<ValuationPoint> valuations() {
		return valuations;
	}

	public List<TrailingFinancials> trailing() {
		return trailing;
	}

	public List<QuarterlyFinancials> quarterly() {
		return quarterly;
	}

	public List<AnnualRatios> annualRatios() {
		return annualRatios;
	}

	public List<PricePoint> prices() {
		return prices;
	}

	public boolean isEmpty() {
		return valuations.isEmpty() && trailing.isEmpty() && quarterly.isEmpty() && annualRatios.isEmpty()
				&& prices.isEmpty();
	}

	public int size(DataKind kind) {
		return switch (kind) {
			case VALUATION -> valuations.size();
			case TRAILING -> trailing.size();
			case QUARTERLY -> quarterly.size();
			case ANNUAL -> annualRatios.size();
			case PRICE -> prices.size();
		};
	}
}
