package my.fundmetrics.app.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Distinct period keys seen per time-series category, most recent first. Instances are immutable;
 * {@link #merge(Map)} returns a registry that contains every period of this one plus the new ones.
 */
public final class PeriodRegistry {
	private static final PeriodRegistry EMPTY = new PeriodRegistry(new EnumMap<>(Category.class));

	private final Map<Category, List<PeriodKey>> periods;

	private PeriodRegistry(Map<Category, List<PeriodKey>> periods) {
		this.periods = periods;
	}

	public static PeriodRegistry empty() {
		return EMPTY;
	}

	public static PeriodRegistry of(Map<Category, ? extends Collection<PeriodKey>> periods) {
		return EMPTY.merge(periods);
	}

	public List<PeriodKey> periods(Category category) {
		return periods.getOrDefault(category, List.of());
	}

	public int size(Category category) {
		return periods(category).size();
	}

	public boolean isEmpty() {
		return periods.values().stream().allMatch(List::isEmpty);
	}

	public Map<Category, List<PeriodKey>> asMap() {
		return Collections.unmodifiableMap(periods);
	}

	public PeriodRegistry merge(Map<Category, ? extends Collection<PeriodKey>> additions) {
		if (additions == null || additions.isEmpty()) {
			return this;
		}
		Map<Category, List<PeriodKey>> merged = new EnumMap<>(Category.class);
		for (Category category : Category.timeSeries()) {
			TreeSet<PeriodKey> keys = new TreeSet<>(Comparator.reverseOrder());
			keys.addAll(periods(category));
			Collection<PeriodKey> added = additions.get(category);
			if (added != null) {
				for (PeriodKey key : added) {
					if (key != null && key.kind() == category.periodKind()) {
						keys.add(key);
					}
				}
			}
			if (!keys.isEmpty()) {
				merged.put(category, List.copyOf(keys));
			}
		}
		return new PeriodRegistry(merged);
	}

	public PeriodRegistry union(PeriodRegistry other) {
		return other == null ? this : merge(other.periods);
	}

	/**
	 * Periods in {@code candidates} that this registry does not hold yet.
	 */
	public Map<Category, List<PeriodKey>> unknown(Map<Category, ? extends Collection<PeriodKey>> candidates) {
		Map<Category, List<PeriodKey>> result = new EnumMap<>(Category.class);
		if (candidates == null) {
			return result;
		}
		for (Map.Entry<Category, ? extends Collection<PeriodKey>> entry : candidates.entrySet()) {
			List<PeriodKey> known = periods(entry.getKey());
			List<PeriodKey> fresh = new ArrayList<>();
			for (PeriodKey key : entry.getValue()) {
				if (!known.contains(key) && !fresh.contains(key)) {
					fresh.add(key);
				}
			}
			if (!fresh.isEmpty()) {
				result.put(entry.getKey(), fresh);
			}
		}
		return result;
	}

	public boolean includes(PeriodRegistry other) {
		for (Map.Entry<Category, List<PeriodKey>> entry : other.periods.entrySet()) {
			if (!periods(entry.getKey()).containsAll(entry.getValue())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * View holding only the {@code count} most recent periods of each category; a non-positive count keeps all.
	 */
	public PeriodRegistry limitedTo(int count) {
		if (count <= 0) {
			return this;
		}
		Map<Category, List<PeriodKey>> limited = new EnumMap<>(Category.class);
		periods.forEach((category, keys) -> limited.put(category, keys.subList(0, Math.min(count, keys.size()))));
		return new PeriodRegistry(limited);
	}

	@Override
	public String toString() {
		return "PeriodRegistry" + periods;
	}
}
