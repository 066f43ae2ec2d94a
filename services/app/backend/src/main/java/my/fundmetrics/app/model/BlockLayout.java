package my.fundmetrics.app.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Column ranges of every block in an export, derived from a period registry. Positions are only valid for
 * the registry they were projected from.
 */
public final class BlockLayout {
	private final List<Block> blocks;
	private final SortedSet<Integer> separators;
	private final int columnCount;

	public BlockLayout(List<Block> blocks, SortedSet<Integer> separators, int columnCount) {
		this.blocks = List.copyOf(blocks);
		this.separators = Collections.unmodifiableSortedSet(new TreeSet<>(separators));
		this.columnCount = columnCount;
	}

	public List<Block> blocks() {
		return blocks;
	}

	public SortedSet<Integer> separators() {
		return separators;
	}

	public int columnCount() {
		return columnCount;
	}

	public Optional<Block> block(Category category) {
		return blocks.stream().filter(block -> block.category() == category).findFirst();
	}

	public List<Block> nonEmptyBlocks() {
		List<Block> result = new ArrayList<>();
		for (Block block : blocks) {
			if (block.width() > 0) {
				result.add(block);
			}
		}
		return result;
	}

	public Optional<Integer> columnOf(Category category, PeriodKey period) {
		return block(category).flatMap(block -> {
			int offset = block.periods().indexOf(period);
			return offset < 0 ? Optional.empty() : Optional.of(block.startColumn() + offset);
		});
	}

	/**
	 * @param endColumn inclusive; {@code startColumn - 1} for a zero-width block
	 * @param fixedColumns columns of a fixed block, empty for time-series blocks
	 */
	public record Block(Category category, int startColumn, int endColumn, List<PeriodKey> periods,
						List<FixedColumn> fixedColumns) {
		public Block {
			periods = List.copyOf(periods);
			fixedColumns = List.copyOf(fixedColumns);
		}

		public int width() {
			return endColumn - startColumn + 1;
		}
	}
}
