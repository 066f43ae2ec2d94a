package my.fundmetrics.app.service;

import my.fundmetrics.app.importer.HeaderLayout;
import my.fundmetrics.app.model.BlockLayout;
import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import my.fundmetrics.app.model.PeriodRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns a period registry into column positions. Each category gets one contiguous block, most recent
 * period first, and one blank column separates neighbouring blocks. Categories without periods take no
 * columns and add no separator.
 */
@Service
public class BlockLayoutProjector {
	public BlockLayout project(PeriodRegistry registry) {
		return project(registry, Category.canonicalOrder());
	}

	public BlockLayout project(PeriodRegistry registry, List<Category> categoriesInOrder) {
		PeriodRegistry source = registry == null ? PeriodRegistry.empty() : registry;
		List<BlockLayout.Block> blocks = new ArrayList<>();
		TreeSet<Integer> separators = new TreeSet<>();
		int column = 0;
		boolean placed = false;
		for (Category category : categoriesInOrder) {
			List<PeriodKey> periods = category.isTimeSeries() ? source.periods(category) : List.of();
			List<FixedColumn> fixedColumns = FixedColumn.of(category);
			int width = category.isTimeSeries() ? periods.size() : fixedColumns.size();
			if (width == 0) {
				blocks.add(new BlockLayout.Block(category, column, column - 1, List.of(), List.of()));
				continue;
			}
			if (placed) {
				separators.add(column);
				column += 1;
			}
			blocks.add(new BlockLayout.Block(category, column, column + width - 1, periods, fixedColumns));
			column += width;
			placed = true;
		}
		return new BlockLayout(blocks, separators, column);
	}

	/**
	 * Header rows for a layout: block titles, category labels on the first column of each block, identity
	 * sub-labels, then one label per column on the period row.
	 */
	public List<List<String>> renderHeaderRows(BlockLayout layout, HeaderLayout headerLayout) {
		List<List<String>> rows = new ArrayList<>(headerLayout.headerRows());
		for (int i = 0; i < headerLayout.headerRows(); i++) {
			rows.add(new ArrayList<>(Collections.nCopies(layout.columnCount(), "")));
		}
		for (BlockLayout.Block block : layout.nonEmptyBlocks()) {
			int start = block.startColumn();
			rows.get(headerLayout.titleRow()).set(start, block.category().title());
			if (block.category().isTimeSeries()) {
				rows.get(headerLayout.categoryRow()).set(start, block.category().label());
				for (int offset = 0; offset < block.periods().size(); offset++) {
					rows.get(headerLayout.periodRow()).set(start + offset, block.periods().get(offset).label());
				}
				continue;
			}
			for (int offset = 0; offset < block.fixedColumns().size(); offset++) {
				FixedColumn fixed = block.fixedColumns().get(offset);
				rows.get(headerLayout.subcategoryRow()).set(start + offset, fixed.subLabel());
				rows.get(headerLayout.periodRow()).set(start + offset, fixed.label());
			}
		}
		return rows;
	}
}
