package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeaderClassifierTest {
	private final HeaderClassifier classifier = new HeaderClassifier();

	@Test
	void classifiesBlocksFromHeaderRows() {
		List<List<String>> rows = header(20);
		identity(rows);
		set(rows, 5, 14, "TTM Revenue");
		set(rows, 7, 14, "202403");
		set(rows, 7, 15, "202312");
		set(rows, 5, 17, "Market Cap");
		set(rows, 7, 17, "2024-03-31");
		set(rows, 7, 19, "ISIN");

		ColumnClassificationMap map = classifier.classify(rows);

		assertThat(map.columnOf(FixedColumn.COMPANY_NAME)).contains(1);
		assertThat(map.columnOf(FixedColumn.ACCORD_CODE)).contains(2);
		assertThat(map.columnOf(FixedColumn.ISIN)).contains(19);
		assertThat(map.separators()).containsExactly(13, 16, 18);
		assertThat(map.column(14).category()).isEqualTo(Category.TTM_REVENUE);
		assertThat(map.column(15).category()).isEqualTo(Category.TTM_REVENUE);
		assertThat(map.column(15).period()).isEqualTo(PeriodKey.yearMonth(2023, 12));
		assertThat(map.column(17).category()).isEqualTo(Category.MARKET_CAP);
		assertThat(map.discoveredPeriods())
				.containsEntry(Category.TTM_REVENUE, List.of(PeriodKey.yearMonth(2024, 3), PeriodKey.yearMonth(2023, 12)))
				.containsEntry(Category.MARKET_CAP, List.of(PeriodKey.date(LocalDate.of(2024, 3, 31))));
	}

	@Test
	void separatorEndsCarriedCategory() {
		List<List<String>> rows = header(18);
		identity(rows);
		set(rows, 5, 14, "TTM PAT");
		set(rows, 7, 14, "202403");
		set(rows, 7, 16, "202312");

		ColumnClassificationMap map = classifier.classify(rows);

		assertThat(map.column(15).isSeparator()).isTrue();
		assertThat(map.column(16).kind()).isEqualTo(ColumnClassification.Kind.UNKNOWN);
		assertThat(map.columnsOf(Category.TTM_PAT)).hasSize(1);
	}

	@Test
	void unparseablePeriodIsReportedAndSkipped() {
		List<List<String>> rows = header(16);
		identity(rows);
		set(rows, 5, 14, "Quarterly Revenue");
		set(rows, 7, 14, "2025-03");
		set(rows, 7, 15, "202412");

		ColumnClassificationMap map = classifier.classify(rows);

		assertThat(map.unparseableColumns()).extracting(ColumnClassification::columnIndex).containsExactly(14);
		assertThat(map.timeSeriesColumns()).extracting(ColumnClassification::columnIndex).containsExactly(15);
		assertThat(map.discoveredPeriods().get(Category.QUARTERLY_REVENUE))
				.containsExactly(PeriodKey.yearMonth(2024, 12));
	}

	@Test
	void subcategoryLabelsSplitThePriceBlock() {
		List<List<String>> rows = header(20);
		identity(rows);
		set(rows, 5, 5, "Stock wise Fundamentals and Valuations");
		set(rows, 6, 10, "PR");
		set(rows, 5, 14, "Share Price");
		set(rows, 6, 14, "Share Price");
		set(rows, 6, 16, "PR");
		set(rows, 6, 18, "PE");
		for (int col = 14; col < 20; col += 2) {
			set(rows, 7, col, "2025-06-30");
			set(rows, 7, col + 1, "2025-03-28");
		}

		ColumnClassificationMap map = classifier.classify(rows);

		assertThat(map.columnOf(FixedColumn.FREE_FLOAT)).contains(5);
		assertThat(map.columnOf(FixedColumn.PE_CURRENT)).contains(10);
		assertThat(map.columnsOf(Category.SHARE_PRICE)).extracting(ColumnClassification::columnIndex)
				.containsExactly(14, 15);
		assertThat(map.columnsOf(Category.PR_RATIO)).extracting(ColumnClassification::columnIndex)
				.containsExactly(16, 17);
		assertThat(map.columnsOf(Category.PE_RATIO)).extracting(ColumnClassification::columnIndex)
				.containsExactly(18, 19);
		assertThat(map.discoveredPeriods().get(Category.PE_RATIO)).containsExactly(
				PeriodKey.date(LocalDate.of(2025, 6, 30)), PeriodKey.date(LocalDate.of(2025, 3, 28)));
		assertThat(map.unknownColumns()).isEmpty();
	}

	@Test
	void categoryLabelsPreferMostSpecificMatch() {
		assertThat(HeaderClassifier.categoryForLabel("Market Cap Free Float")).contains(Category.MARKET_CAP_FREE_FLOAT);
		assertThat(HeaderClassifier.categoryForLabel("Market Cap")).contains(Category.MARKET_CAP);
		assertThat(HeaderClassifier.categoryForLabel("TTM Net Sales")).contains(Category.TTM_REVENUE);
		assertThat(HeaderClassifier.categoryForLabel("Quarterly PAT Free Float"))
				.contains(Category.QUARTERLY_PAT_FREE_FLOAT);
		assertThat(HeaderClassifier.categoryForLabel("Price to Earnings Ratio")).contains(Category.PE_RATIO);
		assertThat(HeaderClassifier.categoryForLabel("PR Ratio")).contains(Category.PR_RATIO);
		assertThat(HeaderClassifier.categoryForLabel("PE Ratio")).contains(Category.PE_RATIO);
		assertThat(HeaderClassifier.categoryForLabel("Operating ratio")).isEmpty();
		assertThat(HeaderClassifier.categoryForLabel("")).isEmpty();
	}

	@Test
	void missingAccordCodeIsSchemaError() {
		List<List<String>> rows = header(14);
		identity(rows);
		set(rows, 7, 2, "");

		assertThatThrownBy(() -> classifier.classify(rows))
				.isInstanceOf(SchemaException.class)
				.satisfies(ex -> assertThat(((SchemaException) ex).getMissingColumn()).isEqualTo("accord_code"));
	}

	@Test
	void tooFewHeaderRowsIsSchemaError() {
		List<List<String>> rows = header(14).subList(0, 5);

		assertThatThrownBy(() -> classifier.classify(rows))
				.isInstanceOf(SchemaException.class)
				.hasMessageContaining("Expected 8 header rows");
	}

	private static List<List<String>> header(int width) {
		List<List<String>> rows = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			rows.add(new ArrayList<>(Collections.nCopies(width, "")));
		}
		return rows;
	}

	private static void identity(List<List<String>> rows) {
		List<FixedColumn> columns = FixedColumn.of(Category.IDENTITY);
		for (int col = 0; col < columns.size(); col++) {
			set(rows, 6, col, columns.get(col).subLabel());
			set(rows, 7, col, columns.get(col).label());
		}
	}

	private static void set(List<List<String>> rows, int row, int col, String value) {
		rows.get(row).set(col, value);
	}
}
