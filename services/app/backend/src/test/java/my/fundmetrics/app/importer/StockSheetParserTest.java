package my.fundmetrics.app.importer;

import my.fundmetrics.app.model.Category;
import my.fundmetrics.app.model.FixedColumn;
import my.fundmetrics.app.model.PeriodKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StockSheetParserTest {
	private static final PeriodKey MARCH = PeriodKey.yearMonth(2024, 3);
	private static final PeriodKey DECEMBER = PeriodKey.yearMonth(2023, 12);

	private final ColumnClassificationMap classification = new ColumnClassificationMap(List.of(
			ColumnClassification.fixed(0, FixedColumn.SERIAL_NO, Category.IDENTITY, "S. No."),
			ColumnClassification.fixed(1, FixedColumn.COMPANY_NAME, Category.IDENTITY, "Company Name"),
			ColumnClassification.fixed(2, FixedColumn.ACCORD_CODE, Category.IDENTITY, "Accord Code"),
			ColumnClassification.separator(3),
			ColumnClassification.timeSeries(4, Category.TTM_PAT, MARCH, "202403"),
			ColumnClassification.timeSeries(5, Category.TTM_PAT, DECEMBER, "202312"),
			ColumnClassification.timeSeries(6, Category.TTM_PAT, null, "Dec 23")
	));

	private final StockSheetParser parser = new StockSheetParser();

	@Test
	void mapsCellsByClassification() {
		StockSheetParser.Result result = parser.parse(classification, List.of(
				List.of("1", " Infosys ", "INF01", "", "1,250.5", "NA", "999")
		), 8);

		assertThat(result.skippedRows()).isZero();
		assertThat(result.rows()).hasSize(1);
		StockSheetRow row = result.rows().get(0);
		assertThat(row.rowNumber()).isEqualTo(9);
		assertThat(row.companyName()).isEqualTo("Infosys");
		assertThat(row.accordCode()).isEqualTo("INF01");
		assertThat(row.value(Category.TTM_PAT, MARCH)).isEqualByComparingTo("1250.5");
		assertThat(row.value(Category.TTM_PAT, DECEMBER)).isNull();
		assertThat(row.periods(Category.TTM_PAT)).containsExactly(MARCH);
	}

	@Test
	void skipsSampleBlankAndIncompleteRows() {
		StockSheetParser.Result result = parser.parse(classification, List.of(
				List.of("XX", "Sample Ltd", "SAMPLE", "", "1", "2", ""),
				List.of("", "", "", "", "", "", ""),
				List.of("2", "No Code Ltd", "", "", "1", "2", ""),
				List.of("3", "Wipro", "WIP01")
		), 8);

		assertThat(result.skippedRows()).isEqualTo(3);
		assertThat(result.rows()).extracting(StockSheetRow::accordCode).containsExactly("WIP01");
		assertThat(result.rows().get(0).rowNumber()).isEqualTo(12);
		assertThat(result.rows().get(0).periods(Category.TTM_PAT)).isEmpty();
	}
}
