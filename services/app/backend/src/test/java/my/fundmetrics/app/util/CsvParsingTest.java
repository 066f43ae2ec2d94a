package my.fundmetrics.app.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		assertThat(CsvParsing.stripBom("\uFEFFa,b,c")).isEqualTo("a,b,c");
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterLooksAtFirstLineOnly() {
		assertThat(CsvParsing.sniffDelimiter("a;b;c\n1,2,3,4,5")).isEqualTo(';');
		assertThat(CsvParsing.sniffDelimiter("a\tb\tc")).isEqualTo('\t');
		assertThat(CsvParsing.sniffDelimiter("abc")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter(null)).isEqualTo(',');
	}

	@Test
	void decodeFallsBackToLatin1ForInvalidUtf8() {
		byte[] utf8 = "\uFEFFName,Wert".getBytes(StandardCharsets.UTF_8);
		byte[] latin1 = "Café,1".getBytes(StandardCharsets.ISO_8859_1);

		assertThat(CsvParsing.decode(utf8)).isEqualTo("Name,Wert");
		assertThat(CsvParsing.decode(latin1)).isEqualTo("Café,1");
	}

	@Test
	void parseNumberReadsSpreadsheetFormats() {
		assertThat(CsvParsing.parseNumber("₹ 1,23,456.50")).isEqualByComparingTo("123456.50");
		assertThat(CsvParsing.parseNumber("(42.5)")).isEqualByComparingTo("-42.5");
		assertThat(CsvParsing.parseNumber("12.5%")).isEqualByComparingTo("12.5");
		assertThat(CsvParsing.parseNumber("-3")).isEqualByComparingTo(BigDecimal.valueOf(-3));
	}

	@Test
	void parseNumberReturnsNullForMarkersAndGarbage() {
		assertThat(CsvParsing.parseNumber(null)).isNull();
		assertThat(CsvParsing.parseNumber("  ")).isNull();
		assertThat(CsvParsing.parseNumber("NA")).isNull();
		assertThat(CsvParsing.parseNumber("nan")).isNull();
		assertThat(CsvParsing.parseNumber("--")).isNull();
		assertThat(CsvParsing.parseNumber("abc")).isNull();
	}

	@Test
	void csvQuotesOnlyWhenNeeded() {
		assertThat(CsvParsing.csv(null)).isEmpty();
		assertThat(CsvParsing.csv("plain")).isEqualTo("plain");
		assertThat(CsvParsing.csv("Tata, Sons")).isEqualTo("\"Tata, Sons\"");
		assertThat(CsvParsing.csv("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
		assertThat(CsvParsing.csv(new BigDecimal("1E+3"))).isEqualTo("1000");
	}
}
