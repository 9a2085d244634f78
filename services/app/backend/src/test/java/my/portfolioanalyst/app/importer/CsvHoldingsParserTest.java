package my.portfolioanalyst.app.importer;

import my.portfolioanalyst.app.model.Holding;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvHoldingsParserTest {
	private final CsvHoldingsParser parser = new CsvHoldingsParser();

	@Test
	void parsesCommaSeparatedRowsInFileOrder() {
		String csv = "symbol,company_name,quantity,price,value,sector,exchange,currency\n"
				+ "TCS,Tata Consultancy,10,3500.5,,IT,NSE,INR\n"
				+ "HDFCBANK,HDFC Bank,5,1600,8000,Financials,NSE,INR\n";

		List<Holding> holdings = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(holdings).extracting(Holding::symbol).containsExactly("TCS", "HDFCBANK");
		Holding tcs = holdings.get(0);
		assertThat(tcs.companyName()).isEqualTo("Tata Consultancy");
		assertThat(tcs.value()).isEqualByComparingTo(new BigDecimal("35005.0"));
		assertThat(tcs.key()).isEqualTo("NSE:TCS");
		assertThat(tcs.currency()).isEqualTo("INR");
		assertThat(holdings.get(1).value()).isEqualByComparingTo("8000");
	}

	@Test
	void acceptsSemicolonsAliasesAndDecimalCommas() {
		String csv = "Ticker;Name;Qty;Price;Industry\n"
				+ "SAP;SAP SE;3;123,45;Software\n"
				+ ";Missing symbol;1;1;x\n";

		List<Holding> holdings = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(holdings).hasSize(1);
		Holding sap = holdings.get(0);
		assertThat(sap.symbol()).isEqualTo("SAP");
		assertThat(sap.price()).isEqualByComparingTo("123.45");
		assertThat(sap.sector()).isEqualTo("Software");
		assertThat(sap.exchange()).isNull();
	}

	@Test
	void fallsBackToLatin1AndStripsBom() {
		byte[] latin1 = "symbol,company_name\nNESN,Nestlé\n".getBytes(StandardCharsets.ISO_8859_1);
		byte[] withBom = "\uFEFFsymbol,sector\nAAPL,Tech\n".getBytes(StandardCharsets.UTF_8);

		assertThat(parser.parse(latin1).get(0).companyName()).isEqualTo("Nestlé");
		assertThat(parser.parse(withBom).get(0).sector()).isEqualTo("Tech");
	}

	@Test
	void ignoresUnparseableNumbers() {
		String csv = "symbol,quantity,price\nAAPL,ten,190\n";

		Holding holding = parser.parse(csv.getBytes(StandardCharsets.UTF_8)).get(0);

		assertThat(holding.quantity()).isNull();
		assertThat(holding.value()).isNull();
		assertThat(holding.price()).isEqualByComparingTo("190");
	}

	@Test
	void rejectsFilesWithoutSymbolColumn() {
		assertThatThrownBy(() -> parser.parse("name,value\nApple,10\n".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("symbol column");
		assertThatThrownBy(() -> parser.parse(new byte[0]))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
