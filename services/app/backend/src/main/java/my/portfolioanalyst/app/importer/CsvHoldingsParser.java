package my.portfolioanalyst.app.importer;

import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads holdings from a header-based CSV export. Rows keep file order; rows without a symbol are skipped.
 */
@Component
public class CsvHoldingsParser implements HoldingsParser {
	private static final Logger logger = LoggerFactory.getLogger(CsvHoldingsParser.class);

	private static final List<String> SYMBOL_COLUMNS = List.of("symbol", "ticker", "tradingsymbol", "stock_symbol",
			"ticker_symbol", "instrument", "code");
	private static final List<String> COMPANY_COLUMNS = List.of("company_name", "company", "name", "security_name");
	private static final List<String> QUANTITY_COLUMNS = List.of("quantity", "qty", "shares", "units");
	private static final List<String> PRICE_COLUMNS = List.of("price", "last_price", "unit_price", "avg_price");
	private static final List<String> VALUE_COLUMNS = List.of("value", "market_value", "current_value", "total_value");
	private static final List<String> SECTOR_COLUMNS = List.of("sector", "industry");
	private static final List<String> EXCHANGE_COLUMNS = List.of("exchange", "market", "listed_on");
	private static final List<String> CURRENCY_COLUMNS = List.of("currency", "ccy");

	@Override
	public List<Holding> parse(byte[] payload) {
		String content = CsvParsing.decode(payload);
		if (content.isBlank()) {
			throw new IllegalArgumentException("CSV file is empty");
		}
		char delimiter = CsvParsing.sniffDelimiter(content);
		List<Holding> holdings = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withTrim()
		)) {
			Map<String, String> columns = new HashMap<>();
			for (String header : parser.getHeaderNames()) {
				columns.putIfAbsent(CsvParsing.normalizeHeader(header), header);
			}
			String symbolColumn = find(columns, SYMBOL_COLUMNS);
			if (symbolColumn == null) {
				throw new IllegalArgumentException("CSV has no symbol column (expected one of " + SYMBOL_COLUMNS + ")");
			}
			String companyColumn = find(columns, COMPANY_COLUMNS);
			String quantityColumn = find(columns, QUANTITY_COLUMNS);
			String priceColumn = find(columns, PRICE_COLUMNS);
			String valueColumn = find(columns, VALUE_COLUMNS);
			String sectorColumn = find(columns, SECTOR_COLUMNS);
			String exchangeColumn = find(columns, EXCHANGE_COLUMNS);
			String currencyColumn = find(columns, CURRENCY_COLUMNS);

			for (CSVRecord record : parser) {
				String symbol = value(record, symbolColumn);
				if (symbol == null) {
					continue;
				}
				BigDecimal quantity = parseDecimal(value(record, quantityColumn), record, "quantity");
				BigDecimal price = parseDecimal(value(record, priceColumn), record, "price");
				BigDecimal value = parseDecimal(value(record, valueColumn), record, "value");
				if (value == null && quantity != null && price != null) {
					value = quantity.multiply(price);
				}
				holdings.add(new Holding(
						symbol,
						value(record, companyColumn),
						quantity,
						price,
						value,
						value(record, sectorColumn),
						value(record, exchangeColumn),
						value(record, currencyColumn),
						null,
						null
				));
			}
		} catch (IOException | UncheckedIOException exc) {
			throw new IllegalArgumentException("Failed to read holdings CSV: " + exc.getMessage(), exc);
		}
		logger.info("Parsed {} holding(s) from CSV", holdings.size());
		return holdings;
	}

	private String find(Map<String, String> columns, List<String> aliases) {
		for (String alias : aliases) {
			String header = columns.get(alias);
			if (header != null) {
				return header;
			}
		}
		return null;
	}

	private String value(CSVRecord record, String column) {
		if (column == null || !record.isSet(column)) {
			return null;
		}
		String raw = record.get(column);
		return raw == null || raw.isBlank() ? null : raw.trim();
	}

	private BigDecimal parseDecimal(String raw, CSVRecord record, String field) {
		if (raw == null) {
			return null;
		}
		String value = raw.replace("\u20AC", "").replace("\u20B9", "").replace("$", "").replace("\u00A0", "").replace(" ", "");
		int lastComma = value.lastIndexOf(',');
		int lastDot = value.lastIndexOf('.');
		if (lastComma >= 0 && lastDot >= 0) {
			value = lastComma > lastDot
					? value.replace(".", "").replace(",", ".")
					: value.replace(",", "");
		} else if (lastComma >= 0) {
			value = value.replace(",", ".");
		}
		try {
			return new BigDecimal(value);
		} catch (NumberFormatException exc) {
			logger.warn("Ignoring non-numeric {} '{}' in CSV line {}", field, raw, record.getRecordNumber());
			return null;
		}
	}
}
