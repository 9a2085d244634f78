package my.portfolioanalyst.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One portfolio position as supplied by the holdings source. Immutable input to the analysis pipeline.
 */
public record Holding(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("company_name") String companyName,
		@JsonProperty("quantity") BigDecimal quantity,
		@JsonProperty("price") BigDecimal price,
		@JsonProperty("value") BigDecimal value,
		@JsonProperty("sector") String sector,
		@JsonProperty("exchange") String exchange,
		@JsonProperty("currency") String currency,
		@JsonProperty("yesterday_price") BigDecimal yesterdayPrice,
		@JsonProperty("variation_percent") BigDecimal variationPercent
) {
	public Holding {
		if (symbol == null || symbol.isBlank()) {
			throw new IllegalArgumentException("Holding symbol is required");
		}
		symbol = symbol.trim();
		companyName = trimToNull(companyName);
		sector = trimToNull(sector);
		exchange = trimToNull(exchange);
		currency = trimToNull(currency);
	}

	public Holding(String symbol,
				   String companyName,
				   BigDecimal quantity,
				   BigDecimal price,
				   BigDecimal value,
				   String sector) {
		this(symbol, companyName, quantity, price, value, sector, null, null, null, null);
	}

	/**
	 * Slot key of this holding within one run: {@code EXCHANGE:SYMBOL}, or the bare symbol without exchange.
	 */
	public String key() {
		return exchange == null ? symbol : exchange + ":" + symbol;
	}

	public String displayName() {
		return companyName == null ? symbol : companyName;
	}

	/**
	 * Position value: the supplied value, else quantity times price, else zero.
	 */
	public BigDecimal marketValue() {
		if (value != null) {
			return value;
		}
		if (quantity != null && price != null) {
			return quantity.multiply(price);
		}
		return BigDecimal.ZERO;
	}

	public Holding withPriceMovement(BigDecimal previousPrice, BigDecimal variation) {
		return new Holding(symbol, companyName, quantity, price, value, sector, exchange, currency, previousPrice, variation);
	}

	private static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
