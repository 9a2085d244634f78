package my.portfolioanalyst.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import my.portfolioanalyst.app.model.Holding;

import java.math.BigDecimal;

public record HoldingDto(
		@NotBlank @JsonProperty("symbol") String symbol,
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
	public Holding toHolding() {
		return new Holding(symbol, companyName, quantity, price, value, sector, exchange, currency,
				yesterdayPrice, variationPercent);
	}
}
