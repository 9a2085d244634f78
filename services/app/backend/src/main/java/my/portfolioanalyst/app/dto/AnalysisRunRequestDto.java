package my.portfolioanalyst.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.DispatchMode;
import my.portfolioanalyst.app.model.Holding;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public record AnalysisRunRequestDto(
		@NotEmpty @Valid @JsonProperty("holdings") List<HoldingDto> holdings,
		@JsonProperty("mode") DispatchMode mode,
		@JsonProperty("facts") Map<String, String> facts,
		@JsonProperty("follow_up") Boolean followUp,
		@JsonProperty("deliver") Boolean deliver,
		@PositiveOrZero @JsonProperty("deadline_seconds") Integer deadlineSeconds,
		@Valid @JsonProperty("previous_holdings") List<HoldingDto> previousHoldings,
		@PositiveOrZero @JsonProperty("min_variation_percent") BigDecimal minVariationPercent
) {
	public AnalysisRequest toRequest() {
		return new AnalysisRequest(
				toHoldings(holdings),
				mode,
				facts,
				followUp,
				deliver,
				deadlineSeconds == null ? null : Duration.ofSeconds(deadlineSeconds),
				toHoldings(previousHoldings),
				minVariationPercent
		);
	}

	private static List<Holding> toHoldings(List<HoldingDto> dtos) {
		return dtos == null ? List.of() : dtos.stream().map(HoldingDto::toHolding).toList();
	}
}
