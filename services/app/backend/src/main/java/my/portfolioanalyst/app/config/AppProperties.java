package my.portfolioanalyst.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Llm llm,
		Analysis analysis,
		Jobs jobs
) {
	public record Llm(
			@NotBlank String provider,
			Double temperature
	) {
	}

	public record Analysis(
			Integer maxRetries,
			Double confidenceThreshold,
			Integer workerPoolSize,
			Integer deadlineSeconds,
			Integer maxHoldings,
			Boolean followUpEnabled,
			Integer followUpMaxRetries,
			Integer maxPreviousOutputChars
	) {
	}

	public record Jobs(
			Integer ttlMinutes,
			Integer maxConcurrent
	) {
	}
}
