package my.portfolioanalyst.app.config;

import my.portfolioanalyst.app.llm.LlmInvoker;
import my.portfolioanalyst.app.llm.NoopLlmInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);

	@Bean
	@ConditionalOnMissingBean(LlmInvoker.class)
	public LlmInvoker noopLlmInvoker(AppProperties properties) {
		String provider = properties == null || properties.llm() == null || properties.llm().provider() == null
				? "noop"
				: properties.llm().provider().trim().toLowerCase(Locale.ROOT);
		if (!provider.equals("noop") && !provider.equals("none") && !provider.equals("disabled")) {
			logger.warn("No LlmInvoker bean registered for provider={}; analysis requests will fail until one is provided.",
					provider);
		}
		logger.info("LLM invoker disabled (provider=noop).");
		return new NoopLlmInvoker();
	}
}
