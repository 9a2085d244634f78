package my.portfolioanalyst.app.config;

import my.portfolioanalyst.app.service.LoggingReportDeliveryChannel;
import my.portfolioanalyst.app.service.ReportDeliveryChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AnalysisConfig {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);

	@Bean
	public AnalysisSettings analysisSettings(AppProperties properties) {
		AppProperties.Llm llm = properties == null ? null : properties.llm();
		AppProperties.Analysis analysis = properties == null ? null : properties.analysis();
		AppProperties.Jobs jobs = properties == null ? null : properties.jobs();
		AnalysisSettings defaults = AnalysisSettings.defaults();

		double temperature = llm == null || llm.temperature() == null
				? defaults.temperature()
				: Math.min(2.0, Math.max(0.0, llm.temperature()));
		AnalysisSettings settings = new AnalysisSettings(
				analysis == null || analysis.maxRetries() == null ? defaults.maxRetries() : analysis.maxRetries(),
				analysis == null || analysis.confidenceThreshold() == null
						? defaults.confidenceThreshold()
						: analysis.confidenceThreshold(),
				analysis == null || analysis.workerPoolSize() == null ? defaults.workerPoolSize() : analysis.workerPoolSize(),
				analysis == null || analysis.deadlineSeconds() == null
						? Duration.ZERO
						: Duration.ofSeconds(Math.max(0, analysis.deadlineSeconds())),
				analysis == null || analysis.maxHoldings() == null ? defaults.maxHoldings() : analysis.maxHoldings(),
				temperature,
				analysis != null && Boolean.TRUE.equals(analysis.followUpEnabled()),
				analysis == null || analysis.followUpMaxRetries() == null
						? defaults.followUpMaxRetries()
						: analysis.followUpMaxRetries(),
				analysis == null || analysis.maxPreviousOutputChars() == null
						? defaults.maxPreviousOutputChars()
						: analysis.maxPreviousOutputChars(),
				jobs == null || jobs.ttlMinutes() == null ? defaults.jobTtl() : Duration.ofMinutes(jobs.ttlMinutes()),
				jobs == null || jobs.maxConcurrent() == null ? defaults.maxConcurrentJobs() : jobs.maxConcurrent()
		);
		logger.info("Analysis pipeline configured (maxRetries={}, workers={}, threshold={}, deadline={}).",
				settings.maxRetries(), settings.workerPoolSize(), settings.confidenceThreshold(), settings.deadline());
		return settings;
	}

	@Bean
	@ConditionalOnMissingBean(ReportDeliveryChannel.class)
	public ReportDeliveryChannel loggingReportDeliveryChannel() {
		return new LoggingReportDeliveryChannel();
	}
}
