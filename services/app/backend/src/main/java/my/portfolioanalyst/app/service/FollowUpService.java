package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers follow-up questions raised by accepted analyses with one more validate-retry round per
 * holding. Rounds run concurrently on the dispatcher's worker pool within the remaining time budget;
 * a holding keeps its original result when its round fails or runs out of time.
 */
@Service
public class FollowUpService {
	private static final Logger logger = LoggerFactory.getLogger(FollowUpService.class);

	private final RetryController retryController;
	private final EntityDispatcher entityDispatcher;
	private final PromptBuilder promptBuilder;
	private final Aggregator aggregator;
	private final ObjectMapper objectMapper;
	private final int maxAttempts;

	public FollowUpService(RetryController retryController,
						   EntityDispatcher entityDispatcher,
						   PromptBuilder promptBuilder,
						   Aggregator aggregator,
						   ObjectMapper objectMapper,
						   AnalysisSettings settings) {
		this.retryController = retryController;
		this.entityDispatcher = entityDispatcher;
		this.promptBuilder = promptBuilder;
		this.aggregator = aggregator;
		this.objectMapper = objectMapper;
		this.maxAttempts = settings.followUpMaxRetries();
	}

	public AnalysisReport resolve(AnalysisReport report) {
		return resolve(report, Map.of(), Duration.ZERO);
	}

	/**
	 * @param budget time left for all follow-up rounds together; zero waits for every round
	 */
	public AnalysisReport resolve(AnalysisReport report, Map<String, String> facts, Duration budget) {
		if (report == null) {
			return null;
		}
		List<AnalysisResult> pending = report.resultList().stream()
				.filter(result -> result.isAccepted() && result.hasFollowUpQuestion())
				.toList();
		if (pending.isEmpty()) {
			return report;
		}
		List<AnalysisResult> answers = entityDispatcher.runRevisions(pending, result -> answer(result, facts), budget);
		Map<String, AnalysisResult> answered = new HashMap<>();
		for (int i = 0; i < pending.size(); i++) {
			if (answers.get(i) != null) {
				answered.put(pending.get(i).key(), answers.get(i));
			}
		}
		if (answered.isEmpty()) {
			return report;
		}
		logger.info("Resolved {} of {} follow-up question(s)", answered.size(), pending.size());
		List<AnalysisResult> updated = report.resultList().stream()
				.map(result -> answered.getOrDefault(result.key(), result))
				.toList();
		return aggregator.combine(report.mode(), updated);
	}

	private AnalysisResult answer(AnalysisResult result, Map<String, String> facts) {
		AnalysisContext context = AnalysisContext.holding(result.holding(), facts);
		String prompt;
		try {
			prompt = promptBuilder.buildFollowUp(context, previousAnalysisJson(result), result.followUpQuestion());
		} catch (JacksonException ex) {
			logger.warn("Could not serialize previous analysis of {}: {}", result.key(), ex.getOriginalMessage());
			return null;
		}
		RetryOutcome outcome = retryController.run(context, prompt, maxAttempts);
		if (outcome.status() != AnalysisStatus.ACCEPTED) {
			logger.warn("Follow-up for {} ended with {}; keeping the original analysis", result.key(), outcome.status());
			return null;
		}
		return outcome.results(context).get(0)
				.withoutFollowUpQuestion()
				.withAttempts(result.attempts() + outcome.attempts());
	}

	private String previousAnalysisJson(AnalysisResult result) {
		Map<String, Object> previous = new LinkedHashMap<>();
		previous.put("recommendation", result.recommendation());
		previous.put("estimated_return", result.estimatedReturn());
		previous.put("confidence", result.confidence());
		previous.put("risk_notes", result.riskNotes());
		previous.put("sources", result.sources());
		previous.put("follow_up_question", result.followUpQuestion());
		return objectMapper.writeValueAsString(previous);
	}
}
