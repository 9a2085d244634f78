package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.llm.LlmInvoker;
import my.portfolioanalyst.app.llm.LlmRequestException;
import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisShape;
import my.portfolioanalyst.app.model.ExtractedPayload;
import my.portfolioanalyst.app.model.RetryState;
import my.portfolioanalyst.app.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drives one entity through prompt, invocation, extraction and validation, re-prompting with a
 * corrective prompt until the payload validates or the attempt budget is spent.
 * <p>
 * {@code max-retries} is the total number of invocations per run. Transport failures end the run
 * immediately; there is no backoff between attempts. A run is confined to the calling thread, so
 * concurrent runs share nothing but the stateless collaborators.
 */
@Service
public class RetryController {
	private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

	private final LlmInvoker llmInvoker;
	private final PromptBuilder promptBuilder;
	private final ResponseExtractor responseExtractor;
	private final SchemaValidator schemaValidator;
	private final int configuredAttempts;
	private final double temperature;

	public RetryController(LlmInvoker llmInvoker,
						   PromptBuilder promptBuilder,
						   ResponseExtractor responseExtractor,
						   SchemaValidator schemaValidator,
						   AnalysisSettings settings) {
		this.llmInvoker = llmInvoker;
		this.promptBuilder = promptBuilder;
		this.responseExtractor = responseExtractor;
		this.schemaValidator = schemaValidator;
		this.configuredAttempts = Math.max(1, settings.maxRetries());
		this.temperature = settings.temperature();
	}

	public RetryOutcome run(AnalysisContext context) {
		return run(context, promptBuilder.buildInitial(context), configuredAttempts);
	}

	/**
	 * Runs the loop from a caller-supplied first prompt with its own attempt budget. Corrective prompts
	 * are still built from the context.
	 */
	public RetryOutcome run(AnalysisContext context, String initialPrompt, int attemptLimit) {
		int maxAttempts = Math.max(1, attemptLimit);
		AnalysisShape shape = context.shape();
		List<String> expectedKeys = shape == AnalysisShape.SINGLE ? context.expectedKeys() : List.of();
		RetryState state = RetryState.BUILDING;
		String prompt = initialPrompt;
		ValidationOutcome lastOutcome = null;
		int attempt = 0;
		while (true) {
			if (Thread.currentThread().isInterrupted()) {
				logger.warn("Analysis of {} cancelled after {} attempt(s)", context.label(), attempt);
				return RetryOutcome.timedOut(state, attempt, lastOutcome);
			}
			state = advance(state, RetryState.AWAITING_RESPONSE);
			attempt++;
			logger.debug("Prompt for {} (attempt {}/{}):\n{}", context.label(), attempt, maxAttempts, prompt);
			String raw;
			try {
				raw = llmInvoker.invoke(prompt, temperature);
			} catch (RuntimeException ex) {
				if (Thread.currentThread().isInterrupted()) {
					logger.warn("Analysis of {} interrupted while waiting for the LLM", context.label());
					return RetryOutcome.timedOut(state, attempt, lastOutcome);
				}
				String message = safeMessage(ex);
				if (ex instanceof LlmRequestException requestException) {
					logger.warn("LLM request for {} failed (status={}): {}", context.label(),
							requestException.getStatusCode(), message);
				} else {
					logger.warn("LLM invocation for {} failed: {}", context.label(), message, ex);
				}
				return RetryOutcome.invocationFailed(state, attempt, lastOutcome, message);
			}

			state = advance(state, RetryState.EXTRACTING);
			ExtractedPayload payload = responseExtractor.extract(raw);

			state = advance(state, RetryState.VALIDATING);
			ValidationOutcome outcome = schemaValidator.validate(payload, shape, expectedKeys);
			lastOutcome = outcome;
			if (outcome.valid()) {
				advance(state, RetryState.ACCEPTED);
				logger.info("Analysis of {} accepted on attempt {}/{}", context.label(), attempt, maxAttempts);
				return RetryOutcome.accepted(attempt, outcome);
			}
			if (attempt >= maxAttempts) {
				advance(state, RetryState.EXHAUSTED);
				logger.warn("Analysis of {} exhausted after {} attempt(s); missing fields: {}", context.label(),
						attempt, outcome.missingFields());
				return RetryOutcome.exhausted(attempt, outcome);
			}
			state = advance(state, RetryState.RETRYING);
			logger.info("Analysis of {} rejected on attempt {}/{}: {}", context.label(), attempt, maxAttempts,
					outcome.missingFields());
			prompt = promptBuilder.buildCorrective(context, raw, outcome.issues());
		}
	}

	private RetryState advance(RetryState from, RetryState to) {
		if (!from.canMoveTo(to)) {
			throw new IllegalStateException("Illegal retry transition " + from + " -> " + to);
		}
		return to;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
