package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.llm.LlmRequestException;
import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.AnalysisStatus;
import my.portfolioanalyst.app.model.FieldIssue;
import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.model.Recommendation;
import my.portfolioanalyst.app.model.RetryState;
import my.portfolioanalyst.app.support.ScriptedLlmInvoker;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static my.portfolioanalyst.app.support.AnalysisTestData.holding;
import static my.portfolioanalyst.app.support.AnalysisTestData.portfolioEntryJson;
import static my.portfolioanalyst.app.support.AnalysisTestData.settings;
import static my.portfolioanalyst.app.support.AnalysisTestData.validHoldingJson;
import static org.assertj.core.api.Assertions.assertThat;

class RetryControllerTest {
	private final Holding aapl = holding("AAPL", "Technology", "1000");

	@Test
	void acceptsFencedBuyOnFirstAttempt() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(
				"Here is my view:\n```json\n" + validHoldingJson("BUY", 0.8) + "\n```\nGood luck!");
		AnalysisContext context = AnalysisContext.holding(aapl, Map.of());

		RetryOutcome outcome = controller(invoker, 3).run(context);

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.ACCEPTED);
		assertThat(outcome.finalState()).isEqualTo(RetryState.ACCEPTED);
		assertThat(outcome.attempts()).isEqualTo(1);
		AnalysisResult result = outcome.results(context).get(0);
		assertThat(result.recommendation()).isEqualTo(Recommendation.BUY);
		assertThat(result.confidence()).isEqualTo(0.8);
		assertThat(result.sources()).containsExactly("news", "financial report");
		assertThat(invoker.invocations()).isEqualTo(1);
	}

	@Test
	void exhaustsAfterThreeAttemptsWithoutJson() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker("I cannot help with that.");
		AnalysisContext context = AnalysisContext.holding(aapl, Map.of());

		RetryOutcome outcome = controller(invoker, 3).run(context);

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.EXHAUSTED);
		assertThat(outcome.attempts()).isEqualTo(3);
		assertThat(invoker.invocations()).isEqualTo(3);
		AnalysisResult result = outcome.results(context).get(0);
		assertThat(result.errorCode()).isEqualTo("retries_exhausted");
		assertThat(result.missingFields()).contains(FieldIssue.ENTIRE_PAYLOAD);
		assertThat(result.diagnostics()).isNotNull();
		assertThat(result.error()).contains("3 attempt(s)");
	}

	@Test
	void sendsCorrectivePromptAfterInvalidAnswer() {
		String incomplete = "{\"recommendation\":\"SELL\",\"risk_notes\":\"Debt\",\"sources\":[\"news\"]}";
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(incomplete, validHoldingJson("SELL", 0.55));
		AnalysisContext context = AnalysisContext.holding(aapl, Map.of());

		RetryOutcome outcome = controller(invoker, 3).run(context);

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.ACCEPTED);
		assertThat(outcome.attempts()).isEqualTo(2);
		String corrective = invoker.prompts().get(1);
		assertThat(corrective).contains("- confidence: missing").contains(incomplete);
	}

	@Test
	void neverInvokesMoreThanConfiguredAttempts() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker("{\"recommendation\":\"MAYBE\"}");

		RetryOutcome outcome = controller(invoker, 5).run(AnalysisContext.holding(aapl, Map.of()));

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.EXHAUSTED);
		assertThat(invoker.invocations()).isEqualTo(5).isLessThanOrEqualTo(5 + 1);
	}

	@Test
	void transportErrorEndsRunWithoutRetry() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(new LlmRequestException("Read timed out", 504, true, null));
		AnalysisContext context = AnalysisContext.holding(aapl, Map.of());

		RetryOutcome outcome = controller(invoker, 3).run(context);

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.LLM_ERROR);
		assertThat(invoker.invocations()).isEqualTo(1);
		AnalysisResult result = outcome.results(context).get(0);
		assertThat(result.errorCode()).isEqualTo("llm_invocation_error");
		assertThat(result.error()).contains("Read timed out");
	}

	@Test
	void unexpectedInvokerFailureIsTreatedAsTransportError() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(new IllegalStateException("connection pool closed"));

		RetryOutcome outcome = controller(invoker, 3).run(AnalysisContext.holding(aapl, Map.of()));

		assertThat(outcome.status()).isEqualTo(AnalysisStatus.LLM_ERROR);
		assertThat(outcome.error()).isEqualTo("connection pool closed");
	}

	@Test
	void interruptedThreadStopsAsTimedOut() {
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(validHoldingJson("BUY", 0.8));
		Thread.currentThread().interrupt();
		try {
			RetryOutcome outcome = controller(invoker, 3).run(AnalysisContext.holding(aapl, Map.of()));

			assertThat(outcome.status()).isEqualTo(AnalysisStatus.TIMED_OUT);
			assertThat(invoker.invocations()).isZero();
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	void portfolioRunSplitsIntoOneResultPerHolding() {
		Holding msft = holding("MSFT", "Technology", "800");
		String answer = "{\"analyses\":[" + portfolioEntryJson("MSFT", "RETAIN", 0.6) + ","
				+ portfolioEntryJson("AAPL", "BUY", 0.9) + "]}";
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(answer);
		AnalysisContext context = AnalysisContext.portfolio(List.of(aapl, msft), Map.of());

		List<AnalysisResult> results = controller(invoker, 3).run(context).results(context);

		assertThat(results).extracting(AnalysisResult::symbol).containsExactly("AAPL", "MSFT");
		assertThat(results).extracting(AnalysisResult::recommendation)
				.containsExactly(Recommendation.BUY, Recommendation.RETAIN);
	}

	@Test
	void portfolioRunRetriesUntilEveryHoldingIsCovered() {
		Holding msft = holding("MSFT", "Technology", "800");
		String partial = "{\"analyses\":[" + portfolioEntryJson("AAPL", "BUY", 0.9) + "]}";
		String complete = "{\"analyses\":[" + portfolioEntryJson("AAPL", "BUY", 0.9) + ","
				+ portfolioEntryJson("MSFT", "SELL", 0.7) + "]}";
		ScriptedLlmInvoker invoker = new ScriptedLlmInvoker(partial, complete);
		AnalysisContext context = AnalysisContext.portfolio(List.of(aapl, msft), Map.of());

		RetryOutcome outcome = controller(invoker, 3).run(context);

		assertThat(outcome.attempts()).isEqualTo(2);
		assertThat(invoker.prompts().get(1)).contains("- analyses.MSFT: missing");
	}

	private RetryController controller(ScriptedLlmInvoker invoker, int maxRetries) {
		AnalysisSettings settings = settings(maxRetries, 2, Duration.ZERO);
		return new RetryController(invoker, new PromptBuilder(settings), new ResponseExtractor(new ObjectMapper()),
				new SchemaValidator(), settings);
	}
}
