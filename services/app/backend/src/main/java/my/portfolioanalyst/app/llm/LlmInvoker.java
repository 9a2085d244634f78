package my.portfolioanalyst.app.llm;

/**
 * Capability to send one prompt to a language model and return its raw text answer.
 * <p>
 * Implementations report transport failures and timeouts as {@link LlmRequestException}; the analysis
 * pipeline does not retry those. Any retry or backoff policy for transport errors belongs here.
 */
public interface LlmInvoker {
	String invoke(String prompt, double temperature);

	default String name() {
		return getClass().getSimpleName();
	}
}
