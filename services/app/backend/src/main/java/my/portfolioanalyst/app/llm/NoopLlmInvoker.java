package my.portfolioanalyst.app.llm;

public class NoopLlmInvoker implements LlmInvoker {
	@Override
	public String invoke(String prompt, double temperature) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}

	@Override
	public String name() {
		return "noop";
	}
}
