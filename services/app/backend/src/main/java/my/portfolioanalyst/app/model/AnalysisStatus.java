package my.portfolioanalyst.app.model;

public enum AnalysisStatus {
	ACCEPTED(null),
	EXHAUSTED("retries_exhausted"),
	LLM_ERROR("llm_invocation_error"),
	TIMED_OUT("timeout");

	private final String errorCode;

	AnalysisStatus(String errorCode) {
		this.errorCode = errorCode;
	}

	public String errorCode() {
		return errorCode;
	}

	public boolean isFailure() {
		return this != ACCEPTED;
	}
}
