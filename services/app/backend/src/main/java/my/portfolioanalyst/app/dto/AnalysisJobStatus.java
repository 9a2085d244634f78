package my.portfolioanalyst.app.dto;

public enum AnalysisJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED,
	CANCELLED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED || this == CANCELLED;
	}
}
