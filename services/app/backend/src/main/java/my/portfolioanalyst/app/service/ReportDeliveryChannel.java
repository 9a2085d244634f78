package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisReport;

/**
 * Outbound seam for finished reports (chat, mail, ...). Implementations signal delivery problems with
 * unchecked exceptions; callers log them and keep the report.
 */
public interface ReportDeliveryChannel {
	void deliver(AnalysisReport report, String renderedText);

	default String name() {
		return getClass().getSimpleName();
	}
}
