package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingReportDeliveryChannel implements ReportDeliveryChannel {
	private static final Logger logger = LoggerFactory.getLogger(LoggingReportDeliveryChannel.class);

	@Override
	public void deliver(AnalysisReport report, String renderedText) {
		logger.info("Analysis report ({} accepted, {} failed):\n{}",
				report.acceptedCount(), report.failedCount(), renderedText);
	}

	@Override
	public String name() {
		return "log";
	}
}
