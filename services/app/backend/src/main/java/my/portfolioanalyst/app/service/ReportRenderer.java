package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of a report, short enough for a chat message.
 */
@Component
public class ReportRenderer {
	public String render(AnalysisReport report) {
		StringBuilder text = new StringBuilder();
		text.append("Portfolio analysis (").append(report.mode()).append(")");
		if (report.generatedAt() != null) {
			text.append(" - ").append(report.generatedAt());
		}
		text.append('\n');
		text.append("Accepted: ").append(report.acceptedCount())
				.append(", failed: ").append(report.failedCount()).append('\n');
		text.append("Overall confidence: ").append(decimal(report.overallConfidence())).append('\n');
		text.append("Needs follow-up: ").append(report.needsFollowUp() ? "yes" : "no").append('\n');
		if (!report.followUpQuestion().isBlank()) {
			text.append("Follow-up: ").append(report.followUpQuestion()).append('\n');
		}
		if (!report.sectorSummary().isEmpty()) {
			text.append("\nSectors:\n");
			for (Map.Entry<String, BigDecimal> entry : report.sectorSummary().entrySet()) {
				text.append("- ").append(entry.getKey()).append(": ")
						.append(entry.getValue().setScale(2, RoundingMode.HALF_UP).toPlainString()).append('\n');
			}
		}
		text.append("\nHoldings:\n");
		for (AnalysisResult result : report.resultList()) {
			text.append("- ").append(result.key()).append(": ");
			if (result.isAccepted()) {
				text.append(result.recommendation())
						.append(" (confidence ").append(decimal(result.confidence() == null ? 0.0 : result.confidence()));
				if (result.estimatedReturn() != null) {
					text.append(", est. return ").append(result.estimatedReturn().stripTrailingZeros().toPlainString())
							.append('%');
				}
				text.append(')');
			} else {
				text.append("FAILED ").append(result.errorCode());
				if (result.missingFields() != null && !result.missingFields().isEmpty()) {
					text.append(" (missing: ").append(String.join(", ", result.missingFields())).append(')');
				}
			}
			text.append('\n');
		}
		return text.toString();
	}

	private String decimal(double value) {
		return String.format(Locale.ROOT, "%.2f", value);
	}
}
