package my.portfolioanalyst.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.portfolioanalyst.app.model.AnalysisReport;

/**
 * Job snapshot. {@code completed_holdings} counts holdings whose run has ended, failed ones included.
 */
public record AnalysisJobResponseDto(
		@JsonProperty("job_id") String jobId,
		@JsonProperty("status") AnalysisJobStatus status,
		@JsonProperty("total_holdings") int totalHoldings,
		@JsonProperty("completed_holdings") int completedHoldings,
		@JsonProperty("failed_holdings") int failedHoldings,
		@JsonProperty("result") AnalysisReport result,
		@JsonProperty("error") String error
) {
}
