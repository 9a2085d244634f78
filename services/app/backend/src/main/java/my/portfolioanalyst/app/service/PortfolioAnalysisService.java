package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.Holding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class PortfolioAnalysisService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAnalysisService.class);

	private final EntityDispatcher entityDispatcher;
	private final Aggregator aggregator;
	private final FollowUpService followUpService;
	private final PriceMovementFilter priceMovementFilter;
	private final ReportRenderer reportRenderer;
	private final ReportDeliveryChannel deliveryChannel;
	private final AnalysisSettings settings;

	public PortfolioAnalysisService(EntityDispatcher entityDispatcher,
									Aggregator aggregator,
									FollowUpService followUpService,
									PriceMovementFilter priceMovementFilter,
									ReportRenderer reportRenderer,
									ReportDeliveryChannel deliveryChannel,
									AnalysisSettings settings) {
		this.entityDispatcher = entityDispatcher;
		this.aggregator = aggregator;
		this.followUpService = followUpService;
		this.priceMovementFilter = priceMovementFilter;
		this.reportRenderer = reportRenderer;
		this.deliveryChannel = deliveryChannel;
		this.settings = settings;
	}

	public AnalysisReport analyze(AnalysisRequest request) {
		return analyze(request, AnalysisProgressListener.NONE);
	}

	/**
	 * Dispatches the holdings, aggregates the results and, when requested, resolves follow-up
	 * questions and hands the report to the delivery channel. Follow-ups share the run's deadline.
	 *
	 * @param listener notified once per dispatched holding as its run ends
	 * @throws IllegalArgumentException for an empty holding list, duplicate keys or too many holdings
	 */
	public AnalysisReport analyze(AnalysisRequest request, AnalysisProgressListener listener) {
		if (request == null || request.holdings().isEmpty()) {
			throw new IllegalArgumentException("At least one holding is required");
		}
		long started = System.nanoTime();
		List<Holding> holdings = request.holdings();
		if (request.filtersByPriceMovement()) {
			holdings = priceMovementFilter.filter(holdings, request.previousHoldings(), request.minVariationPercent());
			if (holdings.isEmpty()) {
				logger.info("No holding moved enough against the previous snapshot; nothing to analyze");
				return aggregator.combine(request.mode(), List.of());
			}
		}
		logger.info("Starting {} analysis of {} holding(s)", request.mode(), holdings.size());

		Duration deadline = request.deadline() == null ? settings.deadline() : request.deadline();
		List<AnalysisResult> results = entityDispatcher.runAll(holdings, request.mode(), request.facts(), deadline,
				listener);
		AnalysisReport report = aggregator.combine(request.mode(), results);

		boolean followUp = request.followUp() == null ? settings.followUpEnabled() : request.followUp();
		if (followUp && report.resultList().stream().anyMatch(r -> r.isAccepted() && r.hasFollowUpQuestion())) {
			report = resolveFollowUps(report, request, deadline, started);
		}
		if (Boolean.TRUE.equals(request.deliver())) {
			deliver(report);
		}
		logger.info("Analysis finished in {} ms ({} accepted, {} failed, overall confidence {})",
				Duration.ofNanos(System.nanoTime() - started).toMillis(), report.acceptedCount(), report.failedCount(),
				String.format("%.2f", report.overallConfidence()));
		return report;
	}

	private AnalysisReport resolveFollowUps(AnalysisReport report, AnalysisRequest request, Duration deadline,
											long started) {
		if (deadline.isZero() || deadline.isNegative()) {
			return followUpService.resolve(report, request.facts(), Duration.ZERO);
		}
		Duration remaining = deadline.minus(Duration.ofNanos(System.nanoTime() - started));
		if (remaining.isZero() || remaining.isNegative()) {
			logger.warn("Deadline of {} reached before follow-up questions could be asked", deadline);
			return report;
		}
		return followUpService.resolve(report, request.facts(), remaining);
	}

	private void deliver(AnalysisReport report) {
		try {
			deliveryChannel.deliver(report, reportRenderer.render(report));
		} catch (RuntimeException ex) {
			logger.warn("Report delivery via {} failed: {}", deliveryChannel.name(), ex.getMessage(), ex);
		}
	}
}
