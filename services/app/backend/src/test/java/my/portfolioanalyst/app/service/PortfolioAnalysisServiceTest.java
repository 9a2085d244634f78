package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.DispatchMode;
import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.model.Recommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static my.portfolioanalyst.app.support.AnalysisTestData.accepted;
import static my.portfolioanalyst.app.support.AnalysisTestData.holding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioAnalysisServiceTest {
	@Mock
	private EntityDispatcher entityDispatcher;

	@Mock
	private FollowUpService followUpService;

	@Mock
	private ReportDeliveryChannel deliveryChannel;

	private final AnalysisSettings settings = AnalysisSettings.defaults();
	private final Holding aapl = holding("AAPL", "Technology", "100");
	private PortfolioAnalysisService service;

	@BeforeEach
	void setUp() {
		service = new PortfolioAnalysisService(entityDispatcher, new Aggregator(settings), followUpService,
				new PriceMovementFilter(), new ReportRenderer(), deliveryChannel, settings);
	}

	@Test
	void dispatchesAndAggregatesInRequestedMode() {
		Map<String, String> facts = Map.of("NIFTY 50", "+0.4%");
		when(entityDispatcher.runAll(eq(List.of(aapl)), eq(DispatchMode.WHOLE_PORTFOLIO), eq(facts),
				eq(Duration.ofSeconds(30)), any()))
				.thenReturn(List.of(accepted(aapl, Recommendation.BUY, 0.8)));

		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(aapl), DispatchMode.WHOLE_PORTFOLIO,
				facts, null, null, Duration.ofSeconds(30)));

		assertThat(report.mode()).isEqualTo(DispatchMode.WHOLE_PORTFOLIO);
		assertThat(report.acceptedCount()).isEqualTo(1);
		assertThat(report.overallConfidence()).isEqualTo(0.8);
		verify(deliveryChannel, never()).deliver(any(), any());
		verify(followUpService, never()).resolve(any(), anyMap(), any());
	}

	@Test
	void resolvesFollowUpQuestionsWhenRequested() {
		AnalysisResult withQuestion = accepted(aapl, Recommendation.BUY, 0.8, "Any news?");
		when(entityDispatcher.runAll(any(), any(), anyMap(), any(), any())).thenReturn(List.of(withQuestion));
		AnalysisReport resolved = new Aggregator(settings).combine(List.of(accepted(aapl, Recommendation.BUY, 0.9)));
		when(followUpService.resolve(any(), anyMap(), eq(Duration.ZERO))).thenReturn(resolved);

		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(aapl), DispatchMode.PER_ENTITY,
				Map.of(), true, false, null));

		assertThat(report).isSameAs(resolved);
	}

	@Test
	void followUpsGetWhatIsLeftOfTheDeadline() {
		AnalysisResult withQuestion = accepted(aapl, Recommendation.BUY, 0.8, "Any news?");
		when(entityDispatcher.runAll(any(), any(), anyMap(), any(), any())).thenReturn(List.of(withQuestion));
		ArgumentCaptor<Duration> budget = ArgumentCaptor.forClass(Duration.class);
		when(followUpService.resolve(any(), anyMap(), budget.capture()))
				.thenAnswer(invocation -> invocation.getArgument(0));

		service.analyze(new AnalysisRequest(List.of(aapl), DispatchMode.PER_ENTITY, Map.of(), true, false,
				Duration.ofSeconds(30)));

		assertThat(budget.getValue()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(30));
	}

	@Test
	void skipsFollowUpsOnceTheDeadlineHasPassed() {
		AnalysisResult withQuestion = accepted(aapl, Recommendation.BUY, 0.8, "Any news?");
		when(entityDispatcher.runAll(any(), any(), anyMap(), any(), any())).thenAnswer(invocation -> {
			Thread.sleep(50);
			return List.of(withQuestion);
		});

		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(aapl), DispatchMode.PER_ENTITY,
				Map.of(), true, false, Duration.ofMillis(10)));

		assertThat(report.resultList()).extracting(AnalysisResult::followUpQuestion).containsExactly("Any news?");
		verify(followUpService, never()).resolve(any(), anyMap(), any());
	}

	@Test
	void analyzesOnlyHoldingsThatMovedAgainstPreviousSnapshot() {
		Holding apple = priced("AAPL", "110");
		Holding microsoft = priced("MSFT", "201");
		List<Holding> previous = List.of(priced("AAPL", "100"), priced("MSFT", "200"));
		ArgumentCaptor<List<Holding>> dispatched = ArgumentCaptor.forClass(List.class);
		when(entityDispatcher.runAll(dispatched.capture(), any(), anyMap(), any(), any()))
				.thenAnswer(invocation -> List.of(accepted(apple, Recommendation.SELL, 0.7)));

		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(apple, microsoft),
				DispatchMode.PER_ENTITY, Map.of(), false, false, null, previous, new BigDecimal("5")));

		assertThat(dispatched.getValue()).extracting(Holding::symbol).containsExactly("AAPL");
		assertThat(dispatched.getValue().get(0).variationPercent()).isEqualByComparingTo("10");
		assertThat(report.resultList()).extracting(AnalysisResult::symbol).containsExactly("AAPL");
	}

	@Test
	void returnsEmptyReportWhenNothingMoved() {
		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(priced("AAPL", "101")),
				DispatchMode.PER_ENTITY, Map.of(), false, false, null, List.of(priced("AAPL", "100")),
				new BigDecimal("5")));

		assertThat(report.resultList()).isEmpty();
		verify(entityDispatcher, never()).runAll(any(), any(), anyMap(), any(), any());
	}

	@Test
	void deliversRenderedReportAndSurvivesChannelFailure() {
		when(entityDispatcher.runAll(any(), any(), anyMap(), any(), any()))
				.thenReturn(List.of(accepted(aapl, Recommendation.BUY, 0.8)));
		doThrow(new IllegalStateException("gateway down")).when(deliveryChannel).deliver(any(), any());

		AnalysisReport report = service.analyze(new AnalysisRequest(List.of(aapl), DispatchMode.PER_ENTITY,
				Map.of(), false, true, null));

		assertThat(report.acceptedCount()).isEqualTo(1);
		verify(deliveryChannel).deliver(eq(report), contains("AAPL: BUY"));
	}

	@Test
	void rejectsEmptyHoldings() {
		assertThatThrownBy(() -> service.analyze(AnalysisRequest.of(List.of(), DispatchMode.PER_ENTITY)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.analyze(null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static Holding priced(String symbol, String price) {
		return new Holding(symbol, null, null, new BigDecimal(price), null, "Technology");
	}
}
