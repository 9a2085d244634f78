package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.dto.AnalysisJobResponseDto;
import my.portfolioanalyst.app.dto.AnalysisJobStatus;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.DispatchMode;
import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.model.Recommendation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static my.portfolioanalyst.app.support.AnalysisTestData.accepted;
import static my.portfolioanalyst.app.support.AnalysisTestData.holding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisJobServiceTest {
	private final PortfolioAnalysisService analysisService = mock(PortfolioAnalysisService.class);
	private final Aggregator aggregator = new Aggregator(AnalysisSettings.defaults());
	private final Holding aapl = holding("AAPL", "Technology", "100");
	private final Holding msft = holding("MSFT", "Technology", "200");
	private AnalysisJobService jobService = new AnalysisJobService(analysisService, AnalysisSettings.defaults());

	@AfterEach
	void tearDown() {
		jobService.shutdown();
	}

	@Test
	void runsJobToCompletionAndCountsFinishedHoldings() throws InterruptedException {
		AnalysisResult apple = accepted(aapl, Recommendation.BUY, 0.8);
		AnalysisResult microsoft = AnalysisResult.timedOut(msft, 1);
		AnalysisReport report = aggregator.combine(List.of(apple, microsoft));
		when(analysisService.analyze(any(), any())).thenAnswer(invocation -> {
			AnalysisProgressListener listener = invocation.getArgument(1);
			listener.dispatchStarted(2);
			listener.holdingFinished(apple);
			listener.holdingFinished(microsoft);
			listener.holdingFinished(microsoft);
			return report;
		});

		AnalysisJobResponseDto started = jobService.start(request(aapl, msft));
		AnalysisJobResponseDto finished = awaitTerminal(started.jobId());

		assertThat(started.jobId()).isNotBlank();
		assertThat(started.totalHoldings()).isEqualTo(2);
		assertThat(finished.status()).isEqualTo(AnalysisJobStatus.DONE);
		assertThat(finished.completedHoldings()).isEqualTo(2);
		assertThat(finished.failedHoldings()).isEqualTo(1);
		assertThat(finished.result()).isSameAs(report);
		assertThat(finished.error()).isNull();
	}

	@Test
	void totalFollowsHoldingsActuallyDispatched() throws InterruptedException {
		when(analysisService.analyze(any(), any())).thenAnswer(invocation -> {
			AnalysisProgressListener listener = invocation.getArgument(1);
			listener.dispatchStarted(1);
			return aggregator.combine(List.of(accepted(aapl, Recommendation.RETAIN, 0.6)));
		});

		AnalysisJobResponseDto finished = awaitTerminal(jobService.start(request(aapl, msft)).jobId());

		assertThat(finished.totalHoldings()).isEqualTo(1);
	}

	@Test
	void failedJobCarriesErrorReference() throws InterruptedException {
		when(analysisService.analyze(any(), any())).thenThrow(new IllegalStateException("boom"));

		AnalysisJobResponseDto started = jobService.start(request(aapl));
		AnalysisJobResponseDto finished = awaitTerminal(started.jobId());

		assertThat(finished.status()).isEqualTo(AnalysisJobStatus.FAILED);
		assertThat(finished.error()).startsWith("Error ref AN-");
		assertThat(finished.result()).isNull();
	}

	@Test
	void cancellingInterruptsRunningAnalysisAndKeepsPartialReport() throws InterruptedException {
		CountDownLatch firstDone = new CountDownLatch(1);
		CountDownLatch interrupted = new CountDownLatch(1);
		AnalysisResult apple = accepted(aapl, Recommendation.BUY, 0.8);
		AnalysisReport partial = aggregator.combine(List.of(apple, AnalysisResult.timedOut(msft, 0)));
		when(analysisService.analyze(any(), any())).thenAnswer(invocation -> {
			AnalysisProgressListener listener = invocation.getArgument(1);
			listener.holdingFinished(apple);
			firstDone.countDown();
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException ex) {
				interrupted.countDown();
			}
			return partial;
		});
		AnalysisJobResponseDto started = jobService.start(request(aapl, msft));
		assertThat(firstDone.await(5, TimeUnit.SECONDS)).isTrue();

		AnalysisJobResponseDto cancelled = jobService.cancel(started.jobId());

		assertThat(cancelled.status()).isEqualTo(AnalysisJobStatus.CANCELLED);
		assertThat(cancelled.completedHoldings()).isEqualTo(1);
		assertThat(cancelled.totalHoldings()).isEqualTo(2);
		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
		AnalysisJobResponseDto settled = awaitResult(started.jobId());
		assertThat(settled.status()).isEqualTo(AnalysisJobStatus.CANCELLED);
		assertThat(settled.result()).isSameAs(partial);
	}

	@Test
	void cancellingFinishedJobLeavesItUnchanged() throws InterruptedException {
		when(analysisService.analyze(any(), any()))
				.thenReturn(aggregator.combine(List.of(accepted(aapl, Recommendation.BUY, 0.8))));
		String jobId = jobService.start(request(aapl)).jobId();
		awaitTerminal(jobId);

		assertThat(jobService.cancel(jobId).status()).isEqualTo(AnalysisJobStatus.DONE);
	}

	@Test
	void expiredUnfinishedJobIsCancelledAndEvicted() throws InterruptedException {
		jobService.shutdown();
		jobService = new AnalysisJobService(analysisService,
				AnalysisSettings.defaults().withJobTtl(Duration.ofMillis(100)));
		CountDownLatch running = new CountDownLatch(1);
		CountDownLatch interrupted = new CountDownLatch(1);
		when(analysisService.analyze(any(), any())).thenAnswer(invocation -> {
			running.countDown();
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException ex) {
				interrupted.countDown();
			}
			return null;
		});
		String jobId = jobService.start(request(aapl)).jobId();
		assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
		Thread.sleep(200);

		assertThatThrownBy(() -> jobService.get(jobId)).isInstanceOf(ResponseStatusException.class);
		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void unknownJobIsNotFound() {
		assertThatThrownBy(() -> jobService.get("missing"))
				.isInstanceOfSatisfying(ResponseStatusException.class,
						ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
		assertThatThrownBy(() -> jobService.cancel("missing"))
				.isInstanceOf(ResponseStatusException.class);
	}

	@Test
	void rejectsEmptyRequest() {
		assertThatThrownBy(() -> jobService.start(AnalysisRequest.of(List.of(), DispatchMode.PER_ENTITY)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static AnalysisRequest request(Holding... holdings) {
		return AnalysisRequest.of(List.of(holdings), DispatchMode.PER_ENTITY);
	}

	private AnalysisJobResponseDto awaitTerminal(String jobId) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 5_000;
		AnalysisJobResponseDto current = jobService.get(jobId);
		while (!current.status().isTerminal() && System.currentTimeMillis() < deadline) {
			Thread.sleep(20);
			current = jobService.get(jobId);
		}
		return current;
	}

	private AnalysisJobResponseDto awaitResult(String jobId) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 5_000;
		AnalysisJobResponseDto current = jobService.get(jobId);
		while (current.result() == null && System.currentTimeMillis() < deadline) {
			Thread.sleep(20);
			current = jobService.get(jobId);
		}
		return current;
	}
}
