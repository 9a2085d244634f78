package my.portfolioanalyst.app.service;

import jakarta.annotation.PreDestroy;
import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisResult;
import my.portfolioanalyst.app.model.DispatchMode;
import my.portfolioanalyst.app.model.Holding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs the retry loop for a set of holdings, either once for the whole portfolio or once per holding
 * on a fixed worker pool. Every submitted holding yields exactly one result, in input order, even
 * when its run failed, was cancelled or missed the deadline.
 */
@Service
public class EntityDispatcher {
	private static final Logger logger = LoggerFactory.getLogger(EntityDispatcher.class);

	private final RetryController retryController;
	private final AnalysisSettings settings;
	private final ExecutorService executor;

	public EntityDispatcher(RetryController retryController, AnalysisSettings settings) {
		this.retryController = retryController;
		this.settings = settings;
		AtomicInteger counter = new AtomicInteger();
		this.executor = Executors.newFixedThreadPool(settings.workerPoolSize(), runnable -> {
			Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	public List<AnalysisResult> runAll(List<Holding> holdings, DispatchMode mode) {
		return runAll(holdings, mode, Map.of(), null);
	}

	public List<AnalysisResult> runAll(List<Holding> holdings,
									   DispatchMode mode,
									   Map<String, String> facts,
									   Duration deadline) {
		return runAll(holdings, mode, facts, deadline, AnalysisProgressListener.NONE);
	}

	/**
	 * @param deadline overall time budget; {@code null} uses the configured default, zero waits for all runs
	 * @param listener notified once per holding as its run ends
	 */
	public List<AnalysisResult> runAll(List<Holding> holdings,
									   DispatchMode mode,
									   Map<String, String> facts,
									   Duration deadline,
									   AnalysisProgressListener listener) {
		List<Holding> entities = holdings == null ? List.of() : new ArrayList<>(holdings);
		validate(entities);
		if (entities.isEmpty()) {
			return List.of();
		}
		DispatchMode effectiveMode = mode == null ? DispatchMode.PER_ENTITY : mode;
		Duration budget = deadline == null ? settings.deadline() : deadline;
		long deadlineNanos = budget.isZero() || budget.isNegative() ? 0L : System.nanoTime() + budget.toNanos();
		logger.info("Dispatching {} holding(s) in {} mode (workers={}, deadline={})",
				entities.size(), effectiveMode, settings.workerPoolSize(), deadlineNanos == 0L ? "none" : budget);

		AnalysisProgressListener progress = listener == null ? AnalysisProgressListener.NONE : listener;
		progress.dispatchStarted(entities.size());
		List<AnalysisResult> results = effectiveMode == DispatchMode.WHOLE_PORTFOLIO
				? runPortfolio(entities, facts, deadlineNanos, progress)
				: runPerEntity(entities, facts, deadlineNanos, progress);

		long failed = results.stream().filter(AnalysisResult::isFailure).count();
		logger.info("Dispatch finished: {} accepted, {} failed", results.size() - failed, failed);
		return results;
	}

	/**
	 * Runs {@code revision} for every given result on the worker pool within {@code budget} (zero waits for
	 * all). The returned list is index-aligned with {@code originals}; a slot is {@code null} when its
	 * revision returned nothing, failed or missed the budget.
	 */
	public List<AnalysisResult> runRevisions(List<AnalysisResult> originals,
											 Function<AnalysisResult, AnalysisResult> revision,
											 Duration budget) {
		if (originals == null || originals.isEmpty()) {
			return List.of();
		}
		long deadlineNanos = budget == null || budget.isZero() || budget.isNegative()
				? 0L
				: System.nanoTime() + budget.toNanos();
		List<Future<AnalysisResult>> futures = new ArrayList<>(originals.size());
		for (AnalysisResult original : originals) {
			futures.add(executor.submit(() -> revision.apply(original)));
		}
		List<AnalysisResult> revised = new ArrayList<>(originals.size());
		boolean interrupted = false;
		for (int i = 0; i < originals.size(); i++) {
			Future<AnalysisResult> future = futures.get(i);
			String key = originals.get(i).key();
			if (interrupted) {
				future.cancel(true);
				revised.add(null);
				continue;
			}
			try {
				revised.add(await(future, deadlineNanos));
			} catch (TimeoutException | CancellationException ex) {
				future.cancel(true);
				logger.warn("Revision of {} missed the deadline", key);
				revised.add(null);
			} catch (ExecutionException ex) {
				logger.error("Revision of {} failed: {}", key, causeMessage(ex), ex.getCause());
				revised.add(null);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				interrupted = true;
				future.cancel(true);
				revised.add(null);
			}
		}
		return revised;
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private List<AnalysisResult> runPortfolio(List<Holding> holdings,
											  Map<String, String> facts,
											  long deadlineNanos,
											  AnalysisProgressListener progress) {
		AnalysisContext context = AnalysisContext.portfolio(holdings, facts);
		Future<List<AnalysisResult>> future = executor.submit(() -> retryController.run(context).results(context));
		List<AnalysisResult> results;
		try {
			results = await(future, deadlineNanos);
		} catch (TimeoutException | CancellationException ex) {
			future.cancel(true);
			logger.warn("Portfolio analysis missed the deadline; marking {} holding(s) as timed out", holdings.size());
			results = holdings.stream().map(holding -> AnalysisResult.timedOut(holding, 0)).toList();
		} catch (ExecutionException ex) {
			String message = causeMessage(ex);
			logger.error("Portfolio analysis failed: {}", message, ex.getCause());
			results = holdings.stream().map(holding -> AnalysisResult.invocationFailed(holding, 0, message)).toList();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			results = holdings.stream().map(holding -> AnalysisResult.timedOut(holding, 0)).toList();
		}
		results.forEach(progress::holdingFinished);
		return results;
	}

	private List<AnalysisResult> runPerEntity(List<Holding> holdings,
											  Map<String, String> facts,
											  long deadlineNanos,
											  AnalysisProgressListener progress) {
		AnalysisResult[] slots = new AnalysisResult[holdings.size()];
		List<Future<List<AnalysisResult>>> futures = new ArrayList<>(holdings.size());
		for (Holding holding : holdings) {
			AnalysisContext context = AnalysisContext.holding(holding, facts);
			futures.add(executor.submit(() -> {
				List<AnalysisResult> results = retryController.run(context).results(context);
				results.forEach(progress::holdingFinished);
				return results;
			}));
		}
		boolean interrupted = false;
		for (int i = 0; i < holdings.size(); i++) {
			Holding holding = holdings.get(i);
			Future<List<AnalysisResult>> future = futures.get(i);
			if (interrupted) {
				future.cancel(true);
				slots[i] = AnalysisResult.timedOut(holding, 0);
				progress.holdingFinished(slots[i]);
				continue;
			}
			try {
				slots[i] = await(future, deadlineNanos).get(0);
			} catch (TimeoutException | CancellationException ex) {
				future.cancel(true);
				logger.warn("Analysis of {} missed the deadline", holding.key());
				slots[i] = AnalysisResult.timedOut(holding, 0);
				progress.holdingFinished(slots[i]);
			} catch (ExecutionException ex) {
				String message = causeMessage(ex);
				logger.error("Analysis of {} failed: {}", holding.key(), message, ex.getCause());
				slots[i] = AnalysisResult.invocationFailed(holding, 0, message);
				progress.holdingFinished(slots[i]);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				interrupted = true;
				future.cancel(true);
				slots[i] = AnalysisResult.timedOut(holding, 0);
				progress.holdingFinished(slots[i]);
			}
		}
		return List.of(slots);
	}

	private <T> T await(Future<T> future, long deadlineNanos)
			throws InterruptedException, ExecutionException, TimeoutException {
		if (deadlineNanos == 0L) {
			return future.get();
		}
		long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
		return future.get(remaining, TimeUnit.NANOSECONDS);
	}

	private void validate(List<Holding> holdings) {
		if (holdings.size() > settings.maxHoldings()) {
			throw new IllegalArgumentException("Too many holdings: " + holdings.size()
					+ " (max " + settings.maxHoldings() + ")");
		}
		Set<String> keys = new HashSet<>();
		for (Holding holding : holdings) {
			if (holding == null) {
				throw new IllegalArgumentException("Holding must not be null");
			}
			if (!keys.add(holding.key())) {
				throw new IllegalArgumentException("Duplicate holding key: " + holding.key());
			}
		}
	}

	private String causeMessage(ExecutionException ex) {
		Throwable cause = ex.getCause() == null ? ex : ex.getCause();
		String message = cause.getMessage();
		return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
	}
}
