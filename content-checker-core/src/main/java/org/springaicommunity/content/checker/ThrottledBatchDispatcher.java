package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches one check per file with at most {@code maxConcurrency} checks in flight and
 * a pacing delay after each check before its slot is released.
 *
 * <p>
 * Every file is submitted as its own task. A task first acquires a permit from a fair
 * {@link Semaphore}, runs the {@link CheckInvoker}, waits the pacing delay and releases
 * the permit. Outcomes are returned in input order regardless of completion order.
 *
 * <p>
 * Cancellation stops admission: tasks still waiting for a permit when the signal fires
 * give up and their files are left out of the result. A check already running unwinds at
 * its next wait.
 *
 * <p>
 * Tasks are queued on a pool of {@code maxConcurrency} daemon threads unless an executor
 * is supplied, so the number of threads does not grow with the number of files. A
 * supplied executor should be bounded as well.
 */
public class ThrottledBatchDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ThrottledBatchDispatcher.class);

	static final int DEFAULT_MAX_CONCURRENCY = 2;

	static final Duration DEFAULT_PACING_DELAY = Duration.ofMillis(500);

	private static final long ACQUIRE_POLL_MILLIS = 50;

	private final CheckInvoker checkInvoker;

	private final int maxConcurrency;

	private final Duration pacingDelay;

	private final ExecutorService executor;

	private ThrottledBatchDispatcher(Builder builder) {
		this.checkInvoker = builder.checkInvoker;
		this.maxConcurrency = builder.maxConcurrency;
		this.pacingDelay = builder.pacingDelay;
		this.executor = builder.executor != null ? builder.executor : boundedPool(maxConcurrency);
	}

	/**
	 * Create a new builder for ThrottledBatchDispatcher.
	 * @param checkInvoker invoker used for every file
	 * @return new Builder instance
	 */
	public static Builder builder(CheckInvoker checkInvoker) {
		return new Builder(checkInvoker);
	}

	public int getMaxConcurrency() {
		return maxConcurrency;
	}

	public Duration getPacingDelay() {
		return pacingDelay;
	}

	/**
	 * Check every file and wait until all admitted checks have finished.
	 * @param filePaths files to check
	 * @param batchId batch id sent with every check
	 * @param checkMode check mode sent with every check
	 * @param signal shared cancellation signal
	 * @return one outcome per admitted file, in input order
	 */
	public List<CheckOutcome> dispatchBatch(List<Path> filePaths, String batchId, CheckMode checkMode,
			CancellationSignal signal) {
		if (filePaths.isEmpty()) {
			return List.of();
		}

		logger.info("Dispatching {} files for batch {} (max {} concurrent, {}ms pacing)", filePaths.size(), batchId,
				maxConcurrency, pacingDelay.toMillis());

		Semaphore slots = new Semaphore(maxConcurrency, true);
		@Nullable CheckOutcome[] outcomes = new CheckOutcome[filePaths.size()];
		List<Future<?>> tasks = new ArrayList<>(filePaths.size());

		for (int i = 0; i < filePaths.size(); i++) {
			int index = i;
			Path filePath = filePaths.get(i);
			tasks.add(executor.submit(() -> {
				outcomes[index] = runThrottled(filePath, batchId, checkMode, slots, signal);
			}));
		}

		awaitAll(tasks);

		List<CheckOutcome> result = new ArrayList<>(filePaths.size());
		for (CheckOutcome outcome : outcomes) {
			if (outcome != null) {
				result.add(outcome);
			}
		}
		if (result.size() < filePaths.size()) {
			logger.warn("Batch {} cancelled: {} of {} files were not checked", batchId,
					filePaths.size() - result.size(), filePaths.size());
		}
		return result;
	}

	/**
	 * Runs one check inside a slot. Returns null when the file was never admitted.
	 */
	private @Nullable CheckOutcome runThrottled(Path filePath, String batchId, CheckMode checkMode, Semaphore slots,
			CancellationSignal signal) {
		if (!acquire(slots, signal)) {
			logger.debug("Skipping {}: cancelled before a slot was free", filePath);
			return null;
		}
		try {
			Optional<String> link = invoke(filePath, batchId, checkMode, signal);
			CheckOutcome outcome = CheckOutcome.of(filePath.toString(), link);
			pace(signal);
			return outcome;
		}
		finally {
			slots.release();
		}
	}

	private Optional<String> invoke(Path filePath, String batchId, CheckMode checkMode, CancellationSignal signal) {
		try {
			return checkInvoker.check(filePath, batchId, checkMode, signal);
		}
		catch (CheckCancelledException e) {
			logger.debug("Check of {} cancelled", filePath);
			return Optional.empty();
		}
		catch (RuntimeException e) {
			logger.error("Check of {} failed unexpectedly", filePath, e);
			return Optional.empty();
		}
	}

	private void pace(CancellationSignal signal) {
		try {
			signal.await(pacingDelay);
		}
		catch (CheckCancelledException e) {
			logger.debug("Pacing delay cut short: {}", e.getMessage());
		}
	}

	private boolean acquire(Semaphore slots, CancellationSignal signal) {
		try {
			while (!signal.isCancelled()) {
				if (slots.tryAcquire(ACQUIRE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
					if (signal.isCancelled()) {
						slots.release();
						return false;
					}
					return true;
				}
			}
			return false;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private void awaitAll(List<Future<?>> tasks) {
		for (Future<?> task : tasks) {
			try {
				task.get();
			}
			catch (ExecutionException e) {
				logger.error("Dispatch task failed", e.getCause());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while waiting for dispatched checks");
				return;
			}
		}
	}

	private static ExecutorService boundedPool(int threads) {
		ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 30, TimeUnit.SECONDS,
				new LinkedBlockingQueue<>(), daemonThreads("content-check-"));
		pool.allowCoreThreadTimeOut(true);
		return pool;
	}

	static ThreadFactory daemonThreads(String namePrefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, namePrefix + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	/**
	 * Builder for {@link ThrottledBatchDispatcher}.
	 */
	public static class Builder {

		private final CheckInvoker checkInvoker;

		private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;

		private Duration pacingDelay = DEFAULT_PACING_DELAY;

		@Nullable
		private ExecutorService executor;

		private Builder(CheckInvoker checkInvoker) {
			this.checkInvoker = checkInvoker;
		}

		public Builder maxConcurrency(int maxConcurrency) {
			if (maxConcurrency < 1) {
				throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
			}
			this.maxConcurrency = maxConcurrency;
			return this;
		}

		public Builder pacingDelay(Duration pacingDelay) {
			if (pacingDelay.isNegative()) {
				throw new IllegalArgumentException("pacingDelay must not be negative");
			}
			this.pacingDelay = pacingDelay;
			return this;
		}

		/**
		 * Use the given executor for check tasks instead of a dedicated pool bounded to
		 * {@code maxConcurrency} threads.
		 * @param executor executor service
		 * @return this builder
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		public ThrottledBatchDispatcher build() {
			return new ThrottledBatchDispatcher(this);
		}

	}

}
