package org.springaicommunity.content.checker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared by every task of a run.
 *
 * <p>
 * Waits performed through {@link #await(Duration)} park only the calling task and end
 * early once {@link #cancel()} is called, so backoff and pacing delays unwind promptly.
 */
public final class CancellationSignal {

	private final CountDownLatch cancelled = new CountDownLatch(1);

	/**
	 * Creates a signal that has not fired yet.
	 * @return new signal
	 */
	public static CancellationSignal create() {
		return new CancellationSignal();
	}

	public void cancel() {
		cancelled.countDown();
	}

	public boolean isCancelled() {
		return cancelled.getCount() == 0;
	}

	/**
	 * Throws {@link CheckCancelledException} if the signal has fired.
	 * @param operation what was about to happen, for the exception message
	 */
	public void throwIfCancelled(String operation) {
		if (isCancelled()) {
			throw new CheckCancelledException("Cancelled before " + operation);
		}
	}

	/**
	 * Waits for the given duration unless the signal fires first.
	 * @param duration how long to wait
	 * @throws CheckCancelledException if the signal fired before or during the wait, or
	 * the waiting thread was interrupted
	 */
	public void await(Duration duration) {
		throwIfCancelled("waiting " + duration.toMillis() + "ms");
		if (duration.isZero() || duration.isNegative()) {
			return;
		}
		try {
			if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
				throw new CheckCancelledException("Cancelled while waiting " + duration.toMillis() + "ms");
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CheckCancelledException("Interrupted while waiting " + duration.toMillis() + "ms");
		}
	}

}
