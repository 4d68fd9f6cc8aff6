package io.github.tokenrate;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A ticker that only moves when told to. Unlike the system ticker, it may be moved backwards.
 */
final class ManualTicker extends Ticker
{
	private final AtomicLong nanos = new AtomicLong();

	@Override
	public long read()
	{
		return nanos.get();
	}

	/**
	 * Moves the ticker.
	 *
	 * @param duration the amount of time to add (negative to move the ticker backwards)
	 * @return this
	 */
	public ManualTicker advance(Duration duration)
	{
		nanos.addAndGet(duration.toNanos());
		return this;
	}
}
