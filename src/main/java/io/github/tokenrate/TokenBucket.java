package io.github.tokenrate;

import com.google.common.base.Ticker;
import com.google.errorprone.annotations.CheckReturnValue;
import io.github.tokenrate.internal.CloseableLock;
import io.github.tokenrate.internal.ReadWriteLockAsResource;
import io.github.tokenrate.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A bucket that refills continuously at a fixed rate, up to a maximum capacity.
 * <p>
 * Tokens are replenished in proportion to the time that elapsed since the previous acquisition. The bucket
 * starts out full.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class TokenBucket
{
	private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

	private final double rate;
	private final double capacity;
	private final Ticker ticker;
	/**
	 * A lock over this object's state. See the {@link io.github.tokenrate.internal locking policy} for more
	 * details.
	 */
	private final ReadWriteLockAsResource lock = new ReadWriteLockAsResource();
	private double tokens;
	private long lastUpdate;
	private final Logger log = LoggerFactory.getLogger(TokenBucket.class);

	/**
	 * Builds a new bucket.
	 *
	 * @return a TokenBucket builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new bucket that measures time using {@link Ticker#systemTicker()}.
	 *
	 * @param rate     the number of tokens to add to the bucket every second
	 * @param capacity the maximum number of tokens that the bucket may hold (the burst size)
	 * @throws IllegalArgumentException if {@code rate} or {@code capacity} are negative, zero, infinite or NaN
	 */
	public TokenBucket(double rate, double capacity)
	{
		this(rate, capacity, Ticker.systemTicker());
	}

	/**
	 * Creates a new bucket.
	 *
	 * @param rate     the number of tokens to add to the bucket every second
	 * @param capacity the maximum number of tokens that the bucket may hold (the burst size)
	 * @param ticker   the source of time
	 * @throws NullPointerException     if {@code ticker} is null
	 * @throws IllegalArgumentException if {@code rate} or {@code capacity} are negative, zero, infinite or NaN
	 */
	private TokenBucket(double rate, double capacity, Ticker ticker)
	{
		requireThat(rate, "rate").isFinite().isPositive();
		requireThat(capacity, "capacity").isFinite().isPositive();
		requireThat(ticker, "ticker").isNotNull();
		this.rate = rate;
		this.capacity = capacity;
		this.ticker = ticker;
		this.tokens = capacity;
		this.lastUpdate = ticker.read();
	}

	/**
	 * Returns the number of tokens that are added to the bucket every second.
	 *
	 * @return the number of tokens that are added to the bucket every second
	 */
	public double getRate()
	{
		return rate;
	}

	/**
	 * Returns the maximum number of tokens that the bucket may hold.
	 *
	 * @return the maximum number of tokens that the bucket may hold
	 */
	public double getCapacity()
	{
		return capacity;
	}

	/**
	 * Acquires a single token, only if it is available at the time of invocation.
	 *
	 * @return the result of the operation
	 */
	@CheckReturnValue
	public AcquisitionResult acquire()
	{
		return acquire(1);
	}

	/**
	 * Acquires {@code count} tokens, only if they are available at the time of invocation. Acquisition order
	 * is not guaranteed to be fair.
	 * <p>
	 * Every invocation refills the bucket in proportion to the time that elapsed since the previous
	 * invocation, whether or not the tokens end up being acquired. A request for more than
	 * {@link #getCapacity() capacity} tokens never succeeds.
	 *
	 * @param count the number of tokens to acquire
	 * @return the result of the operation
	 * @throws IllegalArgumentException if {@code count} is negative or NaN
	 */
	@CheckReturnValue
	public AcquisitionResult acquire(double count)
	{
		requireThat(count, "count").isNumber().isNotNegative();

		AcquisitionResult result;
		try (CloseableLock ignored = lock.writeLock())
		{
			long now = ticker.read();
			long elapsedNanos = getElapsedNanos(now);
			refill(elapsedNanos);
			boolean successful = tokens >= count;
			if (successful)
				tokens -= count;
			lastUpdate = now;
			assertThat(r -> r.requireThat(tokens, "tokens").isNotNegative().
				isLessThanOrEqualTo(capacity, "capacity"));

			result = new AcquisitionResult(this, successful, getObservedRate(elapsedNanos), count, tokens,
				Duration.ofNanos(elapsedNanos));
		}
		log.debug("result: {}", result);
		return result;
	}

	/**
	 * Returns the time that elapsed since the last update. If the ticker moved backwards, no time is
	 * considered to have elapsed.
	 *
	 * @param now the current time, in nanoseconds
	 * @return the number of nanoseconds since the last update
	 */
	private long getElapsedNanos(long now)
	{
		assert (lock.isWriteLockedByCurrentThread());
		long elapsedNanos = now - lastUpdate;
		if (elapsedNanos < 0)
		{
			log.warn("Ticker moved backwards by {}. Assuming that no time has elapsed.",
				Duration.ofNanos(-elapsedNanos));
			return 0;
		}
		return elapsedNanos;
	}

	/**
	 * Adds tokens in proportion to the elapsed time, discarding any tokens in excess of the capacity.
	 *
	 * @param elapsedNanos the number of nanoseconds since the last update
	 */
	private void refill(long elapsedNanos)
	{
		assert (lock.isWriteLockedByCurrentThread());
		tokens = Math.min(capacity, tokens + rate * (elapsedNanos / NANOS_PER_SECOND));
	}

	/**
	 * @param elapsedNanos the number of nanoseconds since the last update
	 * @return the number of acquisitions per second implied by {@code elapsedNanos};
	 * {@code Double.POSITIVE_INFINITY} if no time elapsed
	 */
	private static double getObservedRate(long elapsedNanos)
	{
		if (elapsedNanos == 0)
			return Double.POSITIVE_INFINITY;
		return NANOS_PER_SECOND / elapsedNanos;
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return new ToStringBuilder(TokenBucket.class).
				add("rate", rate).
				add("capacity", capacity).
				add("tokens", tokens).
				toString();
		}
	}

	/**
	 * Builds a bucket.
	 */
	public static final class Builder
	{
		private double rate = 1;
		private double capacity = 1;
		private Ticker ticker = Ticker.systemTicker();

		/**
		 * Use {@link TokenBucket#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Returns the number of tokens to add to the bucket every second. By default, this value is
		 * {@code 1}.
		 *
		 * @return the number of tokens to add to the bucket every second
		 */
		public double rate()
		{
			return rate;
		}

		/**
		 * Sets the number of tokens to add to the bucket every second.
		 *
		 * @param rate the number of tokens to add to the bucket every second
		 * @return this
		 * @throws IllegalArgumentException if {@code rate} is negative, zero, infinite or NaN
		 */
		public Builder rate(double rate)
		{
			requireThat(rate, "rate").isFinite().isPositive();
			this.rate = rate;
			return this;
		}

		/**
		 * Returns the maximum number of tokens that the bucket may hold. By default, this value is {@code 1}.
		 *
		 * @return the maximum number of tokens that the bucket may hold
		 */
		public double capacity()
		{
			return capacity;
		}

		/**
		 * Sets the maximum number of tokens that the bucket may hold. The bucket starts out full.
		 *
		 * @param capacity the maximum number of tokens that the bucket may hold (the burst size)
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is negative, zero, infinite or NaN
		 */
		public Builder capacity(double capacity)
		{
			requireThat(capacity, "capacity").isFinite().isPositive();
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the source of time. By default, this value is {@link Ticker#systemTicker()}.
		 *
		 * @return the source of time
		 */
		public Ticker ticker()
		{
			return ticker;
		}

		/**
		 * Sets the source of time.
		 *
		 * @param ticker the source of time
		 * @return this
		 * @throws NullPointerException if {@code ticker} is null
		 */
		public Builder ticker(Ticker ticker)
		{
			requireThat(ticker, "ticker").isNotNull();
			this.ticker = ticker;
			return this;
		}

		/**
		 * Builds a new TokenBucket.
		 *
		 * @return a new TokenBucket
		 */
		public TokenBucket build()
		{
			return new TokenBucket(rate, capacity, ticker);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("rate", rate).
				add("capacity", capacity).
				add("ticker", ticker).
				toString();
		}
	}
}
