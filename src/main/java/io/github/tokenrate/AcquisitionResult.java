package io.github.tokenrate;

import io.github.tokenrate.internal.ToStringBuilder;

import java.time.Duration;
import java.util.Objects;

import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * The result of an attempt to acquire tokens.
 * <p>
 * Being rate-limited is not an error. Successful and unsuccessful results carry the same diagnostics.
 */
public final class AcquisitionResult
{
	private final TokenBucket bucket;
	private final boolean successful;
	private final double observedRate;
	private final double tokensRequested;
	private final double tokensLeft;
	private final Duration timeSinceLastAcquisition;

	/**
	 * Creates the result of a request to acquire tokens.
	 *
	 * @param bucket                   the bucket that the tokens were requested from
	 * @param successful               true if the tokens were acquired
	 * @param observedRate             the number of acquisitions per second implied by
	 *                                 {@code timeSinceLastAcquisition}
	 * @param tokensRequested          the number of tokens that were requested
	 * @param tokensLeft               the number of tokens left in the bucket
	 * @param timeSinceLastAcquisition the amount of time that elapsed since the previous acquisition attempt
	 * @throws NullPointerException     if {@code bucket} or {@code timeSinceLastAcquisition} are null
	 * @throws IllegalArgumentException if {@code observedRate} is not positive. If {@code tokensRequested},
	 *                                  {@code tokensLeft} or {@code timeSinceLastAcquisition} are negative.
	 */
	AcquisitionResult(TokenBucket bucket, boolean successful, double observedRate, double tokensRequested,
	                  double tokensLeft, Duration timeSinceLastAcquisition)
	{
		if (assertionsAreEnabled())
		{
			requireThat(bucket, "bucket").isNotNull();
			requireThat(observedRate, "observedRate").isPositive();
			requireThat(tokensRequested, "tokensRequested").isNotNegative();
			requireThat(tokensLeft, "tokensLeft").isNotNegative();
			requireThat(timeSinceLastAcquisition, "timeSinceLastAcquisition").
				isGreaterThanOrEqualTo(Duration.ZERO);
		}
		this.bucket = bucket;
		this.successful = successful;
		this.observedRate = observedRate;
		this.tokensRequested = tokensRequested;
		this.tokensLeft = tokensLeft;
		this.timeSinceLastAcquisition = timeSinceLastAcquisition;
	}

	/**
	 * Returns the bucket that the tokens were requested from.
	 *
	 * @return the bucket that the tokens were requested from
	 */
	public TokenBucket getBucket()
	{
		return bucket;
	}

	/**
	 * Returns true if the tokens were acquired.
	 *
	 * @return true if the tokens were acquired
	 */
	public boolean isSuccessful()
	{
		return successful;
	}

	/**
	 * Returns the number of acquisition attempts per second implied by the time since the previous attempt.
	 * This reflects how closely calls are spaced, not the configured {@link TokenBucket#getRate() rate}.
	 *
	 * @return {@code Double.POSITIVE_INFINITY} if no time elapsed since the previous attempt
	 */
	public double getObservedRate()
	{
		return observedRate;
	}

	/**
	 * Returns the number of tokens that were requested.
	 *
	 * @return the number of tokens that were requested
	 */
	public double getTokensRequested()
	{
		return tokensRequested;
	}

	/**
	 * Returns the number of tokens left in the bucket after the attempt.
	 *
	 * @return the number of tokens left in the bucket after the attempt
	 */
	public double getTokensLeft()
	{
		return tokensLeft;
	}

	/**
	 * Returns the amount of time that the bucket was refilled for.
	 *
	 * @return zero if the time source moved backwards
	 */
	public Duration getTimeSinceLastAcquisition()
	{
		return timeSinceLastAcquisition;
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof AcquisitionResult other))
			return false;
		return other.bucket == bucket && other.successful == successful &&
			Double.compare(other.observedRate, observedRate) == 0 &&
			Double.compare(other.tokensRequested, tokensRequested) == 0 &&
			Double.compare(other.tokensLeft, tokensLeft) == 0 &&
			other.timeSinceLastAcquisition.equals(timeSinceLastAcquisition);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(bucket, successful, observedRate, tokensRequested, tokensLeft,
			timeSinceLastAcquisition);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(AcquisitionResult.class).
			add("successful", successful).
			add("observedRate", observedRate).
			add("tokensRequested", tokensRequested).
			add("tokensLeft", tokensLeft).
			add("timeSinceLastAcquisition", timeSinceLastAcquisition).
			add("rate", bucket.getRate()).
			add("capacity", bucket.getCapacity()).
			toString();
	}
}
