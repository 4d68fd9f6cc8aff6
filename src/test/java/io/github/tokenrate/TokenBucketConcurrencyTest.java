package io.github.tokenrate;

import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class TokenBucketConcurrencyTest
{
	private static final int THREADS = 8;

	/**
	 * Runs {@code task} on {@link #THREADS} threads that start at the same time.
	 *
	 * @param task the task to run
	 * @return the value returned by each thread
	 */
	private static List<Integer> race(TaskWithResult task) throws Exception
	{
		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		try
		{
			CountDownLatch start = new CountDownLatch(1);
			List<Future<Integer>> futures = new ArrayList<>();
			for (int i = 0; i < THREADS; ++i)
			{
				futures.add(executor.submit(() ->
				{
					start.await();
					return task.run();
				}));
			}
			start.countDown();
			List<Integer> result = new ArrayList<>();
			for (Future<Integer> future : futures)
				result.add(future.get(30, TimeUnit.SECONDS));
			return result;
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void frozenClockGrantsExactlyCapacity() throws Exception
	{
		int capacity = 100;
		ManualTicker ticker = new ManualTicker();
		TokenBucket bucket = TokenBucket.builder().rate(1).capacity(capacity).ticker(ticker).build();

		List<Integer> granted = race(() ->
		{
			int count = 0;
			for (int i = 0; i < 50; ++i)
			{
				if (bucket.acquire(1).isSuccessful())
					++count;
			}
			return count;
		});
		int total = 0;
		for (int count : granted)
			total += count;
		requireThat(total, "total").isEqualTo(capacity);
	}

	@Test
	public void tokensStayWithinBoundsUnderContention() throws Exception
	{
		double capacity = 10;
		TokenBucket bucket = TokenBucket.builder().rate(1000).capacity(capacity).build();

		List<Integer> violations = race(() ->
		{
			int count = 0;
			for (int i = 0; i < 10_000; ++i)
			{
				double tokensLeft = bucket.acquire(1).getTokensLeft();
				if (tokensLeft < 0 || tokensLeft > capacity)
					++count;
			}
			return count;
		});
		for (int count : violations)
			requireThat(count, "violations").isEqualTo(0);
	}

	/**
	 * A task that returns a value.
	 */
	@FunctionalInterface
	private interface TaskWithResult
	{
		/**
		 * @return the result of the task
		 */
		int run();
	}
}
