package io.github.tokenrate.internal;

/**
 * A held lock that is released by {@link #close()}, without throwing checked exceptions.
 */
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock.
	 */
	@Override
	void close();
}
