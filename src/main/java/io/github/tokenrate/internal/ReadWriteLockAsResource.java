package io.github.tokenrate.internal;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Guards a bucket's state, releasing locks through try-with-resources.
 * <p>
 * State transitions run under the write lock. The read lock is only used to render consistent snapshots
 * (e.g. {@code toString()}).
 */
public final class ReadWriteLockAsResource
{
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	 * Acquires a read lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock readLock()
	{
		Lock readLock = lock.readLock();
		readLock.lock();
		return readLock::unlock;
	}

	/**
	 * Acquires the write lock, blocking until no other thread holds it.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock writeLock()
	{
		Lock writeLock = lock.writeLock();
		writeLock.lock();
		return writeLock::unlock;
	}

	/**
	 * @return true if the current thread holds the write lock
	 */
	public boolean isWriteLockedByCurrentThread()
	{
		return lock.isWriteLockedByCurrentThread();
	}
}
