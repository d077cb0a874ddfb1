package nl.fw.util.namedlock;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A namespace of named locks. A named lock (a {@link LockEntry}) is created the first time 
 * the name is used and removed when it is no longer used (depending on the {@link CleanupPolicy}).
 * All methods are thread-safe.
 * <p>
 * All administration is done while holding one table lock (a fair {@link ReentrantLock}).
 * The table lock is never held while waiting for a named lock: {@link #acquire(Object, Supplier)} 
 * registers the caller as user of the named lock, releases the table lock and only then waits for the named lock.
 * A named lock with users other than the table itself is never removed.
 * Releasing a guard unlocks the named lock before the table lock is used for cleanup.
 * This lock order prevents deadlocks between the table and its named locks.
 * <br>See also the package description for more info. 
 * 
 * @author vanOekel
 *
 * @param <K> type of lock name (unique ID for the protected value)
 * @param <V> type of the protected value
 */
public class KeyedLockTable<K, V> {

	private static final Logger log = LoggerFactory.getLogger(KeyedLockTable.class);

	/**
	 * Reference count of an unused entry: the reference held by the table itself.
	 */
	static final int TABLE_REFERENCE = 1;

	/**
	 * The table administration, shared by all tables created via {@link #share()}.
	 */
	private static class Names<K, V> {

		/**
		 * The main lock that keeps all administration in order.
		 */
		final ReentrantLock tableLock = new ReentrantLock(true);

		/**
		 * The named locks. Only updated while holding the table lock,
		 * concurrent to allow cheap (unsynchronized) inspection.
		 */
		final ConcurrentHashMap<K, LockEntry<V>> entries = new ConcurrentHashMap<>();
	}

	private final Names<K, V> names;
	private final CleanupPolicy policy;
	private final boolean traceHandles;
	private final boolean fairEntries;

	/**
	 * A table with the given cleanup policy, no handle tracing and non-fair named locks.
	 */
	public KeyedLockTable(CleanupPolicy policy) {
		this(policy, false, false);
	}

	/**
	 * @param policy what to do with named locks that are no longer used.
	 * @param traceHandles if true, named locks are {@link TracingLockEntry}s that log (on TRACE level) 
	 * where handles are retained and released.
	 * @param fairEntries if true, named locks are given to waiting threads in order of arrival.
	 */
	public KeyedLockTable(CleanupPolicy policy, boolean traceHandles, boolean fairEntries) {
		this(new Names<K, V>(), policy, traceHandles, fairEntries);
	}

	private KeyedLockTable(Names<K, V> names, CleanupPolicy policy, boolean traceHandles, boolean fairEntries) {
		this.names = names;
		this.policy = Objects.requireNonNull(policy, "cleanup policy");
		this.traceHandles = traceHandles;
		this.fairEntries = fairEntries;
	}

	/**
	 * Returns a table that shares the named locks with this table.
	 * Both tables can be used independently from each other (e.g. one per thread).
	 */
	public KeyedLockTable<K, V> share() {
		return new KeyedLockTable<K, V>(names, policy, traceHandles, fairEntries);
	}

	public CleanupPolicy getPolicy() {
		return policy;
	}

	/* *** Locking *** */

	/**
	 * Locks the named lock, no lock timeout is used (i.e wait forever).
	 * If the named lock does not exist, it is created with a value from the initializer.
	 * <br>The returned guard must be released, preferably via try-with-resources: <pre>
	 * try (ExtendedGuard&lt;V&gt; guard = table.acquire(key, initializer)) {
	 * 	// use guard.get()
	 * } </pre>
	 * @param key the name of the lock.
	 * @param initializer called (once) while holding the table lock to create the value for a new named lock.
	 * It must not use this table. If it throws an exception, no named lock is created.
	 * @throws PoisonedException when a previous lock holder failed. 
	 */
	public ExtendedGuard<V> acquire(K key, Supplier<? extends V> initializer) throws PoisonedException {

		final LockEntry<V> entry = retainEntry(key, initializer);
		return ExtendedGuard.lockRetained(entry, releaseHook(key));
	}

	/**
	 * Locks the named lock, see {@link #acquire(Object, Supplier)}.
	 * <br>If the lock is not available within the given time, the attempt is rolled back 
	 * (with {@link CleanupPolicy#AUTO_CLEANUP} a named lock created for this attempt is removed again).
	 * @param timeout lock time-out. A value less than 0 is used as "no timeout" (wait forever).
	 * @param tunit lock time unit.
	 * @throws InterruptedException when current thread is interrupted while waiting for the lock.
 	 * @throws TimeoutException when lock time-out =&gt; 0 and the named lock is not available within the given lock time-out period.
	 * @throws PoisonedException when a previous lock holder failed. 
	 */
	public ExtendedGuard<V> acquire(K key, Supplier<? extends V> initializer, long timeout, TimeUnit tunit) 
			throws InterruptedException, TimeoutException, PoisonedException {

		Objects.requireNonNull(tunit, "time unit");
		final LockEntry<V> entry = retainEntry(key, initializer);
		return ExtendedGuard.tryLockRetained(entry, releaseHook(key), timeout, tunit);
	}

	/**
	 * Locks the named lock, calls the function with the locked value and releases the lock. 
	 * The lock is released whatever way the function ends. 
	 * If the function throws an exception, the named lock is poisoned (see {@link ExtendedGuard#poison()}) 
	 * and the exception is re-thrown.
	 * <br>See also {@link #acquire(Object, Supplier)}.
	 * @return the function result
	 * @throws PoisonedException when a previous lock holder failed, the function is not called.
	 */
	public <R> R withLock(K key, Supplier<? extends V> initializer, Function<? super LockedValue<V>, ? extends R> body) 
			throws PoisonedException {

		Objects.requireNonNull(body, "body");
		final ExtendedGuard<V> guard = acquire(key, initializer);
		try {
			return body.apply(guard);
		} catch (RuntimeException | Error e) {
			guard.poison();
			throw e;
		} finally {
			guard.release();
		}
	}

	/**
	 * Finds or creates the named lock and registers one more user for it.
	 */
	private LockEntry<V> retainEntry(K key, Supplier<? extends V> initializer) {

		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(initializer, "initializer");
		final ReentrantLock tableLock = lockTable(key);
		try {
			LockEntry<V> entry = names.entries.get(key);
			if (entry == null) {
				entry = newEntry(key, initializer.get());
				names.entries.put(key, entry);
				if (log.isDebugEnabled()) {
					log.debug("Created lock " + entry);
				}
			}
			return entry.retain();
		} finally {
			tableLock.unlock();
		}
	}

	private LockEntry<V> newEntry(K key, V value) {

		final String name = String.valueOf(key);
		return (traceHandles ? new TracingLockEntry<V>(name, value, fairEntries) : new LockEntry<V>(name, value, fairEntries));
	}

	private ExtendedGuard.ReleaseHook<V> releaseHook(final K key) {

		if (policy == CleanupPolicy.AUTO_CLEANUP) {
			return new ExtendedGuard.ReleaseHook<V>() {
				@Override
				public void released(LockEntry<V> entry) {
					cleanup(key, entry);
				}
			};
		}
		return new ExtendedGuard.ReleaseHook<V>() {
			@Override
			public void released(LockEntry<V> entry) {
				entry.release();
			}
		};
	}

	/**
	 * Releases the handle of a (former) user of the named lock and removes the named lock if it is no longer used.
	 * The named lock must already be unlocked by the user.
	 */
	private void cleanup(Object key, LockEntry<V> entry) {

		final ReentrantLock tableLock = names.tableLock;
		tableLock.lock();
		try {
			entry.release();
			if (names.entries.get(key) == entry) {
				final RemoveResult result = removeUnused(key, entry, false);
				if (result == RemoveResult.POISONED && log.isDebugEnabled()) {
					log.debug("Not removing poisoned lock " + entry);
				}
			}
		} finally {
			tableLock.unlock();
		}
	}

	/* *** Removal *** */

	/**
	 * Removes the named lock if nobody is using it. This method never waits for a named lock.
	 * @param key the name of the lock. Any object equal to the key that was used to create the lock will do.
	 * @return {@link RemoveResult#WOULD_BLOCK} if the named lock is locked or about to be locked,
	 * {@link RemoveResult#POISONED} if the named lock is poisoned (it is not removed). 
	 */
	public RemoveResult tryRemove(Object key) {
		return remove(key, false);
	}

	/**
	 * As {@link #tryRemove(Object)} but also removes a poisoned named lock that is not used.
	 * The next use of the name creates a new named lock with a fresh value.
	 * @return {@link RemoveResult#SUCCESS} when a (possibly poisoned) named lock was removed. 
	 */
	public RemoveResult forceRemove(Object key) {
		return remove(key, true);
	}

	private RemoveResult remove(Object key, boolean force) {

		Objects.requireNonNull(key, "key");
		final ReentrantLock tableLock = lockTable(key);
		try {
			final LockEntry<V> entry = names.entries.get(key);
			if (entry == null) {
				return RemoveResult.NOT_FOUND;
			}
			return removeUnused(key, entry, force);
		} finally {
			tableLock.unlock();
		}
	}

	/**
	 * Caller must hold the table lock: it guarantees nobody can start using the entry
	 * (the reference count can only go down).
	 */
	private RemoveResult removeUnused(Object key, LockEntry<V> entry, boolean force) {

		if (entry.refCount() > TABLE_REFERENCE) {
			return RemoveResult.WOULD_BLOCK;
		}
		if (!entry.lock.tryLock()) {
			return RemoveResult.WOULD_BLOCK;
		}
		try {
			if (entry.poisoned && !force) {
				return RemoveResult.POISONED;
			}
			names.entries.remove(key);
			entry.release();
			if (log.isDebugEnabled()) {
				log.debug("Removed " + (entry.poisoned ? "poisoned lock " : "lock ") + entry);
			}
			return RemoveResult.SUCCESS;
		} finally {
			entry.lock.unlock();
		}
	}

	/*
	 * Initializers run while the table lock is held, using the table from an initializer 
	 * would change the administration halfway a lookup.
	 */
	private ReentrantLock lockTable(Object key) {

		final ReentrantLock tableLock = names.tableLock;
		if (tableLock.isHeldByCurrentThread()) {
			throw new IllegalStateException("Lock table cannot be used from within an initializer (while creating lock " + key + ").");
		}
		tableLock.lock();
		return tableLock;
	}

	/* *** utility methods *** */

	/**
	 * The number of named locks in this table.
	 * Should be 0 with {@link CleanupPolicy#AUTO_CLEANUP} if all users have finished (e.g. after finishing a process).
	 */
	public int size() {
		return names.entries.size();
	}

	/**
	 * Returns true if a named lock exists for the key.
	 * This is a cheap operation.
	 */
	public boolean containsKey(Object key) {
		return names.entries.containsKey(key);
	}

	/**
	 * Returns true if named lock is currently being used (i.e. is locked by a guard).
	 * This is a cheap operation.
	 */
	public boolean isLocked(Object key) {

		final LockEntry<V> entry = names.entries.get(key);
		return (entry == null ? false : entry.isLocked());
	}

	/**
	 * Returns true if the named lock exists and is poisoned.
	 * This is a cheap operation.
	 */
	public boolean isPoisoned(Object key) {

		final LockEntry<V> entry = names.entries.get(key);
		return (entry == null ? false : entry.poisoned);
	}

	/**
	 * Synchronizes on the table lock and obtains the number of guards and lock attempts for the named lock.
	 */
	public int getLockUsers(Object key) {

		final ReentrantLock tableLock = names.tableLock;
		tableLock.lock();
		try {
			final LockEntry<V> entry = names.entries.get(key);
			return (entry == null ? 0 : entry.refCount() - TABLE_REFERENCE);
		} finally {
			tableLock.unlock();
		}
	}

	/**
	 * Returns true if all named locks are unlocked.
	 * Use this method with (unit) testing to ensure locks are always released.
	 */
	public boolean isAllUnlocked() {

		for (LockEntry<V> entry : names.entries.values()) {
			if (entry.isLocked()) {
				return false;
			}
		}
		return true;
	}

	@Override public String toString() {
		return "KeyedLockTable (" + policy + ", " + size() + " locks)";
	}
}
