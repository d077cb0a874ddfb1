package nl.fw.util.namedlock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive access to the value of a {@link LockEntry}.
 * The guard owns a handle to the entry (see {@link LockEntry#retain()}) so the guard stays valid 
 * regardless of what happens to the table or variable the entry was obtained from.
 * <br>On release the entry's lock is unlocked first, after that the handle is released.
 * <p>
 * A guard is not thread-safe and must be released by the thread that acquired it.
 * <br>Usage example: <pre>
 * try (ExtendedGuard&lt;File&gt; guard = ExtendedGuard.lock(entry)) {
 * 	// use guard.get()
 * } </pre>
 * A guard is only valid once: after release any access throws an {@link IllegalStateException}.
 * 
 * @author vanOekel
 *
 * @param <V> type of the protected value
 */
public class ExtendedGuard<V> implements LockedValue<V>, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(ExtendedGuard.class);

	/**
	 * Receives the handle owned by a guard after the guard unlocked the entry.
	 * The hook becomes the owner of the handle and must release it.
	 */
	public interface ReleaseHook<V> {
		void released(LockEntry<V> entry);
	}

	private LockEntry<V> entry;
	private final ReleaseHook<V> hook;

	private ExtendedGuard(LockEntry<V> entry, ReleaseHook<V> hook) {
		this.entry = entry;
		this.hook = hook;
	}

	/**
	 * Locks the given entry, no lock timeout is used (i.e wait forever).
	 * @throws PoisonedException when a previous lock holder failed, the entry is not locked.
	 */
	public static <V> ExtendedGuard<V> lock(LockEntry<V> entry) throws PoisonedException {
		return lockRetained(entry.retain(), ExtendedGuard.<V>dropHandle());
	}

	/**
	 * Locks the given entry.
	 * @param timeout lock time-out. A value less than 0 is used as "no timeout" (wait forever).
	 * @param tunit lock time unit.
	 * @throws InterruptedException when current thread is interrupted while waiting for the lock.
	 * @throws TimeoutException when the lock is not available within the given lock time-out period.
	 * @throws PoisonedException when a previous lock holder failed, the entry is not locked.
	 */
	public static <V> ExtendedGuard<V> tryLock(LockEntry<V> entry, long timeout, TimeUnit tunit) 
			throws InterruptedException, TimeoutException, PoisonedException {
		return tryLockRetained(entry.retain(), ExtendedGuard.<V>dropHandle(), timeout, tunit);
	}

	/**
	 * The hook of guards that were not created by a {@link KeyedLockTable}: only the handle is released.
	 */
	@SuppressWarnings("rawtypes")
	private static final ReleaseHook DROP_HANDLE = new ReleaseHook() {
		@Override
		public void released(LockEntry entry) {
			entry.release();
		}
	};

	@SuppressWarnings("unchecked")
	private static <V> ReleaseHook<V> dropHandle() {
		return DROP_HANDLE;
	}

	/**
	 * Locks an entry for which a handle was already retained on behalf of the guard.
	 * If locking fails, the handle is given to the hook.
	 */
	static <V> ExtendedGuard<V> lockRetained(LockEntry<V> entry, ReleaseHook<V> hook) throws PoisonedException {

		checkNotHeld(entry, hook);
		entry.lock.lock();
		return checkPoisoned(entry, hook);
	}

	/**
	 * See {@link #lockRetained(LockEntry, ReleaseHook)} and {@link #tryLock(LockEntry, long, TimeUnit)}.
	 */
	static <V> ExtendedGuard<V> tryLockRetained(LockEntry<V> entry, ReleaseHook<V> hook, long timeout, TimeUnit tunit) 
			throws InterruptedException, TimeoutException, PoisonedException {

		checkNotHeld(entry, hook);
		boolean locked = false;
		try {
			if (timeout < 0L) {
				entry.lock.lockInterruptibly();
				locked = true;
			} else {
				locked = entry.lock.tryLock(timeout, tunit);
			}
		} finally {
			if (!locked) {
				hook.released(entry);
			}
		}
		if (!locked) {
			throw new TimeoutException("Unable to acquire lock " + entry + " within " + tunit.toMillis(timeout) + " ms.");
		}
		return checkPoisoned(entry, hook);
	}

	/*
	 * The entry lock is re-entrant but a second guard for the same entry in the same thread
	 * would break the one-guard-per-entry rule.
	 */
	private static <V> void checkNotHeld(LockEntry<V> entry, ReleaseHook<V> hook) {

		if (entry.lock.isHeldByCurrentThread()) {
			hook.released(entry);
			throw new IllegalStateException("Lock " + entry + " is already locked by the current thread " 
					+ Thread.currentThread().getName() + ". Release the guard first.");
		}
	}

	private static <V> ExtendedGuard<V> checkPoisoned(LockEntry<V> entry, ReleaseHook<V> hook) throws PoisonedException {

		if (entry.poisoned) {
			entry.lock.unlock();
			hook.released(entry);
			throw new PoisonedException(entry.toString());
		}
		return new ExtendedGuard<V>(entry, hook);
	}

	private LockEntry<V> held() {

		final LockEntry<V> e = entry;
		if (e == null) {
			throw new IllegalStateException("Guard was already released.");
		}
		return e;
	}

	@Override
	public V get() {
		return held().value;
	}

	@Override
	public void set(V value) {
		held().value = value;
	}

	/**
	 * Marks the locked entry as failed: the value may be inconsistent.
	 * After release, any further attempt to lock the entry results in a {@link PoisonedException}.
	 */
	public void poison() {

		final LockEntry<V> e = held();
		if (!e.poisoned) {
			e.poisoned = true;
			log.warn("Lock {} poisoned by thread {}", e, Thread.currentThread().getName());
		}
	}

	public boolean isPoisoned() {
		return held().poisoned;
	}

	public boolean isReleased() {
		return (entry == null);
	}

	/**
	 * The name of the locked entry.
	 */
	public String getName() {
		return held().name;
	}

	/**
	 * Replaces the value with the result of the given function.
	 * @return the new value
	 */
	@Override
	public V update(UnaryOperator<V> function) {

		final LockEntry<V> e = held();
		e.value = function.apply(e.value);
		return e.value;
	}

	/**
	 * Unlocks the entry but does not release the handle to the entry: the caller becomes the owner of the handle
	 * and must call {@link LockEntry#release()} when done with it.
	 * <br>Only allowed for guards created via {@link #lock(LockEntry)} or {@link #tryLock(LockEntry, long, TimeUnit)}.
	 * Guards from a {@link KeyedLockTable} must be released with {@link #release()} 
	 * so that the table can remove the named lock when it is no longer used.
	 * @return the handle owned by this guard until now.
	 * @throws IllegalStateException when the guard was created by a table or was already released.
	 */
	public LockEntry<V> unlock() {

		final LockEntry<V> e = held();
		if (hook != DROP_HANDLE) {
			throw new IllegalStateException("Guard for lock " + e + " is owned by a lock table, use release() instead of unlock().");
		}
		return unlockEntry();
	}

	private LockEntry<V> unlockEntry() {

		final LockEntry<V> e = held();
		if (!e.lock.isHeldByCurrentThread()) {
			throw new IllegalStateException("Guard for lock " + e + " must be released by the thread that acquired it, not by " 
					+ Thread.currentThread().getName());
		}
		entry = null;
		e.lock.unlock();
		return e;
	}

	/**
	 * Unlocks the entry and after that gives the handle to the release hook.
	 * Does nothing if this guard was already released.
	 */
	public void release() {

		if (entry != null) {
			hook.released(unlockEntry());
		}
	}

	/**
	 * Same as {@link #release()}.
	 */
	@Override
	public void close() {
		release();
	}

	@Override public String toString() {
		final LockEntry<V> e = entry;
		return "Guard for " + (e == null ? "released lock" : e.toString());
	}
}
