package nl.fw.util.namedlock;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A value protected by its own lock, shared by reference counting.
 * <p>
 * The entry object itself is the shared handle: it never moves and every holder refers to the same instance.
 * Each holder of a handle must call {@link #retain()} once when it takes the handle 
 * and {@link #release()} once when it is done with it.
 * A new entry starts with one reference, owned by its creator 
 * (for entries in a {@link KeyedLockTable} that is the table itself).
 * <p>
 * The value is only accessed via an {@link ExtendedGuard} while {@link #lock} is held.
 * 
 * @author vanOekel
 *
 * @param <V> type of the protected value
 */
public class LockEntry<V> {

	final String name;

	/**
	 * Protects {@link #value}. Also used as a non-blocking probe by {@link KeyedLockTable} 
	 * to find out if the entry is in use.
	 */
	final ReentrantLock lock;

	/** Only accessed while {@link #lock} is held. */
	V value;

	/** 
	 * Set while {@link #lock} is held, never cleared. 
	 * Volatile so that state can be inspected without the lock.
	 */
	volatile boolean poisoned;

	private final AtomicInteger refs = new AtomicInteger(1);

	public LockEntry(String name, V value) {
		this(name, value, false);
	}

	/**
	 * @param name name of the entry, used for logging
	 * @param value the initial value
	 * @param fair if true, waiting lock holders get the lock in order of arrival (see {@link ReentrantLock#ReentrantLock(boolean)}).
	 */
	public LockEntry(String name, V value, boolean fair) {
		this.name = name;
		this.value = value;
		this.lock = new ReentrantLock(fair);
	}

	/**
	 * Registers one more holder of this entry.
	 * @return this entry
	 */
	public LockEntry<V> retain() {
		refs.incrementAndGet();
		return this;
	}

	/**
	 * Unregisters one holder of this entry.
	 * @throws IllegalStateException when there are no holders left to unregister.
	 */
	public void release() {
		if (refs.decrementAndGet() < 0) {
			refs.incrementAndGet();
			throw new IllegalStateException("Lock entry " + this + " released more often than retained.");
		}
	}

	/**
	 * The number of holders of this entry.
	 */
	public int refCount() {
		return refs.get();
	}

	public boolean isLocked() {
		return lock.isLocked();
	}

	public boolean isPoisoned() {
		return poisoned;
	}

	public String getName() {
		return name;
	}

	/**
	 * Returns name if name is set.
	 */
	@Override public String toString() {
		return (name == null ? super.toString() : name);
	}
}
