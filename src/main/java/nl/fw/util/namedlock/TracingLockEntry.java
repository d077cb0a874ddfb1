package nl.fw.util.namedlock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A lock entry that logs a stack trace each time a handle to the entry is retained or released.
 * Use it to find code that does not release a {@link ExtendedGuard}.
 * Logging is done on TRACE level, the entry behaves exactly like a {@link LockEntry}.
 * <br>See also {@link KeyedLockTable#KeyedLockTable(CleanupPolicy, boolean, boolean)}.
 * 
 * @author vanOekel
 *
 * @param <V> type of the protected value
 */
public class TracingLockEntry<V> extends LockEntry<V> {

	private static final Logger log = LoggerFactory.getLogger(TracingLockEntry.class);

	public TracingLockEntry(String name, V value, boolean fair) {
		super(name, value, fair);
	}

	@Override
	public LockEntry<V> retain() {
		super.retain();
		if (log.isTraceEnabled()) {
			log.trace("Thread " + Thread.currentThread().getName() + ": retained lock entry " + this 
					+ " (" + refCount() + " holders)", new Throwable("Retained at"));
		}
		return this;
	}

	@Override
	public void release() {
		super.release();
		if (log.isTraceEnabled()) {
			log.trace("Thread " + Thread.currentThread().getName() + ": released lock entry " + this 
					+ " (" + refCount() + " holders)", new Throwable("Released at"));
		}
	}
}
