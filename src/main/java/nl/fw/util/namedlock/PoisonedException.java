package nl.fw.util.namedlock;

/**
 * Thrown when a named lock cannot be used because a previous lock holder failed
 * while it had the lock (see {@link ExtendedGuard#poison()}).
 * The value protected by the lock may be in an inconsistent state.
 * <br>Poison is never cleared automatically: the named lock stays unusable 
 * until {@link KeyedLockTable#forceRemove(Object)} removes it.
 * Other named locks in the same table are not affected.
 * 
 * @author vanOekel
 *
 */
public class PoisonedException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String lockName;

	public PoisonedException(String lockName) {
		super("Lock " + lockName + " is poisoned by a previous lock holder.");
		this.lockName = lockName;
	}

	/**
	 * The name (key) of the poisoned lock.
	 */
	public String getLockName() {
		return lockName;
	}
}
