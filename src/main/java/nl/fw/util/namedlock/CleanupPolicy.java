package nl.fw.util.namedlock;

/**
 * Determines what happens to a named lock in a {@link KeyedLockTable} when it is no longer used.
 * 
 * @author vanOekel
 *
 */
public enum CleanupPolicy {

	/**
	 * Named locks stay in the table until {@link KeyedLockTable#tryRemove(Object)} 
	 * (or {@link KeyedLockTable#forceRemove(Object)}) removes them.
	 */
	RETAIN_AFTER_USE,

	/**
	 * Each release of a guard tries to remove the named lock from the table.
	 * The named lock is removed when the released guard was the last user.
	 */
	AUTO_CLEANUP;
}
