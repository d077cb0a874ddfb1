package nl.fw.util.namedlock;

/**
 * Outcome of {@link KeyedLockTable#tryRemove(Object)}.
 * None of these outcomes is an error, a caller decides what to do next.
 */
public enum RemoveResult {

	/** The named lock was removed. */
	SUCCESS,

	/** There was no named lock for the key. */
	NOT_FOUND,

	/** The named lock is locked or somebody is waiting to lock it. Nothing was removed. */
	WOULD_BLOCK,

	/** A previous lock holder failed, the named lock was not removed. */
	POISONED;
}
