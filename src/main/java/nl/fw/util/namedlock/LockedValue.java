package nl.fw.util.namedlock;

import java.util.function.UnaryOperator;

/**
 * Access to a value that is protected by a lock held by the current thread.
 * 
 * @param <V> type of the protected value
 */
public interface LockedValue<V> {

	V get();

	void set(V value);

	/**
	 * Replaces the value with the result of the given function.
	 * @return the new value
	 */
	V update(UnaryOperator<V> function);
}
