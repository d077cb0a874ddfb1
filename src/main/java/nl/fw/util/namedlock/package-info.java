/**
 * Named locks for resources of which the name is only known at runtime.
 * A {@link nl.fw.util.namedlock.KeyedLockTable} creates a lock the first time a name is used
 * and (depending on the {@link nl.fw.util.namedlock.CleanupPolicy}) removes the lock when it is no longer used.
 * <br>Usage example: <pre>
 * KeyedLockTable&lt;String, Integer&gt; counters = new KeyedLockTable&lt;&gt;(CleanupPolicy.RETAIN_AFTER_USE);
 * int count = counters.withLock("F1", () -&gt; 0, v -&gt; v.update(i -&gt; i + 1));
 * </pre>
 * or, when the lock must be held beyond one method call: <pre>
 * ExtendedGuard&lt;Integer&gt; guard = counters.acquire("F1", () -&gt; 0);
 * try {
 * 	// use guard.get() and guard.set(..)
 * } finally {
 * 	guard.release();
 * } </pre>
 * A guard must be released by the thread that acquired it.
 * If the work done while holding a lock fails, call {@link nl.fw.util.namedlock.ExtendedGuard#poison()} 
 * before releasing the guard ({@code withLock} does this automatically). 
 * All further attempts to use the lock result in a {@link nl.fw.util.namedlock.PoisonedException}
 * until the lock is removed with {@code forceRemove}.
 * <p>  
 * A thread can hold guards for several names at the same time, 
 * but to prevent deadlocks all threads must lock the names in the same order.
 * <br>E.g. the following <i>is</i> allowed: <pre>
 * try (ExtendedGuard&lt;File&gt; g1 = files.acquire("F1", opener)) {
 * 	try (ExtendedGuard&lt;File&gt; g2 = files.acquire("F2", opener)) {
 * 		// use locked resources F1 and F2
 * 	}
 * } </pre>
 * But if another thread locks "F2" before "F1" at the same time, both threads wait forever.
 * Locking the same name twice from one thread is not allowed and results in an {@link java.lang.IllegalStateException}.
 */ 
package nl.fw.util.namedlock;
