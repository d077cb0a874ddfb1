package nl.fw.util.namedlock;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test for {@link KeyedLockTable} using the "dining philosophers problem", see also
 * <br>{@code http://en.wikipedia.org/wiki/Dining_philosophers_problem}
 * <br>Each fork is a named lock, philosophers pick up forks in order of fork name to prevent deadlocks.
 * Forks are removed from the table when nobody uses them ({@link CleanupPolicy#AUTO_CLEANUP}).
 * <br>The logged (on INFO-level) wait-times refer to the time waiting for the forks (measured in milliseconds).
 * <br>Note: put debug logging OFF to prevent a flood of messages.
 * 
 * @author vanOekel
 *
 */
@DisplayName("Dining philosophers")
class DiningPhilosophersTest {

	private static final Logger log = LoggerFactory.getLogger(DiningPhilosophersTest.class);

	/* Total runtime. */
	static final long DINING_TIME_MS = 1_000L;

	static final int PHILOSOPHERS = 5;

	static final int FORKS_PER_PHILOSOPHER = 2;

	static final long EAT_TIME_MIN_MS = 5L;

	/* Random max. amount added to EAT_TIME_MIN_MS */
	static final int EAT_TIME_RANDOM_MS = 5;

	/* How long to wait for a fork. */
	static final long MAX_WAIT_TIME_MS = EAT_TIME_MIN_MS + EAT_TIME_RANDOM_MS + 1L;

	static final long THINK_TIME_MS = 2L;

	/** The value protected by a fork lock: who is using the fork. */
	static class Fork {
		String user;
	}

	final KeyedLockTable<String, Fork> forks = new KeyedLockTable<>(CleanupPolicy.AUTO_CLEANUP, false, true);

	final AtomicInteger forkConflicts = new AtomicInteger();

	List<Philosopher> philosophers;
	ExecutorService tp;

	CountDownLatch tableReady;
	CountDownLatch tableEmpty;

	@BeforeEach
	void setup() {

		tableReady = new CountDownLatch(PHILOSOPHERS);
		tableEmpty = new CountDownLatch(PHILOSOPHERS);
		tp = Executors.newCachedThreadPool();
		philosophers = new LinkedList<Philosopher>();
		for (int i = 1; i < PHILOSOPHERS + 1; i++) {
			Philosopher p = new Philosopher();
			philosophers.add(p);
			p.name = "P" + i;
			int f = i;
			for (int j = 0; j < FORKS_PER_PHILOSOPHER; j++) {
				p.forksUsed.add("F" + f);
				f++;
				if (f > PHILOSOPHERS) {
					f = 1;
				}
			}
		}
	}

	@AfterEach
	void tearDown() {
		tp.shutdownNow();
	}

	@Test
	@Timeout(value = 20, unit = TimeUnit.SECONDS)
	@DisplayName("All philosophers eat without sharing forks")
	void dine() throws InterruptedException {

		for (Philosopher p : philosophers) {
			tp.execute(p);
		}
		assertTrue(tableReady.await(1_000L, TimeUnit.MILLISECONDS), "Missing one or more philosophers at the table.");
		Thread.sleep(DINING_TIME_MS);
		for (Philosopher p : philosophers) {
			p.stop = true;
		}
		assertTrue(tableEmpty.await(5_000L, TimeUnit.MILLISECONDS), "One or more philosophers did not leave the table.");
		if (log.isInfoEnabled()) {
			StringBuilder sb = new StringBuilder("Philosopher stats:");
			for (Philosopher p : philosophers) {
				sb.append('\n').append(p.name).append(' ').append(p.getStats());
			}
			log.info(sb.toString());
		}
		assertEquals(0, forkConflicts.get(), "Forks were used by two philosophers at the same time.");
		for (Philosopher p : philosophers) {
			assertNull(p.error, p.name + " rudely removed from table.");
			assertTrue(p.meals > 0, p.name + " did not eat.");
		}
		assertTrue(forks.isAllUnlocked(), "One or more philosophers lost a fork.");
		assertEquals(0, forks.size(), "Unused forks were not removed from the table.");
	}

	class Philosopher implements Runnable {

		volatile boolean stop;
		volatile Exception error;
		String name;
		/* Sorted: all philosophers pick up forks in the same order. */
		TreeSet<String> forksUsed = new TreeSet<>();

		volatile int meals;
		volatile int retries;
		volatile long longestWaitMs;
		volatile long totalWaitMs;
		Random random = new Random();

		@Override 
		public void run() {

			String tname = Thread.currentThread().getName();
			Thread.currentThread().setName(name);
			try {
				tableReady.countDown();
				log.info(name + " at table, forks used for eating: " + forksUsed);
				tableReady.await(1_000L, TimeUnit.MILLISECONDS);
				while (!stop) {
					Thread.sleep(THINK_TIME_MS);
					final long waitStart = System.currentTimeMillis();
					List<ExtendedGuard<Fork>> held;
					while ((held = pickUpForks()) == null) {
						retries++;
					}
					final long waited = System.currentTimeMillis() - waitStart;
					totalWaitMs += waited;
					longestWaitMs = Math.max(longestWaitMs, waited);
					try {
						eat(held);
					} finally {
						putDownForks(held);
					}
				}
			} catch (Exception e) {
				error = e;
				log.error(name + " rudely removed from table.", e);
			} finally {
				tableEmpty.countDown();
				Thread.currentThread().setName(tname);
			}
		}

		/**
		 * @return null if a fork was not available in time.
		 */
		List<ExtendedGuard<Fork>> pickUpForks() throws InterruptedException, PoisonedException {

			List<ExtendedGuard<Fork>> held = new ArrayList<>();
			boolean haveForks = false;
			try {
				for (String fork : forksUsed) {
					held.add(forks.acquire(fork, Fork::new, MAX_WAIT_TIME_MS, TimeUnit.MILLISECONDS));
				}
				haveForks = true;
			} catch (TimeoutException e) {
				if (log.isDebugEnabled()) {
					log.debug(name + " did not acquire forks within " + MAX_WAIT_TIME_MS + " ms.");
				}
			} finally {
				if (!haveForks) {
					putDownForks(held);
				}
			}
			return (haveForks ? held : null);
		}

		void putDownForks(List<ExtendedGuard<Fork>> held) {

			for (int i = held.size() - 1; i >= 0; i--) {
				held.get(i).release();
			}
		}

		void eat(List<ExtendedGuard<Fork>> held) throws InterruptedException {

			for (ExtendedGuard<Fork> fork : held) {
				if (fork.get().user != null) {
					forkConflicts.incrementAndGet();
				}
				fork.get().user = name;
			}
			long eatTime = EAT_TIME_MIN_MS + (EAT_TIME_RANDOM_MS > 0 ? random.nextInt(EAT_TIME_RANDOM_MS) : 0);
			Thread.sleep(eatTime);
			for (ExtendedGuard<Fork> fork : held) {
				if (!name.equals(fork.get().user)) {
					forkConflicts.incrementAndGet();
				}
				fork.get().user = null;
			}
			meals++;
		}

		String getStats() {
			return "meals = " + meals + ", retries = " + retries 
					+ ", longest / total wait time - " + longestWaitMs + " / " + totalWaitMs;
		}
	}
}
