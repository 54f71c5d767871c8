package org.lnwatch.watcher;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.bitcoinj.core.Transaction;

/**
 * Lets callers follow a watchtower's progress on one channel:
 * transactions broadcast for it, and when it's no longer watched.
 */
public class TowerListener {

	private final CountDownLatch allDone = new CountDownLatch(1);
	private final BlockingQueue<Transaction> broadcastQueue = new LinkedBlockingQueue<>();

	/** Waits for channel to be retired. Returns false on timeout. */
	public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
		return this.allDone.await(timeout, unit);
	}

	public boolean isComplete() {
		return this.allDone.getCount() == 0;
	}

	/** Returns next broadcast transaction, waiting up to <tt>timeout</tt>, or null if none. */
	public Transaction pollBroadcast(long timeout, TimeUnit unit) throws InterruptedException {
		return this.broadcastQueue.poll(timeout, unit);
	}

	public BlockingQueue<Transaction> getBroadcastQueue() {
		return this.broadcastQueue;
	}

	/* package */ void addBroadcast(Transaction transaction) {
		this.broadcastQueue.add(transaction);
	}

	/* package */ void complete() {
		this.allDone.countDown();
	}

}
