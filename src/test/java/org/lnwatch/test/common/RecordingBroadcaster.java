package org.lnwatch.test.common;

import java.util.ArrayList;
import java.util.List;

import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.TransactionBroadcaster;

/** Records broadcasts, and puts them into the chain index's mempool like the network would. */
public class RecordingBroadcaster implements TransactionBroadcaster {

	private final TestChainIndex chainIndex;
	private final List<Transaction> broadcasts = new ArrayList<>();
	private ChainIndexException failure = null;
	private int attemptCount = 0;
	private boolean isShutdown = false;

	public RecordingBroadcaster(TestChainIndex chainIndex) {
		this.chainIndex = chainIndex;
	}

	/** Makes broadcasts fail with <tt>failure</tt>, or succeed again if null. */
	public void setFailure(ChainIndexException failure) {
		this.failure = failure;
	}

	@Override
	public synchronized String broadcastTransaction(Transaction transaction) throws ChainIndexException {
		++this.attemptCount;

		if (this.failure != null)
			throw this.failure;

		this.broadcasts.add(transaction);
		this.chainIndex.addUnconfirmed(transaction);

		return transaction.getTxId().toString();
	}

	@Override
	public synchronized void shutdown() {
		this.isShutdown = true;
	}

	public synchronized boolean isShutdown() {
		return this.isShutdown;
	}

	public synchronized List<Transaction> getBroadcasts() {
		return new ArrayList<>(this.broadcasts);
	}

	public synchronized int getAttemptCount() {
		return this.attemptCount;
	}

}
