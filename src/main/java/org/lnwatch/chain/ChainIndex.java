package org.lnwatch.chain;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;
import org.lnwatch.event.Event;
import org.lnwatch.event.EventBus;

/**
 * Address-synchronizing view of the blockchain that watchers query.
 * <p>
 * Implementations resolve transaction hashes to heights and confirmations,
 * know which transaction spends a given output, and follow addresses added via {@link #addAddress(String)}.
 * They announce progress on their {@link EventBus} using the nested event types.
 */
public abstract class ChainIndex {

	/** New block(s) connected, chain tip advanced. */
	public static class ChainTipEvent implements Event {
		private final int height;

		public ChainTipEvent(int height) {
			this.height = height;
		}

		public int getHeight() {
			return this.height;
		}
	}

	/** A transaction relevant to a followed address has been verified (SPV-style) by the index. */
	public static class VerifiedTransactionEvent implements Event {
		private final String txid;

		public VerifiedTransactionEvent(String txid) {
			this.txid = txid;
		}

		public String getTxid() {
			return this.txid;
		}
	}

	/** Index has finished a synchronization pass and is now up to date. */
	public static class UpToDateEvent implements Event {
	}

	private final EventBus eventBus = new EventBus();

	public EventBus getEventBus() {
		return this.eventBus;
	}

	/** Network the index follows, used to decode addresses and parse raw transactions. */
	public abstract NetworkParameters getNetworkParameters();

	/**
	 * Returns mined info for <tt>txid</tt>.
	 * <p>
	 * Unknown transactions are reported with {@link TxMinedInfo#TX_HEIGHT_LOCAL} height.
	 */
	public abstract TxMinedInfo getTxHeight(String txid) throws ChainIndexException;

	/** Returns txid of the transaction spending <tt>txid:index</tt>, or null if unspent as far as we know. */
	public abstract String getSpentOutpoint(String txid, int index) throws ChainIndexException;

	/** Returns transaction with <tt>txid</tt>, or null if not (yet) known to the index. */
	public abstract Transaction getTransaction(String txid) throws ChainIndexException;

	/** Returns whether <tt>address</tt> is followed by this index. */
	public abstract boolean isMine(String address);

	/** Starts following <tt>address</tt>. Adding an already followed address is a no-op. */
	public abstract void addAddress(String address);

	/** Returns whether the index has caught up with all followed addresses. */
	public abstract boolean isUpToDate();

	/** Returns whether the index has a running synchronizer, i.e. is connected to the network. */
	public abstract boolean isSynchronizing();

}
