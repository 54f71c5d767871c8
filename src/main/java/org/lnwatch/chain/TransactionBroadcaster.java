package org.lnwatch.chain;

import org.bitcoinj.core.Transaction;

public interface TransactionBroadcaster {

	/**
	 * Submits <tt>transaction</tt> to the network.
	 *
	 * @return txid as accepted by the network
	 * @throws ChainIndexException if the network is unreachable or rejects the transaction
	 */
	public String broadcastTransaction(Transaction transaction) throws ChainIndexException;

	/** Releases any network connections. */
	public default void shutdown() {
	}

}
