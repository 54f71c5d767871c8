package org.lnwatch.watcher;

import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelStateUpdate;
import org.lnwatch.repository.DataException;

/**
 * How a {@link ChannelWatcher} reacts to a closed channel: derive sweeps live from channel keys,
 * or replay sweeps handed to us in advance.
 */
public interface WatchStrategy {

	/**
	 * Tries to claim whatever can be claimed from <tt>closingTx</tt> and its descendants.
	 * <p>
	 * Must not throw for chain index or channel problems: log them and return true.
	 *
	 * @return whether channel still needs watching
	 */
	public boolean resolveClosingTransaction(Outpoint fundingOutpoint, Transaction closingTx);

	/** Records outcome of a channel evaluation. */
	public void persistChannelState(ChannelStateUpdate update);

	/** Called before the pass triggered by a new chain tip. */
	public default void onChainTip() {
	}

	/**
	 * Deletes persisted watch state for channel, as the first step of retiring it.
	 * <p>
	 * If this throws, the channel stays watched.
	 */
	public default void deleteChannelState(Outpoint fundingOutpoint) throws DataException {
	}

	/** Called once channel has been retired. */
	public default void onChannelRetired(Outpoint fundingOutpoint) {
	}

}
