package org.lnwatch.watcher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.MinedDepthClassifier;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TransactionBroadcaster;
import org.lnwatch.chain.TxMinedInfo;
import org.lnwatch.data.ChannelStateUpdate;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.Repository;
import org.lnwatch.repository.RepositoryManager;
import org.lnwatch.repository.SweepRepository;

/**
 * Replays sweep transactions that clients stored with us in advance.
 * <p>
 * We hold no channel keys, so all we can do is broadcast stored transactions whose prevouts are still unspent.
 */
public class TowerSweepStrategy implements WatchStrategy {

	private static final Logger LOGGER = LogManager.getLogger(TowerSweepStrategy.class);

	private final ChainIndex chainIndex;
	private final SpendInspector inspector;
	private final MinedDepthClassifier classifier;
	private final TransactionBroadcaster broadcaster;

	private final Map<Outpoint, TowerListener> listeners = new ConcurrentHashMap<>();

	public TowerSweepStrategy(ChainIndex chainIndex, SpendInspector inspector, MinedDepthClassifier classifier, TransactionBroadcaster broadcaster) {
		this.chainIndex = chainIndex;
		this.inspector = inspector;
		this.classifier = classifier;
		this.broadcaster = broadcaster;
	}

	@Override
	public boolean resolveClosingTransaction(Outpoint fundingOutpoint, Transaction closingTx) {
		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			long followedBefore = this.inspector.getFollowedAddressCount();
			Map<Outpoint, String> spenders = this.inspector.inspect(fundingOutpoint, SpendInspector.DEPTH_FUNDING);

			boolean keepWatching = false;
			for (Map.Entry<Outpoint, String> entry : spenders.entrySet()) {
				Outpoint prevout = entry.getKey();
				String spenderTxid = entry.getValue();

				if (spenderTxid != null) {
					keepWatching |= !this.classifier.isDeeplyMined(spenderTxid);
					continue;
				}

				List<Transaction> sweepTransactions = sweepRepository.getSweepTransactions(fundingOutpoint, prevout);
				for (Transaction sweepTransaction : sweepTransactions) {
					this.broadcastOrLog(fundingOutpoint, sweepTransaction);
					keepWatching = true;
				}
			}

			// Outputs we only just started following could already be spent
			if (this.inspector.getFollowedAddressCount() != followedBefore)
				keepWatching = true;

			return keepWatching;
		} catch (DataException e) {
			LOGGER.error(String.format("Repository issue while sweeping channel %s", fundingOutpoint), e);
		} catch (ChainIndexException e) {
			LOGGER.warn(() -> String.format("Chain index issue while sweeping channel %s: %s", fundingOutpoint, e.getMessage()));
		}

		// Try again later
		return true;
	}

	/**
	 * Broadcasts <tt>transaction</tt> unless it has already been broadcast.
	 *
	 * @return txid reported by network, or null if not broadcast
	 */
	public String broadcastOrLog(Outpoint fundingOutpoint, Transaction transaction) throws ChainIndexException {
		String txid = transaction.getTxId().toString();

		// Anything else means the network already knows about it
		if (this.chainIndex.getTxHeight(txid).getHeight() != TxMinedInfo.TX_HEIGHT_LOCAL)
			return null;

		String broadcastTxid;
		try {
			broadcastTxid = this.broadcaster.broadcastTransaction(transaction);
		} catch (ChainIndexException e) {
			LOGGER.info(() -> String.format("Broadcast failure: txid=%s, funding outpoint=%s: %s", txid, fundingOutpoint, e.getMessage()));
			return null;
		}

		LOGGER.info(() -> String.format("Broadcast success: txid=%s, funding outpoint=%s", txid, fundingOutpoint));

		TowerListener listener = this.listeners.get(fundingOutpoint);
		if (listener != null)
			listener.addBroadcast(transaction);

		return broadcastTxid;
	}

	@Override
	public void persistChannelState(ChannelStateUpdate update) {
		// Nothing to record: stored sweeps and channel info are all a tower keeps
	}

	@Override
	public void deleteChannelState(Outpoint fundingOutpoint) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			int sweepCount = sweepRepository.deleteSweepTransactions(fundingOutpoint);
			sweepRepository.deleteChannel(fundingOutpoint);

			repository.saveChanges();

			LOGGER.debug(() -> String.format("Deleted %d stored sweep(s) for channel %s", sweepCount, fundingOutpoint));
		}
	}

	@Override
	public void onChannelRetired(Outpoint fundingOutpoint) {
		TowerListener listener = this.listeners.get(fundingOutpoint);
		if (listener != null)
			listener.complete();
	}

	/** Returns listener for channel, creating one if needed. */
	public TowerListener getListener(Outpoint fundingOutpoint) {
		return this.listeners.computeIfAbsent(fundingOutpoint, outpoint -> new TowerListener());
	}

	public void removeListener(Outpoint fundingOutpoint) {
		this.listeners.remove(fundingOutpoint);
	}

}
