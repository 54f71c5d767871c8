package org.lnwatch.watcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TxMinedInfo;
import org.lnwatch.data.ChannelStateUpdate;
import org.lnwatch.data.ChannelStatus;
import org.lnwatch.event.Event;
import org.lnwatch.event.Listener;
import org.lnwatch.repository.DataException;
import org.lnwatch.utils.NamedThreadFactory;

/**
 * Re-evaluates every tracked channel whenever the chain index reports progress,
 * handing closed channels to a {@link WatchStrategy} and retiring channels once fully settled.
 * <p>
 * Passes run one at a time on a dedicated thread, so a channel is never evaluated concurrently with itself.
 */
public class ChannelWatcher implements Listener {

	private static final Logger LOGGER = LogManager.getLogger(ChannelWatcher.class);

	private static final long STOP_TIMEOUT = 30L; // seconds

	private final ChainIndex chainIndex;
	private final ChannelStatusTracker statusTracker;
	private final SpendInspector inspector;
	private final WatchStrategy strategy;

	/** Funding outpoint by watched address. One entry per address. */
	private final Map<String, Outpoint> trackedChannels = new ConcurrentHashMap<>();

	private final Object passLock = new Object();
	private ExecutorService passExecutor;
	private volatile boolean isRunning = false;

	public ChannelWatcher(ChainIndex chainIndex, ChannelStatusTracker statusTracker, SpendInspector inspector, WatchStrategy strategy) {
		this.chainIndex = chainIndex;
		this.statusTracker = statusTracker;
		this.inspector = inspector;
		this.strategy = strategy;
	}

	// Tracking

	/** Starts watching channel. Tracking an already tracked address keeps its original channel. */
	public void track(Outpoint fundingOutpoint, String address) {
		this.chainIndex.addAddress(address);

		Outpoint existing = this.trackedChannels.putIfAbsent(address, fundingOutpoint);
		if (existing == null)
			LOGGER.debug(() -> String.format("Watching channel %s at %s", fundingOutpoint, address));
		else if (!existing.equals(fundingOutpoint))
			LOGGER.warn(() -> String.format("Address %s already watched for channel %s, ignoring %s", address, existing, fundingOutpoint));
	}

	public void untrack(String address) {
		this.trackedChannels.remove(address);
	}

	public boolean isTracking(String address) {
		return this.trackedChannels.containsKey(address);
	}

	public int getTrackedCount() {
		return this.trackedChannels.size();
	}

	public ChannelStatus getChannelStatus(Outpoint fundingOutpoint) {
		return this.statusTracker.get(fundingOutpoint);
	}

	// Lifecycle

	public synchronized void start() {
		if (this.isRunning)
			return;

		this.passExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("ChannelWatcher"));
		this.isRunning = true;
		this.chainIndex.getEventBus().addListener(this);
	}

	/** Stops reacting to chain events, waiting for any in-flight pass to finish. */
	public synchronized void stop() {
		if (!this.isRunning)
			return;

		this.isRunning = false;
		this.chainIndex.getEventBus().removeListener(this);

		this.passExecutor.shutdown();
		try {
			if (!this.passExecutor.awaitTermination(STOP_TIMEOUT, TimeUnit.SECONDS))
				LOGGER.warn("Channel watcher pass still running after shutdown timeout");
		} catch (InterruptedException e) {
			LOGGER.warn("Interrupted while waiting for channel watcher pass to finish");
			Thread.currentThread().interrupt();
		}
	}

	public boolean isRunning() {
		return this.isRunning;
	}

	@Override
	public void listen(Event event) {
		final boolean isNewChainTip = event instanceof ChainIndex.ChainTipEvent;

		if (!isNewChainTip
				&& !(event instanceof ChainIndex.VerifiedTransactionEvent)
				&& !(event instanceof ChainIndex.UpToDateEvent))
			return;

		try {
			this.passExecutor.execute(() -> {
				// Queued passes are dropped once stopped
				if (!this.isRunning)
					return;

				if (isNewChainTip)
					this.strategy.onChainTip();

				this.runPass();
			});
		} catch (RejectedExecutionException e) {
			LOGGER.debug(() -> String.format("Ignoring %s as channel watcher is stopping", event.getClass().getSimpleName()));
		}
	}

	// Evaluation

	/** Evaluates every tracked channel once, in random order. */
	public void runPass() {
		synchronized (this.passLock) {
			if (!this.chainIndex.isSynchronizing()) {
				LOGGER.info("Chain index synchronizer not running yet");
				return;
			}

			List<Map.Entry<String, Outpoint>> channels = new ArrayList<>(this.trackedChannels.entrySet());
			Collections.shuffle(channels);

			for (Map.Entry<String, Outpoint> channel : channels) {
				String address = channel.getKey();
				Outpoint fundingOutpoint = channel.getValue();

				// Untracked during this pass?
				if (!this.trackedChannels.containsKey(address))
					continue;

				try {
					this.checkOnchainSituation(address, fundingOutpoint);
				} catch (ChainIndexException e) {
					LOGGER.warn(() -> String.format("Chain index issue checking channel %s: %s", fundingOutpoint, e.getMessage()));
				} catch (IllegalStateException e) {
					LOGGER.fatal(String.format("Unable to classify transactions of channel %s", fundingOutpoint), e);
				} catch (RuntimeException e) {
					LOGGER.error(String.format("Unexpected failure checking channel %s", fundingOutpoint), e);
				}
			}
		}
	}

	private void checkOnchainSituation(String address, Outpoint fundingOutpoint) throws ChainIndexException {
		// Address not added yet
		if (!this.chainIndex.isMine(address))
			return;

		// Inspection might have added new addresses, so wait until index catches up
		if (!this.chainIndex.isUpToDate())
			return;

		String fundingTxid = fundingOutpoint.getTxid();
		TxMinedInfo fundingHeight = this.chainIndex.getTxHeight(fundingTxid);

		String closingTxid = this.inspector.getSpender(fundingOutpoint);
		TxMinedInfo closingHeight = closingTxid != null ? this.chainIndex.getTxHeight(closingTxid) : null;

		this.inspector.updateFundingStatus(fundingOutpoint, closingTxid);

		boolean keepWatching = true;
		if (closingTxid != null) {
			Transaction closingTx = this.chainIndex.getTransaction(closingTxid);

			if (closingTx != null)
				keepWatching = this.strategy.resolveClosingTransaction(fundingOutpoint, closingTx);
			else
				LOGGER.info(() -> String.format("Channel %s closed by %s, still waiting for transaction itself", fundingOutpoint, closingTxid));
		}

		this.strategy.persistChannelState(new ChannelStateUpdate(fundingOutpoint, fundingTxid, fundingHeight,
				closingTxid, closingHeight, keepWatching));

		if (!keepWatching)
			this.retire(address, fundingOutpoint);
	}

	private void retire(String address, Outpoint fundingOutpoint) {
		LOGGER.info(() -> String.format("Unwatching channel %s", fundingOutpoint));

		try {
			this.strategy.deleteChannelState(fundingOutpoint);
		} catch (DataException e) {
			LOGGER.error(String.format("Couldn't delete watch state of channel %s, still watching", fundingOutpoint), e);
			return;
		}

		this.trackedChannels.remove(address);
		this.strategy.onChannelRetired(fundingOutpoint);
	}

}
