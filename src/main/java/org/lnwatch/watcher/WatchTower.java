package org.lnwatch.watcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ElectrumX;
import org.lnwatch.chain.MinedDepthClassifier;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TransactionBroadcaster;
import org.lnwatch.data.ChannelInfoData;
import org.lnwatch.data.ChannelStatus;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.Repository;
import org.lnwatch.repository.RepositoryManager;
import org.lnwatch.repository.SweepRepository;
import org.lnwatch.settings.Settings;

/**
 * Third-party watchtower: watches channels on behalf of clients,
 * broadcasting the sweep transactions they stored with us if a channel gets closed.
 * <p>
 * Requires {@link RepositoryManager} to have been set up.
 */
public class WatchTower {

	private static final Logger LOGGER = LogManager.getLogger(WatchTower.class);

	private final ChainIndex chainIndex;
	private final TransactionBroadcaster broadcaster;
	private final TowerSweepStrategy strategy;
	private final ChannelWatcher watcher;

	public WatchTower(ChainIndex chainIndex, TransactionBroadcaster broadcaster) {
		this.chainIndex = chainIndex;
		this.broadcaster = broadcaster;

		MinedDepthClassifier classifier = new MinedDepthClassifier(chainIndex);
		ChannelStatusTracker statusTracker = new ChannelStatusTracker();
		SpendInspector inspector = new SpendInspector(chainIndex, classifier, statusTracker);

		this.strategy = new TowerSweepStrategy(chainIndex, inspector, classifier, broadcaster);
		this.watcher = new ChannelWatcher(chainIndex, statusTracker, inspector, this.strategy);
	}

	/** Builds tower broadcasting via the ElectrumX servers listed in <tt>settings</tt>. */
	public static WatchTower fromSettings(ChainIndex chainIndex, Settings settings) {
		return new WatchTower(chainIndex, ElectrumX.fromSettings(settings));
	}

	// Lifecycle

	/** Resumes watching stored channels, then reacts to chain events. */
	public void start() throws DataException {
		this.startWatching();
		this.watcher.start();
	}

	public void stop() {
		this.watcher.stop();
		this.broadcaster.shutdown();
	}

	/** Tracks every channel in the repository, in random order. */
	public void startWatching() throws DataException {
		List<ChannelInfoData> channels;
		try (final Repository repository = RepositoryManager.getRepository()) {
			channels = new ArrayList<>(repository.getSweepRepository().getAllChannels());
		}

		Collections.shuffle(channels);

		for (ChannelInfoData channel : channels)
			this.watcher.track(channel.getOutpoint(), channel.getAddress());

		LOGGER.info(() -> String.format("Watchtower watching %d stored channel(s)", channels.size()));
	}

	// Client API

	/**
	 * Returns highest commitment number we hold sweeps for, or 0 if none.
	 * <p>
	 * Also starts watching the channel, if not already.
	 */
	public int getTurnNumber(Outpoint fundingOutpoint, String address) throws DataException {
		if (!this.watcher.isTracking(address)) {
			LOGGER.info(() -> String.format("Watching new channel: %s %s", fundingOutpoint, address));
			this.watcher.track(fundingOutpoint, address);
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			if (!sweepRepository.channelExists(fundingOutpoint)) {
				sweepRepository.saveChannel(new ChannelInfoData(fundingOutpoint, address));
				repository.saveChanges();
			}

			return sweepRepository.getTurnNumber(fundingOutpoint);
		}
	}

	/**
	 * Stores a client's signed sweep of <tt>prevout</tt>, valid as of commitment number <tt>ctn</tt>.
	 *
	 * @throws IllegalArgumentException if <tt>rawTransaction</tt> isn't a complete transaction spending <tt>prevout</tt>
	 */
	public void addSweepTransaction(Outpoint fundingOutpoint, int ctn, Outpoint prevout, byte[] rawTransaction) throws DataException {
		validateSweepTransaction(prevout, rawTransaction);

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSweepRepository().addSweepTransaction(fundingOutpoint, ctn, prevout, rawTransaction);
			repository.saveChanges();
		}
	}

	private void validateSweepTransaction(Outpoint prevout, byte[] rawTransaction) {
		Transaction transaction;
		try {
			transaction = new Transaction(this.chainIndex.getNetworkParameters(), rawTransaction);
		} catch (ProtocolException e) {
			throw new IllegalArgumentException("Unable to parse sweep transaction", e);
		}

		boolean spendsPrevout = false;
		for (TransactionInput input : transaction.getInputs()) {
			if (input.getScriptBytes().length == 0 && !input.hasWitness())
				throw new IllegalArgumentException(String.format("Sweep transaction %s is not fully signed", transaction.getTxId()));

			spendsPrevout |= prevout.matches(input.getOutpoint());
		}

		if (!spendsPrevout)
			throw new IllegalArgumentException(String.format("Sweep transaction %s doesn't spend %s", transaction.getTxId(), prevout));
	}

	public int countStoredSweeps(Outpoint fundingOutpoint) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getSweepRepository().countSweepTransactions(fundingOutpoint);
		}
	}

	/** Returns funding outpoints of channels we hold sweeps for. */
	public Set<Outpoint> listStoredSweeps() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getSweepRepository().getSweepFundingOutpoints();
		}
	}

	public List<ChannelInfoData> listChannels() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getSweepRepository().getAllChannels();
		}
	}

	public ChannelStatus getChannelStatus(Outpoint fundingOutpoint) {
		return this.watcher.getChannelStatus(fundingOutpoint);
	}

	public TowerListener getListener(Outpoint fundingOutpoint) {
		return this.strategy.getListener(fundingOutpoint);
	}

	public void removeListener(Outpoint fundingOutpoint) {
		this.strategy.removeListener(fundingOutpoint);
	}

	public ChannelWatcher getWatcher() {
		return this.watcher;
	}

	public TransactionBroadcaster getBroadcaster() {
		return this.broadcaster;
	}

}
