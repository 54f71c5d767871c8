package org.lnwatch.watcher;

import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.MinedDepthClassifier;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.channel.ChannelManager;
import org.lnwatch.data.ChannelStatus;

/** Watches our own channels, claiming what we're owed when they close. */
public class WalletWatcher {

	private final WalletSweepStrategy strategy;
	private final ChannelWatcher watcher;

	public WalletWatcher(ChainIndex chainIndex, ChannelManager channelManager) {
		MinedDepthClassifier classifier = new MinedDepthClassifier(chainIndex);
		ChannelStatusTracker statusTracker = new ChannelStatusTracker();
		SpendInspector inspector = new SpendInspector(chainIndex, classifier, statusTracker);

		this.strategy = new WalletSweepStrategy(chainIndex, inspector, classifier, channelManager);
		this.watcher = new ChannelWatcher(chainIndex, statusTracker, inspector, this.strategy);
	}

	public void start() {
		this.watcher.start();
	}

	public void stop() {
		this.watcher.stop();
	}

	public void track(Outpoint fundingOutpoint, String address) {
		this.watcher.track(fundingOutpoint, address);
	}

	public ChannelStatus getChannelStatus(Outpoint fundingOutpoint) {
		return this.watcher.getChannelStatus(fundingOutpoint);
	}

	public WalletSweepStrategy getStrategy() {
		return this.strategy;
	}

	public ChannelWatcher getWatcher() {
		return this.watcher;
	}

}
