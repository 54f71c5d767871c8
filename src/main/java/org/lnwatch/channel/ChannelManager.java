package org.lnwatch.channel;

import java.util.Collection;

import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.SweepInfo;

/** Owner of our channels and of the wallet that broadcasts sweeps. */
public interface ChannelManager {

	/** Returns channel funded by <tt>fundingOutpoint</tt>, or null if we don't know (any more) about it. */
	public Channel getChannelByFundingOutpoint(Outpoint fundingOutpoint);

	public Collection<Channel> getChannels();

	/** Reacts to a channel's on-chain state having been updated, e.g. by redeeming or forgetting it. */
	public void handleOnchainState(Channel channel) throws ChannelException;

	/** Hands <tt>sweepInfo</tt> to the wallet's pending-sweep queue for fee-bumped broadcast once timelocks allow. */
	public void addSweepInfo(SweepInfo sweepInfo);

}
