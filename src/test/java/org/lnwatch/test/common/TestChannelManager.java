package org.lnwatch.test.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lnwatch.chain.Outpoint;
import org.lnwatch.channel.Channel;
import org.lnwatch.channel.ChannelManager;
import org.lnwatch.data.SweepInfo;

/** Wallet side of channels, recording what watchers hand to it. Safe to read while a watcher thread runs. */
public class TestChannelManager implements ChannelManager {

	private final Map<Outpoint, Channel> channels = new LinkedHashMap<>();
	private final List<SweepInfo> queuedSweeps = Collections.synchronizedList(new ArrayList<>());
	private final List<Channel> handledChannels = Collections.synchronizedList(new ArrayList<>());

	public void addChannel(Outpoint fundingOutpoint, Channel channel) {
		this.channels.put(fundingOutpoint, channel);
	}

	public void removeChannel(Outpoint fundingOutpoint) {
		this.channels.remove(fundingOutpoint);
	}

	public List<SweepInfo> getQueuedSweeps() {
		synchronized (this.queuedSweeps) {
			return new ArrayList<>(this.queuedSweeps);
		}
	}

	public List<Channel> getHandledChannels() {
		synchronized (this.handledChannels) {
			return new ArrayList<>(this.handledChannels);
		}
	}

	@Override
	public Channel getChannelByFundingOutpoint(Outpoint fundingOutpoint) {
		return this.channels.get(fundingOutpoint);
	}

	@Override
	public Collection<Channel> getChannels() {
		return this.channels.values();
	}

	@Override
	public void handleOnchainState(Channel channel) {
		this.handledChannels.add(channel);
	}

	@Override
	public void addSweepInfo(SweepInfo sweepInfo) {
		this.queuedSweeps.add(sweepInfo);
	}

}
