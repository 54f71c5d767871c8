package org.lnwatch.watcher;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelStatus;

/**
 * Latest known status per funding outpoint.
 * <p>
 * Only {@link SpendInspector} writes here: on each watch pass, and when the tower inspects a funding outpoint.
 */
public class ChannelStatusTracker {

	private final Map<Outpoint, ChannelStatus> statuses = new ConcurrentHashMap<>();

	/** Returns status of channel funded by <tt>fundingOutpoint</tt>, or {@link ChannelStatus#UNKNOWN} if never evaluated. */
	public ChannelStatus get(Outpoint fundingOutpoint) {
		return this.statuses.getOrDefault(fundingOutpoint, ChannelStatus.UNKNOWN);
	}

	/* package */ void update(Outpoint fundingOutpoint, ChannelStatus status) {
		this.statuses.put(fundingOutpoint, status);
	}

}
