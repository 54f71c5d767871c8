package org.lnwatch.data;

import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TxMinedInfo;

/** Result of one on-chain evaluation of a watched channel. */
public class ChannelStateUpdate {

	private final Outpoint fundingOutpoint;
	private final String fundingTxid;
	private final TxMinedInfo fundingHeight;
	// Null if channel not (yet) closed
	private final String closingTxid;
	private final TxMinedInfo closingHeight;
	private final boolean keepWatching;

	public ChannelStateUpdate(Outpoint fundingOutpoint, String fundingTxid, TxMinedInfo fundingHeight,
			String closingTxid, TxMinedInfo closingHeight, boolean keepWatching) {
		this.fundingOutpoint = fundingOutpoint;
		this.fundingTxid = fundingTxid;
		this.fundingHeight = fundingHeight;
		this.closingTxid = closingTxid;
		this.closingHeight = closingHeight;
		this.keepWatching = keepWatching;
	}

	public Outpoint getFundingOutpoint() {
		return this.fundingOutpoint;
	}

	public String getFundingTxid() {
		return this.fundingTxid;
	}

	public TxMinedInfo getFundingHeight() {
		return this.fundingHeight;
	}

	public String getClosingTxid() {
		return this.closingTxid;
	}

	public TxMinedInfo getClosingHeight() {
		return this.closingHeight;
	}

	public boolean isKeepWatching() {
		return this.keepWatching;
	}

	@Override
	public String toString() {
		return String.format("funding %s %s, closing %s %s, keep watching: %b",
				this.fundingOutpoint, this.fundingHeight, this.closingTxid, this.closingHeight, this.keepWatching);
	}

}
