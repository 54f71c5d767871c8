package org.lnwatch.channel;

import java.util.Map;

import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelStateUpdate;
import org.lnwatch.data.SweepInfo;

/**
 * Channel with its own keys, able to work out how to claim outputs once it has been closed on-chain.
 */
public interface Channel {

	/** Short identifier suitable for log messages. */
	public String getIdForLog();

	/**
	 * Works out which outputs of <tt>closingTx</tt> we can claim, keyed by prevout.
	 * <p>
	 * Covers to_local, to_remote and first-stage HTLC outputs, including penalties for revoked commitments.
	 */
	public Map<Outpoint, SweepInfo> sweepCtx(Transaction closingTx) throws ChannelException;

	/**
	 * Works out second-stage HTLC outputs we can claim, given a transaction <tt>spenderTx</tt>
	 * that spent one of <tt>closingTx</tt>'s outputs.
	 */
	public Map<Outpoint, SweepInfo> maybeSweepHtlcs(Transaction closingTx, Transaction spenderTx) throws ChannelException;

	/** Inspects <tt>txIn</tt>, which spent an HTLC output, for a payment preimage and records it if found. */
	public void extractPreimageFromHtlcTxin(TransactionInput txIn) throws ChannelException;

	/** Records latest on-chain evaluation. */
	public void updateOnchainState(ChannelStateUpdate update);

	/** Discards cached sweep candidates so they get recomputed. */
	public void clearSweepCache();

}
