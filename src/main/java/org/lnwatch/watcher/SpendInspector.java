package org.lnwatch.watcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.script.ScriptException;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.HtlcWitnessTemplate;
import org.lnwatch.chain.MinedDepthClassifier;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TxMinedInfo;
import org.lnwatch.data.ChannelStatus;

/**
 * Follows the transactions spending a channel's funding output, and their descendants.
 * <p>
 * Inspection has two deliberate side effects:
 * <ul>
 * <li>output addresses of spending transactions that the chain index doesn't follow yet are added to it,
 * so that later passes can see who spends them;</li>
 * <li>inspecting a funding outpoint (depth 0) updates its {@link ChannelStatus}, as does {@link #updateFundingStatus(Outpoint, String)}.</li>
 * </ul>
 */
public class SpendInspector {

	private static final Logger LOGGER = LogManager.getLogger(SpendInspector.class);

	/** Funding output. */
	public static final int DEPTH_FUNDING = 0;
	/** Commitment/closing transaction output: to_local, to_remote or first-stage HTLC. */
	public static final int DEPTH_COMMITMENT = 1;
	/** Second-stage HTLC output. Never recursed into. */
	public static final int DEPTH_SECOND_STAGE = 2;

	private final ChainIndex chainIndex;
	private final MinedDepthClassifier classifier;
	private final ChannelStatusTracker statusTracker;

	private final AtomicLong followedAddressCount = new AtomicLong();

	public SpendInspector(ChainIndex chainIndex, MinedDepthClassifier classifier, ChannelStatusTracker statusTracker) {
		this.chainIndex = chainIndex;
		this.classifier = classifier;
		this.statusTracker = statusTracker;
	}

	/**
	 * Returns spenders of <tt>outpoint</tt> and of interesting descendant outputs, keyed by outpoint, in discovery order.
	 * <p>
	 * A null value means the outpoint is unspent as far as the network is concerned.
	 *
	 * @param depth 0 if <tt>outpoint</tt> is a funding output, 1 for a commitment output, 2 for a second-stage HTLC output
	 */
	public Map<Outpoint, String> inspect(Outpoint outpoint, int depth) throws ChainIndexException {
		if (depth < DEPTH_FUNDING || depth > DEPTH_SECOND_STAGE)
			throw new IllegalArgumentException(String.format("Inspection depth %d out of range", depth));

		Map<Outpoint, String> result = new LinkedHashMap<>();
		this.inspect(outpoint, depth, result);
		return result;
	}

	private void inspect(Outpoint outpoint, int depth, Map<Outpoint, String> result) throws ChainIndexException {
		String spenderTxid = this.findSpender(outpoint);
		result.put(outpoint, spenderTxid);

		if (depth == DEPTH_FUNDING)
			this.updateFundingStatus(outpoint, spenderTxid);

		if (spenderTxid == null)
			return;

		Transaction spenderTx = this.chainIndex.getTransaction(spenderTxid);
		if (spenderTx == null) {
			LOGGER.debug(() -> String.format("Spender %s of %s not available yet", spenderTxid, outpoint));
			return;
		}

		// Past the commitment, only first-stage HTLC transactions lead anywhere interesting.
		// Other spenders still get their outputs followed.
		final boolean recurse = depth < DEPTH_SECOND_STAGE
				&& (depth != DEPTH_COMMITMENT || isFirstStageHtlc(spenderTx));

		List<TransactionOutput> outputs = spenderTx.getOutputs();
		for (int index = 0; index < outputs.size(); ++index) {
			String address = this.outputAddress(outputs.get(index));
			if (address == null)
				continue;

			if (!this.chainIndex.isMine(address))
				this.follow(address);
			else if (recurse)
				this.inspect(new Outpoint(spenderTxid, index), depth + 1, result);
		}
	}

	/**
	 * Returns txid of transaction spending <tt>outpoint</tt>, or null if unspent.
	 * <p>
	 * Unlike {@link #inspect(Outpoint, int)}, doesn't recurse, but still adds the spender's output addresses to the chain index.
	 */
	public String getSpender(Outpoint outpoint) throws ChainIndexException {
		String spenderTxid = this.findSpender(outpoint);
		if (spenderTxid == null)
			return null;

		Transaction spenderTx = this.chainIndex.getTransaction(spenderTxid);
		if (spenderTx == null)
			return spenderTxid;

		for (TransactionOutput output : spenderTx.getOutputs()) {
			String address = this.outputAddress(output);
			if (address != null && !this.chainIndex.isMine(address))
				this.follow(address);
		}

		return spenderTxid;
	}

	/**
	 * Returns how many addresses inspection has added to the chain index so far.
	 * <p>
	 * Callers compare before and after inspecting: spends of newly followed addresses
	 * only become visible once the index catches up.
	 */
	public long getFollowedAddressCount() {
		return this.followedAddressCount.get();
	}

	private void follow(String address) {
		LOGGER.trace(() -> String.format("Following %s", address));
		this.chainIndex.addAddress(address);
		this.followedAddressCount.incrementAndGet();
	}

	/** Returns spender txid, ignoring spenders that were never broadcast or aren't valid yet. */
	private String findSpender(Outpoint outpoint) throws ChainIndexException {
		String spenderTxid = this.chainIndex.getSpentOutpoint(outpoint.getTxid(), outpoint.getIndex());
		if (spenderTxid == null)
			return null;

		TxMinedInfo spenderMinedInfo = this.chainIndex.getTxHeight(spenderTxid);
		if (spenderMinedInfo.isLocalOrFuture())
			return null;

		return spenderTxid;
	}

	/** Records status of channel funded by <tt>fundingOutpoint</tt>, given the txid spending it, or null while unspent. */
	public void updateFundingStatus(Outpoint fundingOutpoint, String closingTxid) throws ChainIndexException {
		this.statusTracker.update(fundingOutpoint, this.deriveStatus(closingTxid));
	}

	private ChannelStatus deriveStatus(String closingTxid) throws ChainIndexException {
		if (closingTxid == null)
			return ChannelStatus.OPEN;

		if (this.classifier.isDeeplyMined(closingTxid))
			return ChannelStatus.CLOSED_DEEP;

		return ChannelStatus.closed(this.chainIndex.getTxHeight(closingTxid).getConfirmations());
	}

	/*
	 * A lone input whose witness script is an HTLC script.
	 * This misses first-stage HTLC transactions with extra inputs, as used by anchor-output channels.
	 */
	private static boolean isFirstStageHtlc(Transaction spenderTx) {
		List<TransactionInput> inputs = spenderTx.getInputs();
		if (inputs.size() != 1)
			return false;

		// No witness, e.g. an unsigned local wallet spend of a coop-close output
		return HtlcWitnessTemplate.matchInput(inputs.get(0)) != null;
	}

	/** Returns address paid to by <tt>output</tt>, or null if its script doesn't pay to an address (e.g. OP_RETURN). */
	private String outputAddress(TransactionOutput output) {
		try {
			return output.getScriptPubKey().getToAddress(this.chainIndex.getNetworkParameters()).toString();
		} catch (ScriptException e) {
			return null;
		}
	}

}
