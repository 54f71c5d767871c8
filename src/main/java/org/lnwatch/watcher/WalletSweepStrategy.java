package org.lnwatch.watcher;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.MinedDepthClassifier;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.channel.Channel;
import org.lnwatch.channel.ChannelException;
import org.lnwatch.channel.ChannelManager;
import org.lnwatch.data.ChannelStateUpdate;
import org.lnwatch.data.SweepInfo;
import org.lnwatch.settings.Settings;

/**
 * Claims outputs of our own closed channels, using sweep candidates the channel derives from its keys.
 * <p>
 * Covers revoked commitments (penalties), our share of honest closes,
 * and second-stage HTLC outputs, and picks up payment preimages revealed by the remote side's claims.
 */
public class WalletSweepStrategy implements WatchStrategy {

	private static final Logger LOGGER = LogManager.getLogger(WalletSweepStrategy.class);

	private final ChainIndex chainIndex;
	private final SpendInspector inspector;
	private final MinedDepthClassifier classifier;
	private final ChannelManager channelManager;

	public WalletSweepStrategy(ChainIndex chainIndex, SpendInspector inspector, MinedDepthClassifier classifier, ChannelManager channelManager) {
		this.chainIndex = chainIndex;
		this.inspector = inspector;
		this.classifier = classifier;
		this.channelManager = channelManager;
	}

	@Override
	public boolean resolveClosingTransaction(Outpoint fundingOutpoint, Transaction closingTx) {
		Channel channel = this.channelManager.getChannelByFundingOutpoint(fundingOutpoint);
		if (channel == null)
			// Nothing left to protect
			return false;

		try {
			return this.sweepCommitmentTransaction(channel, closingTx);
		} catch (ChainIndexException e) {
			LOGGER.warn(() -> String.format("Chain index issue while sweeping channel %s: %s", channel.getIdForLog(), e.getMessage()));
		} catch (ChannelException e) {
			LOGGER.error(String.format("Channel %s couldn't work out sweeps for closing transaction %s", channel.getIdForLog(), closingTx.getTxId()), e);
		}

		// Nothing productive happened this time, so try again later
		return true;
	}

	private boolean sweepCommitmentTransaction(Channel channel, Transaction closingTx) throws ChainIndexException, ChannelException {
		long followedBefore = this.inspector.getFollowedAddressCount();

		// Work out who closed and how to claim outputs
		Map<Outpoint, SweepInfo> sweepInfos = channel.sweepCtx(closingTx);

		// Nothing to claim: done once closing transaction can't be reorged away
		boolean keepWatching = sweepInfos.isEmpty() ? !this.classifier.isDeeplyMined(closingTx.getTxId().toString()) : false;

		for (Map.Entry<Outpoint, SweepInfo> entry : sweepInfos.entrySet()) {
			Outpoint prevout = entry.getKey();
			SweepInfo sweepInfo = entry.getValue();
			String name = sweepInfo.getName() + " " + channel.getIdForLog();

			// Can't act without the prevout's transaction, but it might turn up later
			if (this.chainIndex.getTransaction(prevout.getTxid()) == null) {
				LOGGER.info(() -> String.format("Prevout %s does not exist for %s", prevout, name));
				keepWatching = true;
				continue;
			}

			String spenderTxid = this.inspector.getSpender(prevout);
			Transaction spenderTx = spenderTxid != null ? this.chainIndex.getTransaction(spenderTxid) : null;

			if (spenderTx == null) {
				// Ours to claim, or bump
				keepWatching = true;
				this.maybeRedeem(sweepInfo);
				continue;
			}

			// Spender might be remote, revoked or not
			Map<Outpoint, SweepInfo> htlcSweepInfos = channel.maybeSweepHtlcs(closingTx, spenderTx);
			for (Map.Entry<Outpoint, SweepInfo> htlcEntry : htlcSweepInfos.entrySet()) {
				String htlcSpenderTxid = this.inspector.getSpender(htlcEntry.getKey());

				if (htlcSpenderTxid != null) {
					keepWatching |= !this.classifier.isDeeplyMined(htlcSpenderTxid);
				} else {
					keepWatching = true;
					this.maybeRedeem(htlcEntry.getValue());
				}
			}

			keepWatching |= !this.classifier.isDeeplyMined(spenderTxid);

			TransactionInput spenderInput = findInputSpending(spenderTx, prevout);
			if (spenderInput != null)
				channel.extractPreimageFromHtlcTxin(spenderInput);
		}

		// Outputs we only just started following could already be spent
		if (this.inspector.getFollowedAddressCount() != followedBefore)
			keepWatching = true;

		return keepWatching;
	}

	/**
	 * Hands <tt>sweepInfo</tt> to the wallet for broadcast.
	 * <p>
	 * Sweeps without any timelock settle HTLCs on-chain immediately, which also forgoes revocation,
	 * so they are dropped unless explicitly enabled in settings.
	 */
	public void maybeRedeem(SweepInfo sweepInfo) {
		if (!sweepInfo.isTimelocked() && !Settings.getInstance().isHtlcSettleOnchainEnabled()) {
			LOGGER.debug(() -> String.format("Not settling %s on-chain as disabled by settings", sweepInfo));
			return;
		}

		this.channelManager.addSweepInfo(sweepInfo);
	}

	/** Discards sweep candidates cached by channels, as preimages or completed payments can change them between blocks. */
	@Override
	public void onChainTip() {
		for (Channel channel : this.channelManager.getChannels())
			channel.clearSweepCache();
	}

	@Override
	public void persistChannelState(ChannelStateUpdate update) {
		Channel channel = this.channelManager.getChannelByFundingOutpoint(update.getFundingOutpoint());
		if (channel == null)
			return;

		channel.updateOnchainState(update);

		try {
			this.channelManager.handleOnchainState(channel);
		} catch (ChannelException e) {
			LOGGER.error(String.format("Couldn't handle on-chain state of channel %s", channel.getIdForLog()), e);
		}
	}

	private static TransactionInput findInputSpending(Transaction transaction, Outpoint prevout) {
		for (TransactionInput input : transaction.getInputs())
			if (prevout.matches(input.getOutpoint()))
				return input;

		return null;
	}

}
