package org.lnwatch.chain;

/** Maps a transaction's position in the chain to a {@link TxMinedDepth}. */
public class MinedDepthClassifier {

	/** Transactions with more confirmations than this are considered irreversible. */
	public static final int DEEP_CONFIRMATIONS = 100;

	private final ChainIndex chainIndex;

	public MinedDepthClassifier(ChainIndex chainIndex) {
		this.chainIndex = chainIndex;
	}

	/**
	 * Returns depth of transaction with <tt>txid</tt>.
	 * <p>
	 * A null <tt>txid</tt> means there is no such transaction and yields {@link TxMinedDepth#FREE}.
	 *
	 * @throws IllegalStateException if the chain index reports a height/confirmations combination we don't understand
	 */
	public TxMinedDepth classify(String txid) throws ChainIndexException {
		if (txid == null)
			return TxMinedDepth.FREE;

		return classify(this.chainIndex.getTxHeight(txid));
	}

	public boolean isDeeplyMined(String txid) throws ChainIndexException {
		return classify(txid) == TxMinedDepth.DEEP;
	}

	public static TxMinedDepth classify(TxMinedInfo txMinedInfo) {
		int height = txMinedInfo.getHeight();
		int confirmations = txMinedInfo.getConfirmations();

		if (confirmations > DEEP_CONFIRMATIONS)
			return TxMinedDepth.DEEP;

		if (confirmations > 0)
			return TxMinedDepth.SHALLOW;

		if (height == TxMinedInfo.TX_HEIGHT_UNCONFIRMED || height == TxMinedInfo.TX_HEIGHT_UNCONF_PARENT)
			return TxMinedDepth.MEMPOOL;

		if (height == TxMinedInfo.TX_HEIGHT_LOCAL || height == TxMinedInfo.TX_HEIGHT_FUTURE)
			return TxMinedDepth.FREE;

		// Unverified but claimed to be mined
		if (height > 0 && confirmations == 0)
			return TxMinedDepth.MEMPOOL;

		throw new IllegalStateException(String.format("Unexpected mined info from chain index: %s", txMinedInfo));
	}

}
