package org.lnwatch.chain;

/**
 * Where a transaction sits relative to the chain, as reported by the chain index.
 * <p>
 * Always freshly fetched from {@link ChainIndex#getTxHeight(String)}; confirmations change with every block.
 */
public class TxMinedInfo {

	/** Transaction is not yet valid, e.g. its locktime is in the future. */
	public static final int TX_HEIGHT_FUTURE = -3;
	/** Transaction only exists locally and has never been broadcast. */
	public static final int TX_HEIGHT_LOCAL = -2;
	/** Transaction is in mempool but spends an unconfirmed parent. */
	public static final int TX_HEIGHT_UNCONF_PARENT = -1;
	/** Transaction is in mempool. */
	public static final int TX_HEIGHT_UNCONFIRMED = 0;

	private final int height;
	private final int confirmations;

	public TxMinedInfo(int height, int confirmations) {
		this.height = height;
		this.confirmations = confirmations;
	}

	/** Info for a transaction the chain index has never heard of. */
	public static TxMinedInfo local() {
		return new TxMinedInfo(TX_HEIGHT_LOCAL, 0);
	}

	public int getHeight() {
		return this.height;
	}

	public int getConfirmations() {
		return this.confirmations;
	}

	public boolean isLocalOrFuture() {
		return this.height == TX_HEIGHT_LOCAL || this.height == TX_HEIGHT_FUTURE;
	}

	@Override
	public String toString() {
		return String.format("{height %d, confirmations %d}", this.height, this.confirmations);
	}

}
