package org.lnwatch.chain;

import java.util.Collection;

/**
 * How settled a transaction is, least-settled first.
 * <p>
 * Declaration order matters: comparisons and {@link #min(Collection)} rely on it.
 */
public enum TxMinedDepth {
	/** Local-only, not yet valid, or no transaction at all. */
	FREE,
	/** Broadcast but unconfirmed, or claimed mined but not yet verified. */
	MEMPOOL,
	/** Between 1 and {@link MinedDepthClassifier#DEEP_CONFIRMATIONS} confirmations. */
	SHALLOW,
	/** More than {@link MinedDepthClassifier#DEEP_CONFIRMATIONS} confirmations. */
	DEEP;

	public boolean isAtLeast(TxMinedDepth other) {
		return this.compareTo(other) >= 0;
	}

	/** Returns least-settled depth in <tt>depths</tt>, or {@link #DEEP} if there are none. */
	public static TxMinedDepth min(Collection<TxMinedDepth> depths) {
		TxMinedDepth result = DEEP;

		for (TxMinedDepth depth : depths)
			if (depth.compareTo(result) < 0)
				result = depth;

		return result;
	}
}
