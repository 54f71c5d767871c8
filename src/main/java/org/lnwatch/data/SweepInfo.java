package org.lnwatch.data;

import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutput;
import org.lnwatch.chain.Outpoint;

/**
 * A way to claim one channel-related output, as proposed by the channel.
 * <p>
 * <tt>txIn</tt> spends <tt>prevout</tt>; <tt>txOut</tt> is optional, with null meaning "sweep to wallet".
 */
public class SweepInfo {

	private final String name;
	private final Outpoint prevout;
	/** Relative timelock in blocks, 0 if none. */
	private final int csvDelay;
	/** Absolute timelock (block height), 0 if none. */
	private final int cltvAbs;
	private final TransactionInput txIn;
	private final TransactionOutput txOut;

	public SweepInfo(String name, Outpoint prevout, int csvDelay, int cltvAbs, TransactionInput txIn, TransactionOutput txOut) {
		this.name = name;
		this.prevout = prevout;
		this.csvDelay = csvDelay;
		this.cltvAbs = cltvAbs;
		this.txIn = txIn;
		this.txOut = txOut;
	}

	public String getName() {
		return this.name;
	}

	public Outpoint getPrevout() {
		return this.prevout;
	}

	public int getCsvDelay() {
		return this.csvDelay;
	}

	public int getCltvAbs() {
		return this.cltvAbs;
	}

	public TransactionInput getTxIn() {
		return this.txIn;
	}

	public TransactionOutput getTxOut() {
		return this.txOut;
	}

	/** Returns whether claiming requires waiting for any timelock. */
	public boolean isTimelocked() {
		return this.csvDelay != 0 || this.cltvAbs != 0;
	}

	@Override
	public String toString() {
		return String.format("%s %s (csv %d, cltv %d)", this.name, this.prevout, this.csvDelay, this.cltvAbs);
	}

}
