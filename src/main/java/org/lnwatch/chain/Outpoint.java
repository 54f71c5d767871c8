package org.lnwatch.chain;

import java.util.Objects;

import org.bitcoinj.core.TransactionOutPoint;

/** Transaction output reference, in <tt>txid:index</tt> form when serialized. */
public class Outpoint implements Comparable<Outpoint> {

	private final String txid;
	private final int index;

	public Outpoint(String txid, int index) {
		this.txid = Objects.requireNonNull(txid);
		this.index = index;
	}

	/**
	 * Parses <tt>txid:index</tt>.
	 *
	 * @throws IllegalArgumentException if <tt>outpoint</tt> is malformed
	 */
	public static Outpoint fromString(String outpoint) {
		int colonIndex = outpoint.lastIndexOf(':');
		if (colonIndex <= 0 || colonIndex == outpoint.length() - 1)
			throw new IllegalArgumentException(String.format("Malformed outpoint '%s'", outpoint));

		try {
			return new Outpoint(outpoint.substring(0, colonIndex), Integer.parseInt(outpoint.substring(colonIndex + 1)));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(String.format("Malformed outpoint index in '%s'", outpoint), e);
		}
	}

	public static Outpoint fromTransactionOutPoint(TransactionOutPoint outPoint) {
		return new Outpoint(outPoint.getHash().toString(), (int) outPoint.getIndex());
	}

	public String getTxid() {
		return this.txid;
	}

	public int getIndex() {
		return this.index;
	}

	/** Returns whether <tt>outPoint</tt>, as found in a transaction input, refers to this outpoint. */
	public boolean matches(TransactionOutPoint outPoint) {
		return outPoint.getIndex() == this.index && outPoint.getHash().toString().equals(this.txid);
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (!(other instanceof Outpoint))
			return false;

		Outpoint otherOutpoint = (Outpoint) other;

		return this.index == otherOutpoint.index && this.txid.equals(otherOutpoint.txid);
	}

	@Override
	public int hashCode() {
		return this.txid.hashCode() ^ this.index;
	}

	@Override
	public int compareTo(Outpoint other) {
		int txidComparison = this.txid.compareTo(other.txid);
		if (txidComparison != 0)
			return txidComparison;

		return Integer.compare(this.index, other.index);
	}

	@Override
	public String toString() {
		return String.format("%s:%d", this.txid, this.index);
	}

}
