package org.lnwatch.data;

import java.util.Objects;

import org.lnwatch.chain.Outpoint;

/** Channel registered with a watchtower: funding outpoint and the address it pays to. */
public class ChannelInfoData {

	private final Outpoint outpoint;
	private final String address;

	public ChannelInfoData(Outpoint outpoint, String address) {
		this.outpoint = outpoint;
		this.address = address;
	}

	public Outpoint getOutpoint() {
		return this.outpoint;
	}

	public String getAddress() {
		return this.address;
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (!(other instanceof ChannelInfoData))
			return false;

		ChannelInfoData otherData = (ChannelInfoData) other;

		return this.outpoint.equals(otherData.outpoint) && Objects.equals(this.address, otherData.address);
	}

	@Override
	public int hashCode() {
		return this.outpoint.hashCode();
	}

	@Override
	public String toString() {
		return String.format("%s %s", this.outpoint, this.address);
	}

}
