package org.lnwatch.data;

import java.util.Objects;

/** Human-facing on-chain status of a watched channel. */
public class ChannelStatus {

	public enum State {
		/** Not yet evaluated. */
		UNKNOWN,
		/** Funding output unspent. */
		OPEN,
		/** Funding output spent, closing transaction not yet deeply mined. */
		CLOSED,
		/** Closing transaction deeply mined. */
		CLOSED_DEEP;
	}

	public static final ChannelStatus UNKNOWN = new ChannelStatus(State.UNKNOWN, 0);
	public static final ChannelStatus OPEN = new ChannelStatus(State.OPEN, 0);
	public static final ChannelStatus CLOSED_DEEP = new ChannelStatus(State.CLOSED_DEEP, 0);

	private final State state;
	// Only meaningful for CLOSED
	private final int confirmations;

	private ChannelStatus(State state, int confirmations) {
		this.state = state;
		this.confirmations = confirmations;
	}

	public static ChannelStatus closed(int confirmations) {
		return new ChannelStatus(State.CLOSED, confirmations);
	}

	public State getState() {
		return this.state;
	}

	public int getConfirmations() {
		return this.confirmations;
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (!(other instanceof ChannelStatus))
			return false;

		ChannelStatus otherStatus = (ChannelStatus) other;

		return this.state == otherStatus.state && this.confirmations == otherStatus.confirmations;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.state, this.confirmations);
	}

	@Override
	public String toString() {
		switch (this.state) {
			case OPEN:
				return "open";

			case CLOSED:
				return String.format("closed (%d)", this.confirmations);

			case CLOSED_DEEP:
				return "closed (deep)";

			default:
				return "unknown";
		}
	}

}
