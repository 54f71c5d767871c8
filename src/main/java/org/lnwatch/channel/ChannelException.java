package org.lnwatch.channel;

@SuppressWarnings("serial")
public class ChannelException extends Exception {

	public ChannelException() {
		super();
	}

	public ChannelException(String message) {
		super(message);
	}

	public ChannelException(String message, Throwable cause) {
		super(message, cause);
	}

	public ChannelException(Throwable cause) {
		super(cause);
	}

}
