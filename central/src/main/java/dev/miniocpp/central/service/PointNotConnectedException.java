package dev.miniocpp.central.service;

/**
 * No live session is registered under the requested charge point identity.
 */
public class PointNotConnectedException extends RuntimeException {

	private final String identity;

	public PointNotConnectedException(String identity) {
		super("Charge point " + identity + " is not connected");
		this.identity = identity;
	}

	public String getIdentity() {
		return identity;
	}

}
