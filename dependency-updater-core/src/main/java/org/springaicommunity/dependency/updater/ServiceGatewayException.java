package org.springaicommunity.dependency.updater;

/**
 * Failure of a {@link ServiceGateway} call.
 *
 * <p>
 * A status code of -1 means the call never produced a response (network failure,
 * timeout). Such failures and 5xx responses are transient and may be retried by a gateway
 * decorator; 4xx responses are not, except 429.
 */
public class ServiceGatewayException extends RuntimeException {

	private final int statusCode;

	public ServiceGatewayException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public ServiceGatewayException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public boolean isTransient() {
		return statusCode == -1 || statusCode == 429 || statusCode >= 500;
	}

}
