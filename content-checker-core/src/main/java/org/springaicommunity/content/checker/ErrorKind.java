package org.springaicommunity.content.checker;

/**
 * Classification of check failures. Only transient kinds are retried by
 * {@link RetryExecutor}.
 */
public enum ErrorKind {

	/** Request or connect timeout. */
	TIMEOUT(true),

	/** Connection refused or reset, or any other transport failure. */
	CONNECTION(true),

	/** HTTP 429 Too Many Requests. */
	RATE_LIMITED(true),

	/** HTTP 5xx. */
	SERVER_ERROR(true),

	/** HTTP 401 or 403; bad token, username or client signature. */
	AUTHENTICATION(false),

	/** Any other HTTP 4xx, e.g. a malformed request. */
	CLIENT_ERROR(false),

	/** A submitted check did not finish before the polling deadline. */
	CHECK_EXPIRED(false),

	/** Response body the client could not understand. */
	INVALID_RESPONSE(false),

	/** File missing, not a regular file, or not readable. */
	FILE_NOT_READABLE(false),

	/** File exceeds the configured size limit. */
	FILE_TOO_LARGE(false),

	/** File exists but reading it failed, e.g. because it is being written. */
	FILE_BUSY(true),

	/** The shared cancellation signal fired. */
	CANCELLED(false),

	UNKNOWN(false);

	private final boolean transientError;

	ErrorKind(boolean transientError) {
		this.transientError = transientError;
	}

	public boolean isTransient() {
		return transientError;
	}

	/**
	 * Maps a non-2xx HTTP status code to an error kind.
	 * @param statusCode HTTP status code
	 * @return matching kind
	 */
	public static ErrorKind fromStatusCode(int statusCode) {
		if (statusCode == 429) {
			return RATE_LIMITED;
		}
		if (statusCode >= 500 && statusCode < 600) {
			return SERVER_ERROR;
		}
		if (statusCode == 401 || statusCode == 403) {
			return AUTHENTICATION;
		}
		if (statusCode >= 400 && statusCode < 500) {
			return CLIENT_ERROR;
		}
		return UNKNOWN;
	}

}
