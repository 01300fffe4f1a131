package org.springaicommunity.content.checker;

/**
 * Interface for the remote content checking platform.
 *
 * <p>
 * Provides abstraction over the platform's HTTP API, enabling testability and decorator
 * implementations. Implementations must be safe to share between concurrently running
 * checks.
 */
public interface PlatformClient {

	/**
	 * Sign in with a single sign-on token on behalf of a user.
	 * @param apiToken shared SSO secret
	 * @param username user the checks are run for
	 * @return access token for subsequent calls
	 * @throws ContentCheckException if sign-in fails
	 */
	String signIn(String apiToken, String username);

	/**
	 * Submit a check. The platform runs it asynchronously.
	 * @param accessToken token returned by {@link #signIn(String, String)}
	 * @param request the check to run
	 * @return link to poll for the result
	 * @throws ContentCheckException if the submission fails
	 */
	String submitCheck(String accessToken, CheckRequest request);

	/**
	 * Poll a submitted check until it has finished. Only reads, so it can be repeated
	 * without submitting the document again.
	 * @param accessToken token returned by {@link #signIn(String, String)}
	 * @param resultLink link returned by {@link #submitCheck(String, CheckRequest)}
	 * @param signal cancellation signal observed between polls
	 * @return the finished check
	 * @throws ContentCheckException if polling fails, or with
	 * {@link ErrorKind#CHECK_EXPIRED} if the check does not finish in time
	 */
	CheckResult pollResult(String accessToken, String resultLink, CancellationSignal signal);

}
