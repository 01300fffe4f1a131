package org.springaicommunity.content.checker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the content checking platform using the Java 11+ HttpClient.
 *
 * <p>
 * A check is submitted with one POST. Its result is polled separately from the link the
 * platform returns, so a failed poll can be retried without submitting the document again. Non-2xx responses and transport failures
 * are turned into {@link PlatformApiException} carrying the matching {@link ErrorKind}.
 */
public class PlatformHttpClient implements PlatformClient {

	private static final Logger logger = LoggerFactory.getLogger(PlatformHttpClient.class);

	static final String SIGN_IN_PATH = "/api/v1/auth/sign-ins";

	static final String CHECKS_PATH = "/api/v1/checking/checks";

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

	private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

	private static final Duration MAX_POLL_DURATION = Duration.ofMinutes(10);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final String clientSignature;

	private final Duration maxPollDuration;

	public PlatformHttpClient(String baseUrl, String clientSignature, ObjectMapper objectMapper) {
		this(HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), baseUrl, clientSignature, objectMapper, MAX_POLL_DURATION);
	}

	PlatformHttpClient(HttpClient httpClient, String baseUrl, String clientSignature, ObjectMapper objectMapper,
			Duration maxPollDuration) {
		this.httpClient = httpClient;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.clientSignature = clientSignature;
		this.objectMapper = objectMapper;
		this.maxPollDuration = maxPollDuration;
	}

	@Override
	public String signIn(String apiToken, String username) {
		logger.debug("POST {} for user {}", SIGN_IN_PATH, username);

		HttpRequest request = baseRequest(baseUrl + SIGN_IN_PATH).header("username", username)
			.header("password", apiToken)
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString("{}"))
			.build();

		JsonNode body = parse(executeRequest(request, SIGN_IN_PATH), SIGN_IN_PATH);
		String accessToken = body.path("data").path("accessToken").asText("");
		if (accessToken.isBlank()) {
			throw new PlatformApiException(ErrorKind.AUTHENTICATION, "Sign-in response contained no access token",
					SIGN_IN_PATH, 200);
		}
		return accessToken;
	}

	@Override
	public String submitCheck(String accessToken, CheckRequest checkRequest) {
		String body = serializeCheckRequest(checkRequest);
		logger.debug("POST {} for {} ({} bytes)", CHECKS_PATH, checkRequest.filePath(), body.length());

		HttpRequest request = baseRequest(baseUrl + CHECKS_PATH).header("X-Acrolinx-Auth", accessToken)
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		JsonNode submitted = parse(executeRequest(request, CHECKS_PATH), CHECKS_PATH);
		String resultLink = submitted.path("links").path("result").asText("");
		if (resultLink.isBlank()) {
			throw new PlatformApiException(ErrorKind.INVALID_RESPONSE, "Check submission returned no result link",
					CHECKS_PATH, 201);
		}
		logger.debug("Check for {} submitted, result at {}", checkRequest.filePath(), resultLink);
		return resultLink;
	}

	@Override
	public CheckResult pollResult(String accessToken, String resultLink, CancellationSignal signal) {
		long start = System.currentTimeMillis();
		Instant deadline = Instant.now().plus(maxPollDuration);

		while (true) {
			signal.throwIfCancelled("polling " + resultLink);

			HttpRequest request = baseRequest(resultLink).header("X-Acrolinx-Auth", accessToken).GET().build();
			JsonNode response = parse(executeRequest(request, resultLink), resultLink);

			JsonNode data = response.path("data");
			if (data.isObject() && data.has("quality")) {
				CheckResult result = toCheckResult(data, resultLink);
				logger.debug("Check {} finished after {}ms of polling", result.id(),
						System.currentTimeMillis() - start);
				return result;
			}

			if (!Instant.now().isBefore(deadline)) {
				throw new PlatformApiException(ErrorKind.CHECK_EXPIRED,
						"Check did not finish within " + maxPollDuration.toSeconds() + " seconds", resultLink, 200);
			}

			JsonNode progress = response.path("progress");
			Duration wait = DEFAULT_POLL_INTERVAL;
			if (progress.has("retryAfter")) {
				wait = Duration.ofSeconds(Math.max(1, progress.get("retryAfter").asLong()));
			}
			logger.debug("Check still running ({}%), polling again in {}ms", progress.path("percent").asInt(0),
					wait.toMillis());
			signal.await(wait);
		}
	}

	private CheckResult toCheckResult(JsonNode data, String endpoint) {
		String id = data.path("id").asText("");
		JsonNode quality = data.path("quality");
		Map<String, String> reports = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = data.path("reports").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> report = fields.next();
			String link = report.getValue().path("link").asText("");
			if (!link.isBlank()) {
				reports.put(report.getKey(), link);
			}
		}
		if (id.isBlank()) {
			throw new PlatformApiException(ErrorKind.INVALID_RESPONSE, "Check result contained no id", endpoint, 200);
		}
		String status = quality.hasNonNull("status") ? quality.get("status").asText() : null;
		return new CheckResult(id, quality.path("score").asDouble(0.0), status, reports);
	}

	String serializeCheckRequest(CheckRequest checkRequest) {
		ObjectNode root = objectMapper.createObjectNode();
		root.put("content", checkRequest.content());

		ObjectNode options = root.putObject("checkOptions");
		options.put("checkType", checkRequest.checkMode().wireValue());
		options.put("contentFormat", "AUTO");
		String batchId = checkRequest.effectiveBatchId();
		if (batchId != null) {
			options.put("batchId", batchId);
		}

		root.putObject("document").put("reference", checkRequest.filePath());

		try {
			return objectMapper.writeValueAsString(root);
		}
		catch (JsonProcessingException e) {
			throw new PlatformApiException(ErrorKind.UNKNOWN, "Could not serialize check request", CHECKS_PATH, -1, e);
		}
	}

	private HttpRequest.Builder baseRequest(String url) {
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(REQUEST_TIMEOUT)
			.header("Accept", "application/json")
			.header("X-Acrolinx-Client", clientSignature)
			.header("X-Acrolinx-Client-Locale", "en")
			.header("User-Agent", "content-checker");
	}

	private String executeRequest(HttpRequest request, String endpoint) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}

			ErrorKind kind = ErrorKind.fromStatusCode(statusCode);
			String message = switch (kind) {
				case RATE_LIMITED -> "Too Many Requests (429)";
				case AUTHENTICATION -> "Unauthorized (" + statusCode + "): check the SSO token, username and client signature";
				case SERVER_ERROR -> "Platform server error: " + statusCode;
				default -> "Platform API error: " + statusCode;
			};
			throw new PlatformApiException(kind, message, endpoint, statusCode);
		}
		catch (HttpTimeoutException e) {
			throw new PlatformApiException(ErrorKind.TIMEOUT, "Request timed out: " + e.getMessage(), endpoint, -1, e);
		}
		catch (IOException e) {
			logger.debug("HTTP request to {} failed: {}", endpoint, e.getMessage());
			throw new PlatformApiException(ErrorKind.CONNECTION, "HTTP request failed: " + e.getMessage(), endpoint,
					-1, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CheckCancelledException("HTTP request interrupted: " + endpoint);
		}
	}

	private JsonNode parse(String body, String endpoint) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new PlatformApiException(ErrorKind.INVALID_RESPONSE, "Malformed response body", endpoint, 200, e);
		}
	}

	/**
	 * Exception thrown when platform API calls fail.
	 *
	 * <p>
	 * Carries the HTTP status code (or -1 when no response was received) and the endpoint
	 * that was being accessed.
	 */
	public static class PlatformApiException extends ContentCheckException {

		private final int statusCode;

		private final String endpoint;

		public PlatformApiException(ErrorKind errorKind, String message, String endpoint, int statusCode) {
			this(errorKind, message, endpoint, statusCode, null);
		}

		public PlatformApiException(ErrorKind errorKind, String message, String endpoint, int statusCode,
				@Nullable Throwable cause) {
			super(errorKind, message, null, cause);
			this.statusCode = statusCode;
			this.endpoint = endpoint;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public String getEndpoint() {
			return endpoint;
		}

	}

}
