package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Loads {@link CheckerConfiguration} from environment variables and validates it.
 *
 * <p>
 * Variables are resolved through {@link EnvironmentSupport} unless another lookup is
 * given. Loading never throws: problems are collected in
 * {@link CheckerConfiguration#validationErrors()} so that all of them can be reported
 * at once.
 */
public class ConfigurationLoader {

	private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

	public static final String URL_VARIABLE = "ACROLINX_URL";

	public static final String TOKEN_VARIABLE = "ACROLINX_SSO_TOKEN";

	public static final String USERNAME_VARIABLE = "ACROLINX_USERNAME";

	public static final String SIGNATURE_VARIABLE = "ACROLINX_CLIENT_SIGNATURE";

	public static final String CONTENT_DIR_VARIABLE = "ACROLINX_CONTENT_DIR";

	private static final List<String> PROVISIONED_PLACEHOLDERS = List.of("ACROLINX-SECURELY-PROVISIONED",
			"ACROLINX-PROVISIONED");

	private static final String USERNAME_PLACEHOLDER = "myacrolinx-username";

	private final Function<String, @Nullable String> environment;

	public ConfigurationLoader() {
		this(EnvironmentSupport::get);
	}

	/**
	 * Create a loader reading variables from the given lookup.
	 * @param environment variable lookup returning null for unset variables
	 */
	public ConfigurationLoader(Function<String, @Nullable String> environment) {
		this.environment = environment;
	}

	public CheckerConfiguration load() {
		return load(null);
	}

	/**
	 * Load and validate the configuration.
	 * @param contentDirectoryOverride directory to use instead of
	 * {@value #CONTENT_DIR_VARIABLE}, or null
	 * @return configuration, possibly carrying validation errors
	 */
	public CheckerConfiguration load(@Nullable Path contentDirectoryOverride) {
		List<String> errors = new ArrayList<>();

		String remoteUrl = required(URL_VARIABLE, "Acrolinx URL", errors);
		String apiToken = required(TOKEN_VARIABLE, "SSO token", errors);
		String username = required(USERNAME_VARIABLE, "username", errors);
		String clientSignature = required(SIGNATURE_VARIABLE, "client signature", errors);

		Path contentDirectory = contentDirectoryOverride;
		if (contentDirectory == null) {
			String dir = required(CONTENT_DIR_VARIABLE, "content directory", errors);
			contentDirectory = dir != null ? Path.of(dir) : null;
		}

		validate(remoteUrl, apiToken, username, clientSignature, contentDirectory, errors);

		CheckerConfiguration configuration = new CheckerConfiguration(remoteUrl, apiToken, username, clientSignature,
				contentDirectory, errors);
		if (configuration.isValid()) {
			logger.debug("Configuration loaded: {}", configuration);
		}
		else {
			logger.error("Configuration validation failed with {} errors", errors.size());
		}
		return configuration;
	}

	private @Nullable String required(String variable, String displayName, List<String> errors) {
		String value = environment.apply(variable);
		if (value == null || value.isBlank()) {
			errors.add("Missing required environment variable: " + variable + " (" + displayName + ")");
			return null;
		}
		return value.trim();
	}

	static void validate(@Nullable String remoteUrl, @Nullable String apiToken, @Nullable String username,
			@Nullable String clientSignature, @Nullable Path contentDirectory, List<String> errors) {
		if (contentDirectory != null && !Files.isDirectory(contentDirectory)) {
			errors.add("Content directory does not exist: " + contentDirectory);
		}

		if (remoteUrl != null) {
			if (remoteUrl.contains("{") && remoteUrl.contains("}")) {
				errors.add("Acrolinx URL contains template placeholder: " + remoteUrl
						+ ". Please replace with actual URL.");
			}
			else if (!isAbsoluteHttpUrl(remoteUrl)) {
				errors.add("Invalid URL format: " + remoteUrl);
			}
		}

		if (apiToken != null && containsProvisionedPlaceholder(apiToken)) {
			errors.add("SSO Token contains placeholder value. Please replace with actual token.");
		}
		if (clientSignature != null && containsProvisionedPlaceholder(clientSignature)) {
			errors.add("Client Signature contains placeholder value. Please replace with actual signature.");
		}
		if (username != null && username.contains(USERNAME_PLACEHOLDER)) {
			errors.add("Username contains placeholder value: " + username + ". Please replace with actual username.");
		}
	}

	private static boolean containsProvisionedPlaceholder(String value) {
		return PROVISIONED_PLACEHOLDERS.stream().anyMatch(value::contains);
	}

	private static boolean isAbsoluteHttpUrl(String value) {
		try {
			URI uri = new URI(value);
			String scheme = uri.getScheme();
			return uri.isAbsolute() && uri.getHost() != null
					&& ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
		}
		catch (URISyntaxException e) {
			return false;
		}
	}

}
