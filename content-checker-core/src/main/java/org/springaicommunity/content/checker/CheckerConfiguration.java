package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Connection settings and content location, loaded once at startup and read-only
 * afterwards.
 *
 * @param remoteUrl platform base URL
 * @param apiToken SSO token used to sign in
 * @param username platform user name
 * @param clientSignature client signature sent with every request
 * @param contentDirectory directory holding the content files
 * @param validationErrors problems found while loading, empty when valid
 */
public record CheckerConfiguration(@Nullable String remoteUrl, @Nullable String apiToken, @Nullable String username,
		@Nullable String clientSignature, @Nullable Path contentDirectory, List<String> validationErrors) {

	public CheckerConfiguration {
		validationErrors = List.copyOf(validationErrors);
	}

	public boolean isValid() {
		return validationErrors.isEmpty();
	}

	/**
	 * Returns this configuration if it is valid.
	 * @return this configuration
	 * @throws ConfigurationException listing every validation error
	 */
	public CheckerConfiguration validateOrThrow() {
		if (!isValid()) {
			throw new ConfigurationException(validationErrors);
		}
		return this;
	}

	@Override
	public String toString() {
		return "CheckerConfiguration{" + "remoteUrl='" + remoteUrl + '\'' + ", apiToken=" + mask(apiToken)
				+ ", username='" + username + '\'' + ", clientSignature=" + mask(clientSignature)
				+ ", contentDirectory=" + contentDirectory + ", validationErrors=" + validationErrors + '}';
	}

	private static String mask(@Nullable String secret) {
		return secret == null ? "null" : "****";
	}

}
