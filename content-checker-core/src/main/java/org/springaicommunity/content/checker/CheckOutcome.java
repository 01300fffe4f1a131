package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Outcome of checking one file. Exactly one outcome exists per dispatched file.
 *
 * @param filePath the checked file
 * @param resultLink report link for a successful check, null on failure
 * @param succeeded whether the check produced a link
 */
public record CheckOutcome(String filePath, @Nullable String resultLink, boolean succeeded) {

	public CheckOutcome {
		if (succeeded && (resultLink == null || resultLink.isBlank())) {
			throw new IllegalArgumentException("A successful outcome needs a result link: " + filePath);
		}
		if (!succeeded && resultLink != null) {
			throw new IllegalArgumentException("A failed outcome cannot carry a result link: " + filePath);
		}
	}

	public static CheckOutcome success(String filePath, String resultLink) {
		return new CheckOutcome(filePath, resultLink, true);
	}

	public static CheckOutcome failure(String filePath) {
		return new CheckOutcome(filePath, null, false);
	}

	/**
	 * Creates an outcome from an optional link; an absent or blank link is a failure.
	 * @param filePath the checked file
	 * @param resultLink link returned by the check invoker
	 * @return outcome
	 */
	public static CheckOutcome of(String filePath, Optional<String> resultLink) {
		return resultLink.filter(link -> !link.isBlank())
			.map(link -> success(filePath, link))
			.orElseGet(() -> failure(filePath));
	}

	public Optional<String> link() {
		return Optional.ofNullable(resultLink);
	}

}
