package org.springaicommunity.content.checker;

import java.util.List;

/**
 * Thrown when the configuration is invalid. Fatal for the whole run; raised before any
 * file is dispatched.
 */
public class ConfigurationException extends RuntimeException {

	private final List<String> validationErrors;

	public ConfigurationException(List<String> validationErrors) {
		super(buildMessage(validationErrors));
		this.validationErrors = List.copyOf(validationErrors);
	}

	public List<String> getValidationErrors() {
		return validationErrors;
	}

	private static String buildMessage(List<String> errors) {
		StringBuilder message = new StringBuilder("Configuration validation failed:");
		for (String error : errors) {
			message.append("\n  - ").append(error);
		}
		return message.toString();
	}

}
