package org.springaicommunity.content.checker;

/**
 * How a check is reported on the platform.
 *
 * <p>
 * {@link #BATCH} checks share a batch id and contribute to a content analysis dashboard;
 * {@link #AUTOMATED} checks stand on their own and only produce a scorecard.
 */
public enum CheckMode {

	AUTOMATED("automated"),

	BATCH("batch");

	private final String wireValue;

	CheckMode(String wireValue) {
		this.wireValue = wireValue;
	}

	/**
	 * Returns the value the platform expects in {@code checkOptions.checkType}.
	 * @return wire value
	 */
	public String wireValue() {
		return wireValue;
	}

}
