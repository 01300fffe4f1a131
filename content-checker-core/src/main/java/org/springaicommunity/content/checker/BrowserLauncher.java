package org.springaicommunity.content.checker;

/**
 * Opens report links for the user.
 */
@FunctionalInterface
public interface BrowserLauncher {

	/**
	 * Open the link. Implementations ignore anything that is not an {@code https://} URL.
	 * @param url link to open
	 */
	void open(String url);

	/**
	 * Whether the link is acceptable to hand to a browser.
	 * @param url candidate link
	 * @return true for non-blank https links
	 */
	static boolean isOpenable(String url) {
		return !url.isBlank() && url.startsWith("https://");
	}

}
