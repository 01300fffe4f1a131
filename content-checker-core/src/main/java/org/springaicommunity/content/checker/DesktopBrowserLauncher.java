package org.springaicommunity.content.checker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * {@link BrowserLauncher} backed by {@link Desktop#browse(URI)}. On headless machines the
 * link is only logged.
 */
public class DesktopBrowserLauncher implements BrowserLauncher {

	private static final Logger logger = LoggerFactory.getLogger(DesktopBrowserLauncher.class);

	@Override
	public void open(String url) {
		if (!BrowserLauncher.isOpenable(url)) {
			logger.warn("Invalid URL, not opening in browser: {}", url);
			return;
		}

		if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
				|| !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
			logger.info("No desktop browser available. Open manually: {}", url);
			return;
		}

		try {
			Desktop.getDesktop().browse(URI.create(url));
			logger.info("Opening {} in default browser...", url);
		}
		catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
			logger.error("Failed to open browser for {}: {}", url, e.getMessage());
		}
	}

}
