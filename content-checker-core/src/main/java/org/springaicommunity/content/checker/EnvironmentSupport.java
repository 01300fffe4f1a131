package org.springaicommunity.content.checker;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration variables from {@code .env} files and the process environment.
 * Both files are read once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable, then {@code .env} in the working directory (dotenv's
 * own precedence)</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

}
