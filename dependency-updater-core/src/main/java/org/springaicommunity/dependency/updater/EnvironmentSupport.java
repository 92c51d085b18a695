package org.springaicommunity.dependency.updater;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration variables from the system environment or a {@code .env} file.
 * Each {@code .env} file is loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable, which {@link Dotenv#get(String)} consults before its
 * own entries</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Dotenv WORKING_DIRECTORY_DOTENV = Dotenv.configure()
		.ignoreIfMissing()
		.ignoreIfMalformed()
		.load();

	@Nullable
	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	@Nullable
	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value. Blank values count as unset.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIRECTORY_DOTENV.get(name);
		if (isBlank(value) && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return isBlank(value) ? null : value;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
