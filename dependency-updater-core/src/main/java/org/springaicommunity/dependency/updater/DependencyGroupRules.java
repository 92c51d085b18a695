package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Membership rules of a {@link DependencyGroup}.
 *
 * <p>
 * A dependency is a member when its name matches at least one of {@code patterns} (an
 * empty list matches every name), matches none of {@code excludePatterns}, and, when
 * {@code dependencyType} is set, is of that type. Patterns are globs where {@code *}
 * matches any run of characters; matching is case-insensitive.
 *
 * @param patterns name patterns to include
 * @param excludePatterns name patterns to exclude
 * @param dependencyType "production" or "development", null for both
 */
public record DependencyGroupRules(List<String> patterns, List<String> excludePatterns,
		@Nullable String dependencyType) {

	public static final String PRODUCTION = "production";

	public static final String DEVELOPMENT = "development";

	public DependencyGroupRules {
		patterns = patterns == null ? List.of() : List.copyOf(patterns);
		excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
		if (dependencyType != null && !PRODUCTION.equals(dependencyType) && !DEVELOPMENT.equals(dependencyType)) {
			throw new IllegalArgumentException(
					"Invalid dependency-type '" + dependencyType + "': must be 'production' or 'development'");
		}
	}

	/**
	 * Rules matching every dependency.
	 */
	public static DependencyGroupRules matchAll() {
		return new DependencyGroupRules(List.of(), List.of(), null);
	}

	/**
	 * Rules matching the given name patterns.
	 */
	public static DependencyGroupRules patterns(String... patterns) {
		return new DependencyGroupRules(List.of(patterns), List.of(), null);
	}

	boolean matches(Dependency dependency) {
		String name = dependency.name();
		if (!patterns.isEmpty() && patterns.stream().noneMatch(p -> globMatches(p, name))) {
			return false;
		}
		if (excludePatterns.stream().anyMatch(p -> globMatches(p, name))) {
			return false;
		}
		if (dependencyType == null) {
			return true;
		}
		return DEVELOPMENT.equals(dependencyType) == dependency.isDevelopmentOnly();
	}

	static boolean globMatches(String glob, String name) {
		String regex = Arrays.stream(glob.split("\\*", -1)).map(Pattern::quote).collect(Collectors.joining(".*"));
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(name).matches();
	}

}
