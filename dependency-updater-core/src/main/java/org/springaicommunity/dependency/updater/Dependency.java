package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A dependency of the project, either as parsed from the manifests or as proposed by an
 * {@link UpdateChecker}.
 *
 * <p>
 * For comparison purposes a dependency is identified by its name and, where relevant, its
 * target {@link #version()}.
 *
 * @param name the package name
 * @param version the current version, or the target version for an updated dependency
 * @param previousVersion the version before the update (null for parsed dependencies)
 * @param requirements the declared requirements
 * @param previousRequirements the requirements before the update (null for parsed
 * dependencies)
 * @param topLevel whether the dependency is declared directly rather than pulled in
 * transitively
 */
public record Dependency(String name, @Nullable String version, @Nullable String previousVersion,
		List<DependencyRequirement> requirements, @Nullable List<DependencyRequirement> previousRequirements,
		boolean topLevel) {

	public Dependency {
		Objects.requireNonNull(name, "name");
		requirements = requirements == null ? List.of() : List.copyOf(requirements);
		previousRequirements = previousRequirements == null ? null : List.copyOf(previousRequirements);
	}

	/**
	 * Convenience constructor for a parsed, top-level dependency.
	 */
	public Dependency(String name, @Nullable String version, List<DependencyRequirement> requirements) {
		this(name, version, null, requirements, null, true);
	}

	/**
	 * Create the updated form of this dependency.
	 * @param targetVersion the version being updated to
	 * @param updatedRequirements the requirements after the update
	 * @return a dependency carrying this one's version and requirements as "previous"
	 */
	public Dependency updatedTo(String targetVersion, List<DependencyRequirement> updatedRequirements) {
		return new Dependency(name, targetVersion, version, updatedRequirements, requirements, topLevel);
	}

	/**
	 * Whether the dependency appears in any requirement group whose name suggests a
	 * development-only dependency.
	 */
	@JsonIgnore
	public boolean isDevelopmentOnly() {
		if (requirements.isEmpty()) {
			return false;
		}
		return requirements.stream()
			.allMatch(r -> !r.groups().isEmpty() && r.groups().stream().allMatch(Dependency::isDevelopmentGroup));
	}

	/**
	 * Whether applying this update leaves the version unchanged.
	 */
	@JsonIgnore
	public boolean isVersionUnchanged() {
		return previousVersion != null && previousVersion.equals(version);
	}

	private static boolean isDevelopmentGroup(String group) {
		String normalized = group.toLowerCase();
		return normalized.startsWith("dev") || normalized.equals("test") || normalized.endsWith("-dev");
	}

}
