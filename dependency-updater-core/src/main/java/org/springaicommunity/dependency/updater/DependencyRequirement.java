package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A single declared requirement of a dependency, as reported by the ecosystem parser.
 *
 * @param file the manifest file declaring the requirement (e.g. "package.json")
 * @param requirement the declared constraint (e.g. "^1.2.0"), null when the manifest only
 * pins through a lockfile
 * @param groups manifest sections the requirement appears in (e.g. "dependencies",
 * "devDependencies")
 */
public record DependencyRequirement(String file, @Nullable String requirement, List<String> groups) {

	public DependencyRequirement {
		groups = groups == null ? List.of() : List.copyOf(groups);
	}

}
