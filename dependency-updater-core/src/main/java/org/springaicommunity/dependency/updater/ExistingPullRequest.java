package org.springaicommunity.dependency.updater;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The open pull request currently representing a dependency group, as known to the
 * {@link ServiceGateway}. Read-only to the updater.
 *
 * @param dependencyGroupName the group the pull request was created for
 * @param dependencies the (name, version) pairs the pull request claims
 */
public record ExistingPullRequest(String dependencyGroupName, List<PullRequestDependency> dependencies) {

	public ExistingPullRequest {
		dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
	}

	/**
	 * Distinct dependency names claimed by the pull request, in order of appearance.
	 */
	public Set<String> dependencyNames() {
		Set<String> names = new LinkedHashSet<>();
		for (PullRequestDependency dependency : dependencies) {
			names.add(dependency.dependencyName());
		}
		return names;
	}

}
