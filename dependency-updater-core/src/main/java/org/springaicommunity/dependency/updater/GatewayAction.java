package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A pull request action sent to a {@link ServiceGateway}.
 *
 * @param type "create_pull_request", "update_pull_request" or "close_pull_request"
 * @param dependencyGroupName the group of the pull request, null for closes
 * @param dependencies the (name, version) pairs of the pull request
 * @param updatedDependencyFiles the files of the pull request, empty for closes
 * @param baseCommitSha the commit the change was computed against, null for closes
 * @param reason why the pull request is closed, null otherwise
 */
public record GatewayAction(String type, @Nullable String dependencyGroupName,
		List<PullRequestDependency> dependencies, List<DependencyFile> updatedDependencyFiles,
		@Nullable String baseCommitSha, @Nullable ClosureReason reason) {

	public static final String CREATE = "create_pull_request";

	public static final String UPDATE = "update_pull_request";

	public static final String CLOSE = "close_pull_request";

	public GatewayAction {
		dependencies = List.copyOf(dependencies);
		updatedDependencyFiles = List.copyOf(updatedDependencyFiles);
	}

	static GatewayAction forChange(String type, DependencyChange change, String baseCommitSha) {
		List<PullRequestDependency> dependencies = change.updatedDependencies()
			.stream()
			.map(d -> new PullRequestDependency(d.name(), d.version(), null))
			.toList();
		String groupName = change.dependencyGroup() != null ? change.dependencyGroup().name() : null;
		return new GatewayAction(type, groupName, dependencies, change.updatedDependencyFiles(), baseCommitSha, null);
	}

	static GatewayAction forClose(List<String> dependencyNames, ClosureReason reason) {
		List<PullRequestDependency> dependencies = dependencyNames.stream()
			.map(name -> new PullRequestDependency(name, null, null))
			.toList();
		return new GatewayAction(CLOSE, null, dependencies, List.of(), null, reason);
	}

}
