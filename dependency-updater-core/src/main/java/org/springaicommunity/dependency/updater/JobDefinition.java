package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration of a single update job. Read-only for the duration of the job.
 *
 * @param repository the repository being updated, in "owner/repo" format
 * @param dependencies names of the dependencies carried by the pull request being
 * refreshed
 * @param dependencyGroupToRefresh name of the group whose pull request is refreshed
 * @param dependencyGroups every group configured for the project, in configuration order
 * @param directory the project directory when the job covers a single directory
 * @param directories the project directories when the job spans several, null otherwise
 * @param securityUpdatesOnly whether the job only performs security updates
 * @param updatingAPullRequest whether the job was started to refresh an existing pull
 * request
 * @param allowedUpdates which dependencies the job may update
 * @param experiments feature-experiment flags, keyed by experiment name
 */
public record JobDefinition(@Nullable String repository, List<String> dependencies,
		@Nullable String dependencyGroupToRefresh, List<DependencyGroup> dependencyGroups, String directory,
		@Nullable List<String> directories, boolean securityUpdatesOnly,
		@JsonProperty("updating-a-pull-request") boolean updatingAPullRequest,
		AllowedUpdates allowedUpdates, Map<String, Boolean> experiments) {

	public static final String DEFAULT_DIRECTORY = "/";

	public JobDefinition {
		dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
		dependencyGroups = dependencyGroups == null ? List.of() : List.copyOf(dependencyGroups);
		directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
		directories = directories == null ? null : List.copyOf(directories);
		allowedUpdates = allowedUpdates == null ? AllowedUpdates.DIRECT : allowedUpdates;
		experiments = experiments == null ? Map.of() : Map.copyOf(experiments);
	}

	/**
	 * Job refreshing the pull request of one group in a single directory.
	 */
	public static JobDefinition forGroupRefresh(String groupName, List<String> dependencies,
			List<DependencyGroup> groups) {
		return new JobDefinition(null, dependencies, groupName, groups, DEFAULT_DIRECTORY, null, false, true,
				AllowedUpdates.DIRECT, Map.of());
	}

	/**
	 * Copy of this job spanning the given directories.
	 */
	public JobDefinition withDirectories(List<String> newDirectories) {
		return new JobDefinition(repository, dependencies, dependencyGroupToRefresh, dependencyGroups, directory,
				newDirectories, securityUpdatesOnly, updatingAPullRequest, allowedUpdates, experiments);
	}

	/**
	 * Copy of this job refreshing the pull request of another group.
	 */
	public JobDefinition withDependencyGroupToRefresh(String groupName) {
		return new JobDefinition(repository, dependencies, groupName, dependencyGroups, directory, directories,
				securityUpdatesOnly, updatingAPullRequest, allowedUpdates, experiments);
	}

	/**
	 * Directories to process, in configured order. A job without a directory list has a
	 * single implicit directory.
	 */
	@JsonIgnore
	public List<String> directoriesToProcess() {
		if (directories == null || directories.isEmpty()) {
			return List.of(directory);
		}
		return directories;
	}

	@JsonIgnore
	public boolean isMultiDirectory() {
		return directories != null && directories.size() > 1;
	}

	/**
	 * Find a configured group by name.
	 */
	public Optional<DependencyGroup> findGroup(@Nullable String name) {
		if (name == null) {
			return Optional.empty();
		}
		return dependencyGroups.stream().filter(group -> group.name().equals(name)).findFirst();
	}

	public boolean isExperimentEnabled(String experiment) {
		return Boolean.TRUE.equals(experiments.get(experiment));
	}

}
