package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A self-contained description of an update job, read from a JSON file: the job
 * configuration, the state of every project directory together with the scripted answers
 * of the ecosystem collaborators, and the group pull requests currently open.
 *
 * <pre>
 * {
 *   "job": { "dependency-group-to-refresh": "npm", "dependencies": ["react"], ... },
 *   "directories": {
 *     "/": {
 *       "base-commit-sha": "1a2b3c",
 *       "files": [ { "name": "package.json", "content": "..." } ],
 *       "dependencies": [ { "name": "react", "version": "18.2.0", "latest-version": "18.3.1" } ]
 *     }
 *   },
 *   "existing-group-pull-requests": [
 *     { "dependency-group-name": "npm", "dependencies": [ { "dependency-name": "react", "dependency-version": "18.3.1" } ] }
 *   ]
 * }
 * </pre>
 *
 * @param job the job configuration
 * @param directories state of each directory, keyed by directory
 * @param existingGroupPullRequests group pull requests open before the job runs
 */
public record JobDocument(JobDefinition job, Map<String, DirectoryFixture> directories,
		List<ExistingPullRequest> existingGroupPullRequests) {

	public JobDocument {
		directories = directories == null ? Map.of() : new LinkedHashMap<>(directories);
		existingGroupPullRequests = existingGroupPullRequests == null ? List.of()
				: List.copyOf(existingGroupPullRequests);
	}

	/**
	 * Fetched and scripted state of one directory.
	 *
	 * @param baseCommitSha the commit the files are read at
	 * @param files the dependency files
	 * @param dependencies the dependencies declared by the files, with their scripted
	 * update answers
	 */
	public record DirectoryFixture(@Nullable String baseCommitSha, List<FileFixture> files,
			List<DependencyFixture> dependencies) {

		public DirectoryFixture {
			files = files == null ? List.of() : List.copyOf(files);
			dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
		}

	}

	/**
	 * A file of a directory.
	 *
	 * @param name the file path within the directory
	 * @param content the file content
	 */
	public record FileFixture(String name, String content) {
	}

	/**
	 * A dependency and the answers its update checker gives.
	 *
	 * @param name the dependency name
	 * @param version the current version
	 * @param topLevel whether the dependency is declared directly (default true)
	 * @param requirements the declared requirements
	 * @param latestVersion the version an update moves to, null if the dependency is up to
	 * date
	 * @param requirementsToUnlock the least level at which the update is achievable
	 * (default none)
	 * @param requirementsLocked whether the declared requirements must not be loosened
	 * @param error when set, the checker fails with this message
	 */
	public record DependencyFixture(String name, @Nullable String version, @Nullable Boolean topLevel,
			List<DependencyRequirement> requirements, @Nullable String latestVersion,
			@Nullable RequirementsUnlock requirementsToUnlock, boolean requirementsLocked, @Nullable String error) {

		public DependencyFixture {
			requirements = requirements == null ? List.of() : List.copyOf(requirements);
		}

		public Dependency toDependency() {
			return new Dependency(name, version, null, requirements, null, topLevel == null || topLevel);
		}

	}

}
