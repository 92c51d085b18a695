package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Job-scoped view of a project's dependencies.
 *
 * <p>
 * Holds the files and dependencies of every directory the job covers, the configured
 * dependency groups, a current-directory cursor used while iterating multi-directory
 * projects, and the set of dependency names already claimed ("handled") during this run.
 * The handled set only grows; names are compared by exact equality.
 *
 * <p>
 * A snapshot is built once at the start of a job and discarded at its end. It is not
 * thread-safe and must not be shared between concurrent refreshes.
 */
public class DependencySnapshot {

	private static final Logger logger = LoggerFactory.getLogger(DependencySnapshot.class);

	private final JobDefinition job;

	private final Map<String, DirectoryContents> directories;

	private final Map<String, DependencyGroup> groups = new LinkedHashMap<>();

	private final Set<String> handledDependencies = new LinkedHashSet<>();

	private String currentDirectory;

	public DependencySnapshot(JobDefinition job, Map<String, DirectoryContents> directories) {
		if (directories.isEmpty()) {
			throw new IllegalArgumentException("A snapshot needs at least one directory");
		}
		this.job = job;
		this.directories = Collections.unmodifiableMap(new LinkedHashMap<>(directories));
		for (DependencyGroup group : job.dependencyGroups()) {
			this.groups.putIfAbsent(group.name(), group);
		}
		this.currentDirectory = this.directories.keySet().iterator().next();
	}

	/**
	 * Build a snapshot by fetching and parsing every directory of the job, in configured
	 * order.
	 * @param job the job configuration
	 * @param fileFetcher fetches each directory's files
	 * @param parser parses each directory's files
	 * @return the snapshot
	 */
	public static DependencySnapshot create(JobDefinition job, FileFetcher fileFetcher, DependencyParser parser) {
		Map<String, DirectoryContents> contents = new LinkedHashMap<>();
		for (String directory : job.directoriesToProcess()) {
			FetchedFiles fetched = fileFetcher.fetch(directory);
			List<Dependency> dependencies = parser.parse(fetched.files());
			logger.info("Parsed {} dependencies from {} files in {} at {}", dependencies.size(), fetched.files().size(),
					directory, fetched.baseCommitSha());
			contents.put(directory, new DirectoryContents(fetched.files(), dependencies, fetched.baseCommitSha()));
		}
		return new DependencySnapshot(job, contents);
	}

	public JobDefinition job() {
		return job;
	}

	/**
	 * Configured groups, in configuration order.
	 */
	public List<DependencyGroup> groups() {
		return List.copyOf(groups.values());
	}

	public Optional<DependencyGroup> findGroup(String name) {
		return Optional.ofNullable(groups.get(name));
	}

	/**
	 * The group the job asks to refresh, empty if the job names no group or a group that
	 * is no longer configured.
	 */
	public Optional<DependencyGroup> jobGroup() {
		String name = job.dependencyGroupToRefresh();
		return name == null ? Optional.empty() : findGroup(name);
	}

	/**
	 * Mark dependency names as claimed for this run. Adding a name twice has no effect.
	 */
	public void addHandledDependencies(Collection<String> dependencyNames) {
		for (String name : dependencyNames) {
			if (handledDependencies.add(name)) {
				logger.debug("Dependency '{}' is now handled", name);
			}
		}
	}

	public boolean isHandled(String dependencyName) {
		return handledDependencies.contains(dependencyName);
	}

	public Set<String> handledDependencies() {
		return Collections.unmodifiableSet(handledDependencies);
	}

	/**
	 * Directories of the snapshot, in configured order.
	 */
	public List<String> directories() {
		return List.copyOf(directories.keySet());
	}

	public String currentDirectory() {
		return currentDirectory;
	}

	public void setCurrentDirectory(String directory) {
		if (!directories.containsKey(directory)) {
			throw new IllegalArgumentException("Unknown directory '" + directory + "', expected one of "
					+ directories.keySet());
		}
		this.currentDirectory = directory;
	}

	/**
	 * Dependencies of the current directory.
	 */
	public List<Dependency> dependencies() {
		return directories.get(currentDirectory).dependencies();
	}

	/**
	 * Dependencies of the current directory the job is allowed to update.
	 */
	public List<Dependency> allowedDependencies() {
		return dependencies().stream().filter(job.allowedUpdates()::permits).toList();
	}

	/**
	 * Files of the current directory.
	 */
	public List<DependencyFile> dependencyFiles() {
		return directories.get(currentDirectory).files();
	}

	/**
	 * Commit the current directory's files were fetched at.
	 */
	public String baseCommitSha() {
		return baseCommitSha(currentDirectory);
	}

	public String baseCommitSha(String directory) {
		DirectoryContents contents = directories.get(directory);
		if (contents == null) {
			throw new IllegalArgumentException("Unknown directory '" + directory + "'");
		}
		return contents.baseCommitSha();
	}

	/**
	 * Allowed dependencies of any directory that belong to the group, one per name, whether
	 * or not they are handled or updatable.
	 */
	public List<Dependency> eligibleMembers(DependencyGroup group) {
		Map<String, Dependency> members = new LinkedHashMap<>();
		for (DirectoryContents contents : directories.values()) {
			for (Dependency dependency : contents.dependencies()) {
				if (job.allowedUpdates().permits(dependency) && group.contains(dependency)) {
					members.putIfAbsent(dependency.name(), dependency);
				}
			}
		}
		return new ArrayList<>(members.values());
	}

	/**
	 * Fetched and parsed state of one directory.
	 *
	 * @param files the dependency files
	 * @param dependencies the parsed dependencies
	 * @param baseCommitSha the commit the files were fetched at
	 */
	public record DirectoryContents(List<DependencyFile> files, List<Dependency> dependencies, String baseCommitSha) {

		public DirectoryContents {
			files = List.copyOf(files);
			dependencies = List.copyOf(dependencies);
		}

	}

}
