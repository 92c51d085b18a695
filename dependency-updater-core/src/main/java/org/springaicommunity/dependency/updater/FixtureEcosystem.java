package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ecosystem collaborators answering from a {@link JobDocument} instead of a real package
 * registry.
 *
 * <p>
 * Files and dependencies come from the document's directories. Each dependency's checker
 * reports the scripted latest version and unlock level; the file updater rewrites the
 * previous version to the new one on every line mentioning the dependency. Useful for
 * replaying a job offline and for exercising the refresh end to end.
 */
public class FixtureEcosystem implements FileFetcher, DependencyParser, UpdateCheckerFactory, FileUpdater {

	private static final Logger logger = LoggerFactory.getLogger(FixtureEcosystem.class);

	private static final String DEFAULT_BASE_COMMIT_SHA = "0000000000000000000000000000000000000000";

	private final Map<String, JobDocument.DirectoryFixture> directories;

	public FixtureEcosystem(JobDocument document) {
		this.directories = document.directories();
	}

	@Override
	public FetchedFiles fetch(String directory) {
		JobDocument.DirectoryFixture fixture = directoryFixture(directory);
		List<DependencyFile> files = fixture.files()
			.stream()
			.map(file -> new DependencyFile(directory, file.name(), file.content()))
			.toList();
		String sha = fixture.baseCommitSha() != null ? fixture.baseCommitSha() : DEFAULT_BASE_COMMIT_SHA;
		logger.debug("Fetched {} files from {} at {}", files.size(), directory, sha);
		return new FetchedFiles(files, sha);
	}

	@Override
	public List<Dependency> parse(List<DependencyFile> files) {
		if (files.isEmpty()) {
			return List.of();
		}
		return directoryFixture(files.get(0).directory()).dependencies()
			.stream()
			.map(JobDocument.DependencyFixture::toDependency)
			.toList();
	}

	@Override
	public UpdateChecker forDependency(Dependency dependency, List<DependencyFile> dependencyFiles) {
		if (dependencyFiles.isEmpty()) {
			throw new IllegalStateException("No dependency files to check " + dependency.name() + " against");
		}
		String directory = dependencyFiles.get(0).directory();
		JobDocument.DependencyFixture fixture = findDependencyFixture(directory, dependency.name())
			.orElseThrow(() -> new IllegalStateException(
					"Dependency " + dependency.name() + " is not described in directory " + directory));
		return new FixtureUpdateChecker(dependency, fixture);
	}

	@Override
	public List<DependencyFile> updatedDependencyFiles(List<Dependency> dependencies,
			List<DependencyFile> dependencyFiles) {
		List<DependencyFile> updated = new ArrayList<>();
		for (DependencyFile file : dependencyFiles) {
			String content = file.content();
			for (Dependency dependency : dependencies) {
				content = rewriteVersion(content, dependency);
			}
			if (!content.equals(file.content())) {
				updated.add(file.withContent(content));
			}
		}
		return updated;
	}

	private static String rewriteVersion(String content, Dependency dependency) {
		String previousVersion = dependency.previousVersion();
		String version = dependency.version();
		if (previousVersion == null || version == null || previousVersion.equals(version)) {
			return content;
		}
		String[] lines = content.split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (lines[i].contains(dependency.name())) {
				lines[i] = lines[i].replace(previousVersion, version);
			}
		}
		return String.join("\n", lines);
	}

	private JobDocument.DirectoryFixture directoryFixture(String directory) {
		JobDocument.DirectoryFixture fixture = directories.get(directory);
		if (fixture == null) {
			throw new IllegalStateException("Directory " + directory + " is not described by the job document");
		}
		return fixture;
	}

	private Optional<JobDocument.DependencyFixture> findDependencyFixture(String directory, String name) {
		return directoryFixture(directory).dependencies().stream().filter(d -> d.name().equals(name)).findFirst();
	}

	/**
	 * Checker replaying the scripted answers of one dependency.
	 */
	static class FixtureUpdateChecker implements UpdateChecker {

		private final Dependency dependency;

		private final JobDocument.DependencyFixture fixture;

		FixtureUpdateChecker(Dependency dependency, JobDocument.DependencyFixture fixture) {
			this.dependency = dependency;
			this.fixture = fixture;
		}

		@Override
		public boolean isUpToDate() {
			failIfScripted();
			return fixture.latestVersion() == null || fixture.latestVersion().equals(dependency.version());
		}

		@Override
		public boolean requirementsUnlockedOrCanBe() {
			return !fixture.requirementsLocked();
		}

		@Override
		public boolean canUpdate(RequirementsUnlock requirementsToUnlock) {
			failIfScripted();
			RequirementsUnlock required = fixture.requirementsToUnlock() != null ? fixture.requirementsToUnlock()
					: RequirementsUnlock.NONE;
			if (isUpToDate() || required == RequirementsUnlock.UPDATE_NOT_POSSIBLE
					|| requirementsToUnlock == RequirementsUnlock.UPDATE_NOT_POSSIBLE) {
				return false;
			}
			return requirementsToUnlock.ordinal() >= required.ordinal();
		}

		@Override
		public List<Dependency> updatedDependencies(RequirementsUnlock requirementsToUnlock) {
			if (!canUpdate(requirementsToUnlock)) {
				return List.of();
			}
			String latestVersion = fixture.latestVersion();
			String currentVersion = dependency.version();
			List<DependencyRequirement> requirements = dependency.requirements().stream().map(requirement -> {
				if (requirementsToUnlock == RequirementsUnlock.NONE || requirement.requirement() == null
						|| currentVersion == null) {
					return requirement;
				}
				return new DependencyRequirement(requirement.file(),
						requirement.requirement().replace(currentVersion, latestVersion), requirement.groups());
			}).toList();
			return List.of(dependency.updatedTo(latestVersion, requirements));
		}

		private void failIfScripted() {
			if (fixture.error() != null) {
				throw new IllegalStateException(
						"Update check failed for " + dependency.name() + ": " + fixture.error());
			}
		}

	}

}
