package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles the {@link DependencyChange} of one group for the snapshot's current directory.
 *
 * <p>
 * Every dependency of the directory that the job may update, that belongs to the group and
 * that is not already handled is checked. Up-to-date dependencies and dependencies that
 * cannot be updated are skipped; each remaining one is updated at the least invasive
 * {@link RequirementsUnlock} level and its files rewritten. Files are fed forward, so the
 * second dependency touching a manifest is applied on top of the first one's edit.
 *
 * <p>
 * Collaborator failures are not caught: they abort the compilation.
 */
public class DependencyChangeCompiler {

	private static final Logger logger = LoggerFactory.getLogger(DependencyChangeCompiler.class);

	private final UpdateCheckerFactory updateCheckerFactory;

	private final FileUpdater fileUpdater;

	public DependencyChangeCompiler(UpdateCheckerFactory updateCheckerFactory, FileUpdater fileUpdater) {
		this.updateCheckerFactory = updateCheckerFactory;
		this.fileUpdater = fileUpdater;
	}

	/**
	 * Compile the change of a group for the current directory of the snapshot.
	 * @param group the group to compile
	 * @param snapshot the job snapshot, positioned on the directory to compile
	 * @return the change, empty when nothing in the directory can be updated
	 */
	public DependencyChange compile(DependencyGroup group, DependencySnapshot snapshot) {
		String directory = snapshot.currentDirectory();
		List<Dependency> updatedDependencies = new ArrayList<>();
		Map<DependencyFile.Key, DependencyFile> workingFiles = new LinkedHashMap<>();
		for (DependencyFile file : snapshot.dependencyFiles()) {
			workingFiles.put(file.key(), file);
		}
		Map<DependencyFile.Key, DependencyFile> changedFiles = new LinkedHashMap<>();

		for (Dependency dependency : snapshot.allowedDependencies()) {
			if (!group.contains(dependency)) {
				continue;
			}
			if (snapshot.isHandled(dependency.name())) {
				logger.debug("Skipping {}: already handled in this run", dependency.name());
				continue;
			}

			List<DependencyFile> currentFiles = List.copyOf(workingFiles.values());
			UpdateChecker checker = updateCheckerFactory.forDependency(dependency, currentFiles);
			if (checker.isUpToDate()) {
				logger.debug("No update needed for {} {}", dependency.name(), dependency.version());
				continue;
			}

			RequirementsUnlock requirementsToUnlock = RequirementsUnlock.requiredFor(checker);
			if (requirementsToUnlock == RequirementsUnlock.UPDATE_NOT_POSSIBLE) {
				logger.info("No update possible for {} {}", dependency.name(), dependency.version());
				continue;
			}

			List<Dependency> updated = checker.updatedDependencies(requirementsToUnlock);
			if (updated.isEmpty() || updated.get(0).isVersionUnchanged()) {
				logger.info("No update possible for {} {} (version unchanged)", dependency.name(),
						dependency.version());
				continue;
			}

			logger.info("Updating {} from {} to {} in {} (requirements to unlock: {})", dependency.name(),
					dependency.version(), updated.get(0).version(), directory, requirementsToUnlock.value());
			List<DependencyFile> updatedFiles = fileUpdater.updatedDependencyFiles(updated, currentFiles);
			for (DependencyFile file : updatedFiles) {
				workingFiles.put(file.key(), file);
				changedFiles.put(file.key(), file);
			}
			for (Dependency updatedDependency : updated) {
				if (updatedDependencies.stream().noneMatch(d -> d.name().equals(updatedDependency.name()))) {
					updatedDependencies.add(updatedDependency);
				}
			}
		}

		logger.info("Compiled {} updated dependencies and {} files for group '{}' in {}", updatedDependencies.size(),
				changedFiles.size(), group.name(), directory);
		return new DependencyChange(updatedDependencies, new ArrayList<>(changedFiles.values()), group);
	}

}
