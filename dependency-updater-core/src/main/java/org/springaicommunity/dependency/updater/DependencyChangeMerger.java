package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the per-directory changes of a group into the single change of its pull
 * request.
 *
 * <p>
 * Dependencies are concatenated in directory order and de-duplicated by name; the first
 * directory to touch a dependency decides the version reported for it. Files are keyed by
 * directory and name, so files of different directories never collide. If the same file is
 * produced more than once, the content produced last wins and the file keeps its first
 * position.
 */
public class DependencyChangeMerger {

	private static final Logger logger = LoggerFactory.getLogger(DependencyChangeMerger.class);

	/**
	 * Merge per-directory changes.
	 * @param changes one change per directory, in directory order
	 * @return the merged change; the only change itself when there is just one
	 */
	public DependencyChange merge(List<DependencyChange> changes) {
		if (changes.isEmpty()) {
			throw new IllegalArgumentException("At least one change is required");
		}
		if (changes.size() == 1) {
			return changes.get(0);
		}

		Map<String, Dependency> dependencies = new LinkedHashMap<>();
		Map<DependencyFile.Key, DependencyFile> files = new LinkedHashMap<>();
		for (DependencyChange change : changes) {
			for (Dependency dependency : change.updatedDependencies()) {
				Dependency first = dependencies.putIfAbsent(dependency.name(), dependency);
				if (first != null && !first.equals(dependency)) {
					logger.debug("Keeping {} {} over {} from a later directory", first.name(), first.version(),
							dependency.version());
				}
			}
			for (DependencyFile file : change.updatedDependencyFiles()) {
				files.put(file.key(), file);
			}
		}

		DependencyChange merged = new DependencyChange(new ArrayList<>(dependencies.values()),
				new ArrayList<>(files.values()), changes.get(0).dependencyGroup());
		logger.info("Merged {} directory changes into {} dependencies and {} files", changes.size(),
				merged.updatedDependencies().size(), merged.updatedDependencyFiles().size());
		return merged;
	}

}
