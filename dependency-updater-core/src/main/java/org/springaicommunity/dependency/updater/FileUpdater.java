package org.springaicommunity.dependency.updater;

import java.util.List;

/**
 * Rewrites manifests and lockfiles so that they reflect updated dependencies.
 */
@FunctionalInterface
public interface FileUpdater {

	/**
	 * Produce the updated files.
	 * @param dependencies the updated dependencies
	 * @param dependencyFiles the current files of the directory
	 * @return only the files whose content changed
	 */
	List<DependencyFile> updatedDependencyFiles(List<Dependency> dependencies, List<DependencyFile> dependencyFiles);

}
