package org.springaicommunity.dependency.updater;

import java.util.List;

/**
 * Creates the {@link UpdateChecker} for a dependency.
 */
@FunctionalInterface
public interface UpdateCheckerFactory {

	UpdateChecker forDependency(Dependency dependency, List<DependencyFile> dependencyFiles);

}
