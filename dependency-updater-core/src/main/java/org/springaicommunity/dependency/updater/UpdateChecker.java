package org.springaicommunity.dependency.updater;

import java.util.List;

/**
 * Ecosystem-specific answers about whether, and how, one dependency can be updated. One
 * instance is created per dependency by an {@link UpdateCheckerFactory}.
 */
public interface UpdateChecker {

	/**
	 * @return true if the dependency is already at the latest allowed version
	 */
	boolean isUpToDate();

	/**
	 * @return true if the declared requirements are already loose enough or may be
	 * loosened by an update
	 */
	boolean requirementsUnlockedOrCanBe();

	/**
	 * @param requirementsToUnlock how far requirements may be loosened
	 * @return true if an update is achievable at that level
	 */
	boolean canUpdate(RequirementsUnlock requirementsToUnlock);

	/**
	 * Compute the updated dependencies. The first element is the checked dependency, any
	 * further elements are related dependencies that must move with it.
	 * @param requirementsToUnlock how far requirements may be loosened
	 * @return the updated dependencies
	 */
	List<Dependency> updatedDependencies(RequirementsUnlock requirementsToUnlock);

}
