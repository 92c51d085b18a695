package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

/**
 * Reported when a job asks to refresh a group that is no longer configured. Never thrown
 * out of a refresh: the pull request of the missing group is closed instead.
 */
public class MissingDependencyGroupException extends RuntimeException {

	@Nullable
	private final String dependencyGroupName;

	public MissingDependencyGroupException(@Nullable String dependencyGroupName) {
		super("Attempted to refresh a missing group: '" + (dependencyGroupName != null ? dependencyGroupName : "unknown")
				+ "'");
		this.dependencyGroupName = dependencyGroupName;
	}

	@Nullable
	public String getDependencyGroupName() {
		return dependencyGroupName;
	}

}
