package org.springaicommunity.dependency.updater;

/**
 * Thrown when refreshing a group's pull request is aborted because a collaborator failed.
 * Nothing computed for the group before the failure is sent to the service.
 */
public class GroupRefreshException extends RuntimeException {

	private final String dependencyGroupName;

	public GroupRefreshException(String dependencyGroupName, Throwable cause) {
		super("Failed to refresh dependency group '" + dependencyGroupName + "': " + cause.getMessage(), cause);
		this.dependencyGroupName = dependencyGroupName;
	}

	public String getDependencyGroupName() {
		return dependencyGroupName;
	}

}
