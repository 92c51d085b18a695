package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a pull request is closed.
 */
public enum ClosureReason {

	/**
	 * The group no longer has any member dependency, or no longer exists.
	 */
	DEPENDENCY_GROUP_EMPTY("dependency_group_empty"),

	/**
	 * The group still has members, but none of them can be updated right now.
	 */
	UPDATE_NO_LONGER_POSSIBLE("update_no_longer_possible"),

	/**
	 * The set of dependencies in the group's change differs from the open pull request.
	 */
	DEPENDENCIES_CHANGED("dependencies_changed");

	private final String value;

	ClosureReason(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Human readable form, e.g. "update no longer possible".
	 */
	public String description() {
		return value.replace('_', ' ');
	}

}
