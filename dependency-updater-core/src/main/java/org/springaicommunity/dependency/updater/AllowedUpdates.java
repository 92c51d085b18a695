package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which dependencies a job is allowed to touch.
 */
public enum AllowedUpdates {

	/**
	 * Only dependencies declared directly in a manifest.
	 */
	DIRECT("direct"),

	/**
	 * Direct and transitive dependencies.
	 */
	ALL("all");

	private final String value;

	AllowedUpdates(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	public boolean permits(Dependency dependency) {
		return this == ALL || dependency.topLevel();
	}

	@JsonCreator
	public static AllowedUpdates fromValue(String value) {
		for (AllowedUpdates allowed : values()) {
			if (allowed.value.equalsIgnoreCase(value)) {
				return allowed;
			}
		}
		throw new IllegalArgumentException("Invalid allowed-updates '" + value + "': must be 'direct' or 'all'");
	}

}
