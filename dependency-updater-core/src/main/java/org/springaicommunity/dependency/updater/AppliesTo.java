package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of update job a dependency group is configured for.
 */
public enum AppliesTo {

	VERSION_UPDATES("version-updates"),

	SECURITY_UPDATES("security-updates");

	private final String value;

	AppliesTo(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static AppliesTo fromValue(String value) {
		for (AppliesTo appliesTo : values()) {
			if (appliesTo.value.equalsIgnoreCase(value)) {
				return appliesTo;
			}
		}
		throw new IllegalArgumentException(
				"Invalid applies-to '" + value + "': must be 'version-updates' or 'security-updates'");
	}

}
