package org.springaicommunity.dependency.updater;

import java.util.Objects;

/**
 * A manifest or lockfile belonging to one project directory.
 *
 * <p>
 * Two files are the same file when their {@link #key()} is equal: the same name in a
 * different directory is a different file.
 *
 * @param directory the project directory the file belongs to (e.g. "/" or "/api")
 * @param name the path of the file relative to the directory
 * @param content the file content
 */
public record DependencyFile(String directory, String name, String content) {

	public DependencyFile {
		Objects.requireNonNull(directory, "directory");
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(content, "content");
	}

	/**
	 * Identity of the file across a job.
	 */
	public Key key() {
		return new Key(directory, name);
	}

	/**
	 * Returns a copy of this file with new content.
	 */
	public DependencyFile withContent(String updatedContent) {
		return new DependencyFile(directory, name, updatedContent);
	}

	/**
	 * Directory-scoped file identity.
	 *
	 * @param directory the project directory
	 * @param name the file path within the directory
	 */
	public record Key(String directory, String name) {
	}

}
