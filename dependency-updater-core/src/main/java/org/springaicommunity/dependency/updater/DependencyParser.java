package org.springaicommunity.dependency.updater;

import java.util.List;

/**
 * Parses manifest and lockfile contents into dependency records.
 */
public interface DependencyParser {

	/**
	 * Parse the dependencies declared by a directory's files.
	 * @param files the fetched files of one directory
	 * @return the dependencies, in declaration order
	 */
	List<Dependency> parse(List<DependencyFile> files);

}
