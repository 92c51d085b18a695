package org.springaicommunity.dependency.updater;

/**
 * Fetches the dependency files of a project directory from the hosting provider.
 */
public interface FileFetcher {

	/**
	 * Fetch the dependency files of one directory.
	 * @param directory the project directory (e.g. "/" or "/api")
	 * @return the files and the commit they were fetched at
	 */
	FetchedFiles fetch(String directory);

}
