package org.springaicommunity.dependency.updater;

import java.util.List;

/**
 * Files fetched for one directory together with the commit they were read at.
 *
 * @param files the dependency files of the directory
 * @param baseCommitSha the commit the files were fetched from
 */
public record FetchedFiles(List<DependencyFile> files, String baseCommitSha) {

	public FetchedFiles {
		files = List.copyOf(files);
	}

}
