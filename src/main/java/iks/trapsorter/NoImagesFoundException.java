package iks.trapsorter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Directory holds no camera-trap image with readable metadata or can't be listed at all.
 */
public class NoImagesFoundException extends IOException {
	private final Path directory;

	public NoImagesFoundException( Path directory ) {
		super( "No camera-trap images found in directory " + directory );
		this.directory = directory;
	}

	public NoImagesFoundException( Path directory, IOException cause ) {
		super( "Can't list directory " + directory, cause );
		this.directory = directory;
	}

	public Path getDirectory() {
		return directory;
	}
}
