package iks.trapsorter;

/** How a classified image lands in its label directory */
public enum ExportMode {
	SYMLINK,
	COPY
}
