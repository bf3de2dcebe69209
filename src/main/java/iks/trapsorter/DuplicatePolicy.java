package iks.trapsorter;

/**
 * Which image survives when one trigger event holds the same sequence index more than once.
 */
public enum DuplicatePolicy {
	/** Every copy is kept */
	KEEP_ALL,
	/** The copy with the lexicographically smallest filename is kept */
	KEEP_FIRST_BY_FILENAME,
	/** The copy with the lexicographically greatest filename is kept */
	KEEP_LAST_BY_FILENAME
}
