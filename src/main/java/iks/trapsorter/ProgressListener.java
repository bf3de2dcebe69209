package iks.trapsorter;

/** Receives progress of a long operation and decides whether it may go on. */
@FunctionalInterface
public interface ProgressListener {
	ProgressListener IGNORE = percent -> true;

	/**
	 * @param percent value in range 0..100
	 * @return false to interrupt the operation
	 */
	boolean onProgress( int percent );
}
