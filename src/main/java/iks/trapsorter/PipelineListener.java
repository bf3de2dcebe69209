package iks.trapsorter;

/**
 * Receives pipeline notifications. Called on the worker thread (and on the caller thread for removals);
 * implementations must return quickly and must not wait for the pipeline.
 */
public interface PipelineListener {
	default void stateChanged( WorkItem item ) {}

	/**
	 * @param phase {@link ProcessState#SCANNING} or {@link ProcessState#CLASSIFYING}
	 */
	default void progress( WorkItem item, ProcessState phase, int percent ) {}

	default void failed( WorkItem item, Exception error ) {}

	default void removed( WorkItem item ) {}
}
