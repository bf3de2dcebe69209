package iks.trapsorter;

/**
 * Scan or classification of a directory was stopped by the progress callback.
 * Transient: the item returns to its previous state and is processed again later.
 */
public class ProcessingInterruptedException extends Exception {
	public ProcessingInterruptedException( String message ) {
		super( message );
	}
}
