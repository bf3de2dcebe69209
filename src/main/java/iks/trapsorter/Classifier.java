package iks.trapsorter;

import java.io.IOException;

/**
 * Labels the images of a scanned directory.
 */
public interface Classifier {
	/**
	 * Sets the label of every record of the table.
	 *
	 * @param progress false from the listener must stop the classification
	 * @throws ProcessingInterruptedException if stopped through the progress listener
	 * @throws IOException if the images or the model can't be read
	 */
	void classify( EventTable table, ProgressListener progress ) throws ProcessingInterruptedException, IOException;
}
