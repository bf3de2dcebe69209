package iks.trapsorter;

import org.slf4j.*;

import java.io.IOException;
import java.util.*;

/**
 * Classifier built on a model that returns one confidence per label for each image.
 * <p>
 * Images are scored in batches. Each image gets its highest scoring label. With event aggregation every image
 * of a trigger event gets the label of the single most confident image of that event.
 */
public abstract class ScoringClassifier implements Classifier {
	private static final Logger log = LoggerFactory.getLogger( ScoringClassifier.class );
	private static final Logger performanceLog = LoggerFactory.getLogger( "performance.ScoringClassifier" );

	private final List< String > labels;
	private final int batchSize;
	private final boolean aggregateEvents;

	protected ScoringClassifier( ClassificationOptions options ) {
		this.labels = options.getLabels();
		this.batchSize = options.getBatchSize();
		this.aggregateEvents = options.isAggregateEvents();
	}

	/**
	 * Scores a batch of images.
	 *
	 * @return one row per image, one confidence per label in vocabulary order
	 */
	protected abstract float[][] score( List< ImageRecord > batch ) throws IOException;

	public List< String > getLabels() {
		return labels;
	}

	@Override
	public void classify( EventTable table, ProgressListener progress ) throws ProcessingInterruptedException, IOException {
		long startTime = System.nanoTime();
		List< ImageRecord > records = table.getRecords();
		for ( int from = 0; from < records.size(); from += batchSize ) {
			if ( ! progress.onProgress( from * 100 / records.size() ) ) {
				throw new ProcessingInterruptedException( "Classification interrupted at image " + from );
			}
			List< ImageRecord > batch = records.subList( from, Math.min( from + batchSize, records.size() ) );
			float[][] scores = score( batch );
			if ( scores.length != batch.size() ) {
				throw new IllegalStateException( "Model returned " + scores.length + " rows for " + batch.size() + " images" );
			}
			for ( int i = 0; i < batch.size(); ++ i ) {
				assignBestLabel( batch.get( i ), scores[ i ] );
			}
		}
		if ( aggregateEvents ) {
			aggregateEventLabels( records );
		}
		if ( ! progress.onProgress( 100 ) ) {
			throw new ProcessingInterruptedException( "Classification interrupted after the last image" );
		}
		performanceLog.debug( "{} images classified in {}", records.size(), Utils.asHumanReadableDelay( startTime ) );
	}

	private void assignBestLabel( ImageRecord record, float[] confidences ) {
		if ( confidences.length != labels.size() ) {
			throw new IllegalStateException(
					"Model returned " + confidences.length + " scores for " + labels.size() + " labels"
			);
		}
		int best = 0;
		for ( int i = 1; i < confidences.length; ++ i ) {
			if ( confidences[ i ] > confidences[ best ] ) {
				best = i;
			}
		}
		record.setLabel( labels.get( best ), confidences[ best ] );
	}

	/** Every image of a simple event takes the label of the event's most confident image */
	static void aggregateEventLabels( List< ImageRecord > records ) {
		for ( List< ImageRecord > event : EventConsolidator.groupBySimpleKey( records ).values() ) {
			ImageRecord winner = event.get( 0 );
			for ( ImageRecord record : event ) {
				if ( record.getConfidence() > winner.getConfidence() ) {
					winner = record;
				}
			}
			for ( ImageRecord record : event ) {
				if ( ! Objects.equals( record.getLabel(), winner.getLabel() ) ) {
					log.trace( "{} relabeled {} -> {}", record.getFilename(), record.getLabel(), winner.getLabel() );
				}
				record.setLabel( winner.getLabel(), record.getConfidence() );
			}
		}
	}
}
