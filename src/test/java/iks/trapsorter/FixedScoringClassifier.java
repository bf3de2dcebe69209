package iks.trapsorter;

import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

/**
 * Scores each image with a fixed confidence for the label picked by a function of the record.
 */
class FixedScoringClassifier extends ScoringClassifier {
	private final Function< ImageRecord, String > labelOf;
	private final float confidence;
	final List< Integer > batchSizes = Collections.synchronizedList( new ArrayList<>() );

	FixedScoringClassifier( ClassificationOptions options, Function< ImageRecord, String > labelOf, float confidence ) {
		super( options );
		this.labelOf = labelOf;
		this.confidence = confidence;
	}

	static ClassificationOptions options( Path outputDir, int batchSize, boolean aggregate, ExportMode mode ) {
		return new ClassificationOptions(
				outputDir, "classified", "", batchSize, List.of( "cheetah", "leopard", "unknown" ),
				aggregate, DuplicatePolicy.KEEP_ALL, mode
		);
	}

	@Override
	protected float[][] score( List< ImageRecord > batch ) {
		batchSizes.add( batch.size() );
		float[][] scores = new float[ batch.size() ][];
		for ( int i = 0; i < batch.size(); ++ i ) {
			scores[ i ] = row( labelOf.apply( batch.get( i ) ), confidence );
		}
		return scores;
	}

	float[] row( String label, float score ) {
		float[] row = new float[ getLabels().size() ];
		Arrays.fill( row, ( 1f - score ) / ( row.length - 1 ) );
		row[ getLabels().indexOf( label ) ] = score;
		return row;
	}
}
