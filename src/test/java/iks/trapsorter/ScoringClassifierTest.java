package iks.trapsorter;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.*;

import static iks.trapsorter.CameraTrapImages.record;
import static org.junit.jupiter.api.Assertions.*;

class ScoringClassifierTest {
	private static final LocalDateTime T0 = LocalDateTime.of( 2019, 3, 14, 6, 30, 0 );

	private static EventTable table( ImageRecord... records ) {
		return new EventTable( new EventConsolidator().consolidate( Arrays.asList( records ) ) );
	}

	@Test
	void assignsBestScoringLabelInBatches() throws Exception {
		EventTable table = table(
				record( "cheetah1.jpg", "ABC123", T0, 1, 1 ),
				record( "leopard1.jpg", "ABC123", T0.plusMinutes( 1 ), 2, 1 ),
				record( "cheetah2.jpg", "ABC123", T0.plusMinutes( 2 ), 3, 1 ),
				record( "unknown1.jpg", "ABC123", T0.plusMinutes( 3 ), 4, 1 ),
				record( "leopard2.jpg", "ABC123", T0.plusMinutes( 4 ), 5, 1 )
		);
		FixedScoringClassifier classifier = new FixedScoringClassifier(
				FixedScoringClassifier.options( null, 2, false, ExportMode.SYMLINK ),
				image -> image.getFilename().replaceAll( "\\d\\.jpg", "" ), 0.8f
		);
		List< Integer > reported = new ArrayList<>();

		classifier.classify( table, percent -> reported.add( percent ) );

		for ( ImageRecord image : table ) {
			assertTrue( image.getFilename().startsWith( image.getLabel() ), image.toString() );
			assertEquals( 0.8f, image.getConfidence(), 1e-6 );
		}
		assertEquals( List.of( 2, 2, 1 ), classifier.batchSizes );
		assertEquals( List.of( 0, 40, 80, 100 ), reported );
		assertEquals( List.of( "cheetah", "leopard", "unknown" ), table.presentLabels( classifier.getLabels() ) );
	}

	@Test
	void aggregatesLabelOfMostConfidentImagePerEvent() throws Exception {
		EventTable table = table(
				record( "a.jpg", "ABC123", T0, 1, 1 ),
				record( "b.jpg", "ABC123", T0.plusSeconds( 2 ), 1, 2 ),
				record( "c.jpg", "ABC123", T0.plusMinutes( 5 ), 2, 1 )
		);
		ClassificationOptions options = FixedScoringClassifier.options( null, 16, true, ExportMode.SYMLINK );
		ScoringClassifier classifier = new ScoringClassifier( options ) {
			@Override
			protected float[][] score( List< ImageRecord > batch ) {
				return new float[][] {
						{ 0.6f, 0.3f, 0.1f },
						{ 0.05f, 0.9f, 0.05f },
						{ 0.7f, 0.2f, 0.1f }
				};
			}
		};

		classifier.classify( table, ProgressListener.IGNORE );

		assertEquals( "leopard", table.get( 0 ).getLabel() );
		assertEquals( 0.6f, table.get( 0 ).getConfidence(), 1e-6 );
		assertEquals( "leopard", table.get( 1 ).getLabel() );
		assertEquals( "cheetah", table.get( 2 ).getLabel() );
		assertEquals( List.of( "cheetah", "leopard" ), table.presentLabels( options.getLabels() ) );
	}

	@Test
	void rejectsScoresNotMatchingVocabulary() {
		EventTable table = table( record( "a.jpg", "ABC123", T0, 1, 1 ) );
		ScoringClassifier classifier = new ScoringClassifier( FixedScoringClassifier.options( null, 16, false, ExportMode.SYMLINK ) ) {
			@Override
			protected float[][] score( List< ImageRecord > batch ) {
				return new float[][] { { 0.5f, 0.5f } };
			}
		};

		assertThrows( IllegalStateException.class, () -> classifier.classify( table, ProgressListener.IGNORE ) );
	}

	@Test
	void refusalAfterLastBatchStopsToo() {
		EventTable table = table( record( "a.jpg", "ABC123", T0, 1, 1 ) );
		FixedScoringClassifier classifier = new FixedScoringClassifier(
				FixedScoringClassifier.options( null, 16, false, ExportMode.SYMLINK ), image -> "cheetah", 0.9f
		);

		assertThrows( ProcessingInterruptedException.class, () -> classifier.classify( table, percent -> percent < 100 ) );
		assertEquals( List.of( 1 ), classifier.batchSizes );
	}

	@Test
	void stopsWhenProgressListenerRefuses() {
		EventTable table = table(
				record( "a.jpg", "ABC123", T0, 1, 1 ),
				record( "b.jpg", "ABC123", T0.plusMinutes( 1 ), 2, 1 )
		);
		FixedScoringClassifier classifier = new FixedScoringClassifier(
				FixedScoringClassifier.options( null, 1, false, ExportMode.SYMLINK ), image -> "cheetah", 0.9f
		);

		assertThrows( ProcessingInterruptedException.class, () -> classifier.classify( table, percent -> percent == 0 ) );
		assertEquals( List.of( 1 ), classifier.batchSizes );
	}
}
