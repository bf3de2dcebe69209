package iks.trapsorter;

import org.slf4j.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Groups camera-trap images into trigger events.
 * <p>
 * The simple event key is {@code serial_year_dayOfYear_event2}. Images of one burst share it.
 * Duplicates are images repeating a sequence index inside one simple event. Bursts of the same camera
 * following each other closer than the merge window get one extended event key.
 */
public class EventConsolidator {
	private static final Logger log = LoggerFactory.getLogger( EventConsolidator.class );
	public static final Duration DEFAULT_WINDOW = Duration.ofSeconds( 10 );
	private static final long YEAR_ZERO_EPOCH_SECOND = LocalDateTime.of( 0, 1, 1, 0, 0 ).toEpochSecond( ZoneOffset.UTC );

	private static final Comparator< ImageRecord > SORT_ORDER =
			Comparator.comparing( ImageRecord::getSortKey ).thenComparing( ImageRecord::getFilename );

	private final Duration window;

	public EventConsolidator() {
		this( DEFAULT_WINDOW );
	}

	public EventConsolidator( Duration window ) {
		if ( window.isNegative() ) {
			throw new IllegalArgumentException( "Negative event merge window " + window );
		}
		this.window = window;
	}

	/**
	 * Assigns keys, sorts, flags duplicates and merges close events.
	 *
	 * @return the records sorted by sort key (ties by filename)
	 */
	public List< ImageRecord > consolidate( List< ImageRecord > records ) {
		List< ImageRecord > sorted = new ArrayList<>( records );
		for ( ImageRecord record : sorted ) {
			assignKeys( record );
		}
		sorted.sort( SORT_ORDER );
		markDuplicates( sorted );
		extendEventKeys( sorted );
		return sorted;
	}

	static void assignKeys( ImageRecord record ) {
		String simpleKey = record.getSerialNo() + "_" + record.getTimestamp().getYear()
				+ "_" + record.getTimestamp().getDayOfYear() + "_" + record.getEvent2();
		record.setSimpleEventKey( simpleKey );
		// nanoseconds since year 0 padded to 22 digits: string order equals time order for any 16-bit year
		record.setSortKey( String.format(
				"%s%013d%09d", simpleKey, record.getEpochSecond() - YEAR_ZERO_EPOCH_SECOND, record.getTimestamp().getNano()
		) );
	}

	/**
	 * Flags every record of a simple event that repeats a sequence index:
	 * {@link ImageRecord#CONFLICT} if the labels of the event disagree, {@link ImageRecord#REDUNDANT} otherwise.
	 */
	public void markDuplicates( List< ImageRecord > records ) {
		Map< String, List< ImageRecord > > events = groupBySimpleKey( records );
		int flagged = 0;
		for ( List< ImageRecord > event : events.values() ) {
			Set< Integer > seen = new HashSet<>();
			boolean repeated = false;
			for ( ImageRecord record : event ) {
				repeated |= ! seen.add( record.getSequenceIdx() );
			}
			int flag = ImageRecord.UNIQUE;
			if ( repeated ) {
				Set< String > labels = new HashSet<>();
				for ( ImageRecord record : event ) {
					labels.add( record.getLabel() );
				}
				flag = labels.size() > 1 ? ImageRecord.CONFLICT : ImageRecord.REDUNDANT;
				flagged += event.size();
			}
			for ( ImageRecord record : event ) {
				record.setDuplicate( flag );
			}
		}
		if ( flagged > 0 ) {
			log.debug( "{} of {} images belong to events with duplicate sequence indices", flagged, records.size() );
		}
	}

	/**
	 * Single forward pass over records sorted by sort key. A record continues the previous record's extended
	 * event when it was taken by the same camera within {@code [0, window)} after it.
	 */
	public void extendEventKeys( List< ImageRecord > records ) {
		ImageRecord previous = null;
		for ( ImageRecord record : records ) {
			String key = record.getSimpleEventKey();
			if ( previous != null && record.getSerialNo().equals( previous.getSerialNo() ) ) {
				Duration offset = Duration.of(
						record.getEpochSecond() - previous.getEpochSecond(), ChronoUnit.SECONDS
				);
				if ( ! offset.isNegative() && offset.compareTo( window ) < 0 ) {
					key = previous.getEventKey();
				}
			}
			record.setEventKey( key );
			previous = record;
		}
	}

	/**
	 * Picks the surviving records according to the duplicate policy. Order of the input is kept.
	 */
	public List< ImageRecord > retain( List< ImageRecord > records, DuplicatePolicy policy ) {
		if ( policy == DuplicatePolicy.KEEP_ALL ) {
			return new ArrayList<>( records );
		}
		Map< String, ImageRecord > survivors = new HashMap<>();
		for ( ImageRecord record : records ) {
			String slot = record.getSimpleEventKey() + "#" + record.getSequenceIdx();
			ImageRecord current = survivors.get( slot );
			if ( current == null || prefers( policy, record, current ) ) {
				survivors.put( slot, record );
			}
		}
		List< ImageRecord > result = new ArrayList<>( survivors.size() );
		for ( ImageRecord record : records ) {
			if ( survivors.get( record.getSimpleEventKey() + "#" + record.getSequenceIdx() ) == record ) {
				result.add( record );
			}
		}
		return result;
	}

	private static boolean prefers( DuplicatePolicy policy, ImageRecord candidate, ImageRecord current ) {
		int order = candidate.getFilename().compareTo( current.getFilename() );
		return policy == DuplicatePolicy.KEEP_FIRST_BY_FILENAME ? order < 0 : order > 0;
	}

	static Map< String, List< ImageRecord > > groupBySimpleKey( List< ImageRecord > records ) {
		Map< String, List< ImageRecord > > events = new LinkedHashMap<>();
		for ( ImageRecord record : records ) {
			events.computeIfAbsent( record.getSimpleEventKey(), key -> new ArrayList<>() ).add( record );
		}
		return events;
	}
}
