package iks.trapsorter;

import java.util.*;

/**
 * Images of one directory ordered by sort key.
 */
public final class EventTable implements Iterable< ImageRecord > {
	private final List< ImageRecord > records;

	EventTable( List< ImageRecord > records ) {
		this.records = Collections.unmodifiableList( new ArrayList<>( records ) );
	}

	public List< ImageRecord > getRecords() {
		return records;
	}

	public int size() {
		return records.size();
	}

	public ImageRecord get( int index ) {
		return records.get( index );
	}

	public int countEvents() {
		return countDistinct( true );
	}

	public int countExtendedEvents() {
		return countDistinct( false );
	}

	private int countDistinct( boolean simple ) {
		Set< String > keys = new HashSet<>();
		for ( ImageRecord record : records ) {
			keys.add( simple ? record.getSimpleEventKey() : record.getEventKey() );
		}
		return keys.size();
	}

	/** Labels present in the table in vocabulary order */
	public List< String > presentLabels( List< String > vocabulary ) {
		Set< String > present = new HashSet<>();
		for ( ImageRecord record : records ) {
			present.add( record.getLabel() );
		}
		List< String > result = new ArrayList<>();
		for ( String label : vocabulary ) {
			if ( present.contains( label ) ) {
				result.add( label );
			}
		}
		return result;
	}

	@Override
	public Iterator< ImageRecord > iterator() {
		return records.iterator();
	}

	public String describe() {
		return records.size() + " images found in " + countEvents() + " events";
	}

	@Override
	public String toString() {
		return "EventTable{" + describe() + "}";
	}
}
