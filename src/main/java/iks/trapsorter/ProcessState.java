package iks.trapsorter;

/**
 * Processing state of a directory. Declaration order is the forward order of the lifecycle.
 */
public enum ProcessState {
	QUEUED( "Waiting for directory scan.." ),
	SCANNING( "Waiting for scan to finish.." ),
	FAILED( "No camera-trap images found" ),
	READ( "Scanned" ),
	CLASSIFYING( "Classifying.." ),
	CLASSIFIED( "Classified" );

	private final String description;

	ProcessState( String description ) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

	/** Whether the item's lock must be held to enter or leave the state */
	boolean isBusy() {
		return this == SCANNING || this == CLASSIFYING;
	}

	boolean canMoveTo( ProcessState next ) {
		switch ( this ) {
			case QUEUED:
				return next == SCANNING;
			case SCANNING:
				return next == READ || next == FAILED || next == QUEUED;
			case READ:
				return next == CLASSIFYING;
			case CLASSIFYING:
				return next == CLASSIFIED || next == READ || next == FAILED;
			default:
				return false;
		}
	}

	public boolean hasTable() {
		return compareTo( READ ) >= 0;
	}
}
