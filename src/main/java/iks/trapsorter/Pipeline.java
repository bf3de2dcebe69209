package iks.trapsorter;

import org.slf4j.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.*;

/**
 * The single worker draining the {@link WorkTree}: a scan pass over queued directories followed by a
 * classification pass over scanned ones, repeated while there is work, sleeping otherwise.
 * <p>
 * Only this thread scans and classifies. Callers mutate the tree, pause the pipeline and wake the worker up
 * through {@link PipelineController}.
 */
class Pipeline implements Runnable {
	private static final Logger log = LoggerFactory.getLogger( Pipeline.class );
	private static final Logger performanceLog = LoggerFactory.getLogger( "performance.Pipeline" );

	private final WorkTree tree;
	private final DirectoryScanner scanner;
	private final Classifier classifier;
	private final ClassificationOptions options;
	private final ClassificationExporter exporter;
	private final PauseGate pauseGate;
	private final List< PipelineListener > listeners = new CopyOnWriteArrayList<>();

	private final ReentrantLock signalLock = new ReentrantLock();
	private final Condition workAvailable = signalLock.newCondition();
	private final Condition idleCondition = signalLock.newCondition();
	/** Set by callers on new work, cleared by the worker when it starts a round */
	private boolean workRequested;
	private boolean idle;

	/** Item under processing. Reset by callers to make the running operation stop */
	private volatile WorkItem activeItem;

	/**
	 * @param classifier null to scan only
	 */
	Pipeline(
			WorkTree tree, DirectoryScanner scanner, Classifier classifier, ClassificationOptions options,
			PauseGate pauseGate ) {
		this.tree = tree;
		this.scanner = scanner;
		this.classifier = classifier;
		this.options = options;
		this.exporter = options == null ? null : new ClassificationExporter( options.getExportMode() );
		this.pauseGate = pauseGate;
		if ( classifier != null && options == null ) {
			throw new IllegalArgumentException( "Classification needs options" );
		}
	}

	void addListener( PipelineListener listener ) {
		listeners.add( listener );
	}

	void removeListener( PipelineListener listener ) {
		listeners.remove( listener );
	}

	@Override
	public void run() {
		log.debug( "Pipeline worker started" );
		try {
			while ( ! Thread.currentThread().isInterrupted() ) {
				awaitWork();
				runScanPass();
				if ( classifier != null ) {
					runClassifyPass();
				}
			}
		} catch ( InterruptedException ie ) {
			log.trace( "Interrupted. Exiting" );
			// just finish
		} finally {
			signalLock.lock();
			try {
				idle = true;
				idleCondition.signalAll();
			} finally {
				signalLock.unlock();
			}
		}
		log.debug( "Pipeline worker stopped" );
	}

	/** Wakes the worker up */
	void notifyWork() {
		signalLock.lock();
		try {
			workRequested = true;
			workAvailable.signalAll();
		} finally {
			signalLock.unlock();
		}
	}

	private void awaitWork() throws InterruptedException {
		signalLock.lock();
		try {
			while ( ! workRequested && ! tree.hasWork( classifier != null ) ) {
				if ( ! idle ) {
					log.trace( "No more work. Going to sleep" );
					idle = true;
					idleCondition.signalAll();
				}
				workAvailable.await();
			}
			idle = false;
			workRequested = false;
		} finally {
			signalLock.unlock();
		}
	}

	/**
	 * @return false if the worker still had work when the timeout elapsed
	 */
	boolean awaitIdle( long timeout, TimeUnit unit ) throws InterruptedException {
		long nanos = unit.toNanos( timeout );
		signalLock.lock();
		try {
			while ( ! idle || workRequested ) {
				if ( nanos <= 0 ) {
					return false;
				}
				nanos = idleCondition.awaitNanos( nanos );
			}
			return true;
		} finally {
			signalLock.unlock();
		}
	}

	/**
	 * Makes the operation on the item stop at its next progress report.
	 * Nothing happens if the worker is busy with another item.
	 */
	void detach( WorkItem item ) {
		if ( activeItem == item ) {
			activeItem = null;
			log.debug( "Detached active item '{}'", item.getDirectory() );
		}
	}

	/** Makes the running operation stop at its next progress report */
	void detachActive() {
		activeItem = null;
	}

	void runScanPass() throws InterruptedException {
		long startTime = System.nanoTime();
		int scanned = 0;
		Set< WorkItem > skipped = new HashSet<>();
		WorkItem item;
		while ( ( item = nextUnread( skipped ) ) != null ) {
			if ( ! scanItem( item ) ) {
				skipped.add( item );
			} else {
				++ scanned;
			}
		}
		if ( scanned > 0 ) {
			performanceLog.debug( "Scan pass over {} directories done in {}", scanned, Utils.asHumanReadableDelay( startTime ) );
		}
	}

	private WorkItem nextUnread( Set< WorkItem > skipped ) throws InterruptedException {
		while ( true ) {
			checkInterrupted();
			pauseGate.awaitResumed();
			WorkItem next = tree.nextUnread( skipped );
			activeItem = next;
			if ( next == null || ! pauseGate.isPaused() ) {
				return next;
			}
			// paused right after the pick. Wait for resume and pick again
			activeItem = null;
		}
	}

	/**
	 * @return false if the item couldn't be taken because a caller holds it or is removing it
	 */
	private boolean scanItem( WorkItem item ) {
		// only process if the caller isn't trying to delete it
		if ( ! item.tryLock() ) {
			log.debug( "'{}' is locked by a caller. Skipping", item.getDirectory() );
			return false;
		}
		boolean changed = false;
		try {
			if ( item.isRemoving() ) {
				log.debug( "'{}' is being removed. Skipping", item.getDirectory() );
				return false;
			}
			if ( item.isRemoved() || item.getState() != ProcessState.QUEUED ) {
				return true;
			}
			if ( activeItem != item ) {
				// paused or deleted between the pick and the lock
				return true;
			}
			item.moveTo( ProcessState.SCANNING );
			fireStateChanged( item );
			try {
				EventTable table = scanner.scan( item.getDirectory(), percent -> reportProgress( item, ProcessState.SCANNING, percent ) );
				item.moveTo( ProcessState.READ, table );
				log.info( "'{}': {}", item.getDirectory(), table.describe() );
			} catch ( NoImagesFoundException nife ) {
				item.moveTo( ProcessState.FAILED, null );
				log.warn( nife.getMessage() );
				fireFailed( item, nife );
			} catch ( ProcessingInterruptedException pie ) {
				item.moveTo( ProcessState.QUEUED, null );
				log.debug( pie.getMessage() );
			} catch ( RuntimeException re ) {
				item.moveTo( ProcessState.FAILED, null );
				log.error( String.format( "Error scanning directory \"%s\"", item.getDirectory() ), re );
				fireFailed( item, re );
			}
			changed = true;
		} finally {
			activeItem = null;
			item.unlock();
		}
		if ( changed ) {
			fireStateChanged( item );
		}
		return true;
	}

	/**
	 * Classifies every scanned directory in tree order. An interrupted item returns to
	 * {@link ProcessState#READ} and ends the whole pass; the next pass starts over with the remaining items.
	 */
	void runClassifyPass() throws InterruptedException {
		long startTime = System.nanoTime();
		int classified = 0;
		for ( WorkItem item : tree.getReadLeaves() ) {
			checkInterrupted();
			pauseGate.awaitResumed();
			if ( ! item.tryLock() ) {
				log.debug( "'{}' is locked by a caller. Skipping", item.getDirectory() );
				continue;
			}
			ProcessState outcome;
			try {
				if ( item.isRemoving() || item.isRemoved() || item.getState() != ProcessState.READ ) {
					continue;
				}
				activeItem = item;
				if ( pauseGate.isPaused() ) {
					log.debug( "Paused before classifying '{}'. Classification pass aborted", item.getDirectory() );
					return;
				}
				item.moveTo( ProcessState.CLASSIFYING );
				fireStateChanged( item );
				outcome = classifyItem( item );
			} finally {
				activeItem = null;
				item.unlock();
			}
			fireStateChanged( item );
			if ( outcome == ProcessState.READ ) {
				log.debug( "Classification pass aborted at '{}'", item.getDirectory() );
				return;
			}
			if ( outcome == ProcessState.CLASSIFIED ) {
				++ classified;
			}
		}
		if ( classified > 0 ) {
			performanceLog.debug( "Classification pass over {} directories done in {}", classified, Utils.asHumanReadableDelay( startTime ) );
		}
	}

	/** Runs with the item lock held; @return the state the item ended in */
	private ProcessState classifyItem( WorkItem item ) {
		EventTable table = item.getTable();
		try {
			classifier.classify( table, percent -> reportProgress( item, ProcessState.CLASSIFYING, percent ) );
			EventConsolidator consolidator = scanner.getConsolidator();
			// flags of the scan saw no labels yet
			consolidator.markDuplicates( table.getRecords() );
			List< ImageRecord > exported = consolidator.retain( table.getRecords(), options.getDuplicatePolicy() );
			exporter.export( outputDirOf( item ), exported, options.getLabels() );
			item.moveTo( ProcessState.CLASSIFIED );
			log.info( "'{}' classified: {}", item.getDirectory(), table.presentLabels( options.getLabels() ) );
		} catch ( ProcessingInterruptedException pie ) {
			item.moveTo( ProcessState.READ );
			log.debug( pie.getMessage() );
		} catch ( IOException | RuntimeException e ) {
			item.moveTo( ProcessState.FAILED );
			log.error( String.format( "Error classifying directory \"%s\"", item.getDirectory() ), e );
			fireFailed( item, e );
		}
		return item.getState();
	}

	private Path outputDirOf( WorkItem item ) {
		WorkItem root = item.isRoot() ? item : tree.lookup( item.getParentId() );
		Path rootDirectory = root != null ? root.getDirectory() : item.getDirectory();
		return options.resolveOutputDir( rootDirectory, item.getDirectory() );
	}

	/** Progress callback of a running operation: false once paused, detached or being removed */
	private boolean reportProgress( WorkItem item, ProcessState phase, int percent ) {
		for ( PipelineListener listener : listeners ) {
			listener.progress( item, phase, percent );
		}
		return activeItem == item && ! item.isRemoving() && ! pauseGate.isPaused()
				&& ! Thread.currentThread().isInterrupted();
	}

	private static void checkInterrupted() throws InterruptedException {
		if ( Thread.interrupted() ) {
			throw new InterruptedException();
		}
	}

	private void fireStateChanged( WorkItem item ) {
		for ( PipelineListener listener : listeners ) {
			listener.stateChanged( item );
		}
	}

	private void fireFailed( WorkItem item, Exception error ) {
		for ( PipelineListener listener : listeners ) {
			listener.failed( item, error );
		}
	}

	void fireRemoved( WorkItem item ) {
		for ( PipelineListener listener : listeners ) {
			listener.removed( item );
		}
	}
}
