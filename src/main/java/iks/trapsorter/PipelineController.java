package iks.trapsorter;

import org.slf4j.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread safe entry point to the processing pipeline.
 * <p>
 * Callers add and remove directories and pause or resume processing; a single worker thread started by
 * {@link #start()} does the scanning and classification. Nothing the worker runs into is thrown to callers:
 * outcomes are visible through item states and {@link PipelineListener} notifications.
 */
public class PipelineController implements AutoCloseable {
	private static final Logger log = LoggerFactory.getLogger( PipelineController.class );
	private static final long JOIN_TIMEOUT_MS = 10_000;

	private final WorkTree tree = new WorkTree();
	private final PauseGate pauseGate = new PauseGate();
	private final Pipeline pipeline;
	private Thread workerThread;

	/** Scan only controller */
	public PipelineController( DirectoryScanner scanner ) {
		this( scanner, null, null );
	}

	/**
	 * @param classifier null to scan only
	 * @param options settings of classification and export; may be null without a classifier
	 */
	public PipelineController( DirectoryScanner scanner, Classifier classifier, ClassificationOptions options ) {
		this.pipeline = new Pipeline( tree, scanner, classifier, options, pauseGate );
	}

	public synchronized void start() {
		if ( workerThread != null ) {
			throw new IllegalStateException( "Pipeline already started" );
		}
		workerThread = new Thread( pipeline );
		workerThread.setName( "PIPELINE" );
		workerThread.setDaemon( true );
		workerThread.start();
	}

	public void addListener( PipelineListener listener ) {
		pipeline.addListener( listener );
	}

	public void removeListener( PipelineListener listener ) {
		pipeline.removeListener( listener );
	}

	/**
	 * Queues a directory. If it has subdirectories they are queued instead of the directory itself.
	 * A directory that can't be listed is queued as is and fails on scan.
	 *
	 * @return the root item or null if the path is blank or was added already
	 */
	public WorkItem addDir( Path directory ) {
		if ( directory == null || directory.toString().isBlank() ) {
			return null;
		}
		Path normalized = directory.toAbsolutePath().normalize();
		// only matches by path, symlinks are not recognized
		if ( tree.findRoot( normalized ) != null ) {
			log.debug( "'{}' is already queued", normalized );
			return null;
		}
		WorkItem root = tree.addRoot( normalized, listSubdirectories( normalized ) );
		if ( root != null ) {
			pipeline.notifyWork();
		}
		return root;
	}

	private static List< Path > listSubdirectories( Path directory ) {
		List< Path > subdirectories = new ArrayList<>();
		try ( DirectoryStream< Path > stream = Files.newDirectoryStream( directory, Files::isDirectory ) ) {
			for ( Path entry : stream ) {
				subdirectories.add( entry );
			}
		} catch ( IOException | DirectoryIteratorException e ) {
			log.warn( "Can't list subdirectories of '{}': {}", directory, e.getMessage() );
			return Collections.emptyList();
		}
		Collections.sort( subdirectories );
		return subdirectories;
	}

	/**
	 * Removes an item: a root with all its subdirectories, a subdirectory alone (and its root with the last one).
	 * Blocks while the worker is busy with the item; the running operation is asked to stop first.
	 *
	 * @return false if no such item
	 */
	public boolean removeDir( int itemId ) {
		ReentrantLock structureLock = tree.getStructureLock();
		structureLock.lock();
		try {
			WorkItem item = tree.get( itemId );
			if ( item == null ) {
				return false;
			}
			List< WorkItem > children = tree.getChildren( itemId );
			if ( ! children.isEmpty() ) {
				// the last removed child takes its root along
				for ( WorkItem child : children ) {
					removeDir( child.getId() );
				}
				return true;
			}
			acquire( item );
			try {
				tree.remove( item );
			} finally {
				item.unlock();
			}
			pipeline.fireRemoved( item );
			if ( ! item.isRoot() && tree.getChildren( item.getParentId() ).isEmpty() ) {
				removeDir( item.getParentId() );
			}
			return true;
		} finally {
			structureLock.unlock();
		}
	}

	/** Removes the root directory added with this path */
	public boolean removeDir( Path directory ) {
		WorkItem root = tree.findRoot( directory.toAbsolutePath().normalize() );
		return root != null && removeDir( root.getId() );
	}

	private void acquire( WorkItem item ) {
		// keeps the worker from taking the lock back before this thread gets it
		item.markRemoving();
		if ( item.tryLock() ) {
			return;
		}
		// the worker has it: make it stop and wait for the lock
		log.debug( "'{}' is being processed. Waiting for the worker to release it", item.getDirectory() );
		pipeline.detach( item );
		item.lock();
	}

	/** Running operation stops at its next progress report; the worker waits before picking another item */
	public void pause() {
		pauseGate.pause();
		pipeline.detachActive();
	}

	public void resume() {
		pauseGate.resume();
		pipeline.notifyWork();
	}

	public boolean isPaused() {
		return pauseGate.isPaused();
	}

	/** Every item in tree order, roots before their subdirectories */
	public List< WorkItem > getItems() {
		return tree.getItems();
	}

	/** Units of work in tree order */
	public List< WorkItem > getLeaves() {
		return tree.getLeaves();
	}

	public WorkItem getItem( int itemId ) {
		return tree.lookup( itemId );
	}

	/** Every directory has been scanned and at least one successfully */
	public boolean isAllScanned() {
		return tree.isAllScanned();
	}

	/**
	 * Waits until the worker has no work left.
	 *
	 * @return false on timeout
	 */
	public boolean awaitIdle( long timeout, TimeUnit unit ) throws InterruptedException {
		return pipeline.awaitIdle( timeout, unit );
	}

	/** Stops the worker. The current operation is interrupted at its next progress report. */
	@Override
	public synchronized void close() throws InterruptedException {
		if ( workerThread == null ) {
			return;
		}
		pipeline.detachActive();
		workerThread.interrupt();
		workerThread.join( JOIN_TIMEOUT_MS );
		if ( workerThread.isAlive() ) {
			log.warn( "Pipeline worker didn't stop in {} ms", JOIN_TIMEOUT_MS );
		}
		workerThread = null;
	}
}
