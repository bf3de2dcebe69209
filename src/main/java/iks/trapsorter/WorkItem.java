package iks.trapsorter;

import org.slf4j.*;

import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Directory to be scanned and classified.
 * <p>
 * The item lock guards the state/table pair: a thread enters or leaves {@link ProcessState#SCANNING}
 * and {@link ProcessState#CLASSIFYING} only while holding it, and removal from the tree takes it too.
 */
public final class WorkItem {
	private static final Logger log = LoggerFactory.getLogger( WorkItem.class );
	public static final int NO_PARENT = -1;

	private final int id;
	private final Path directory;
	private final int parentId;
	private final ReentrantLock processLock = new ReentrantLock();

	private volatile ProcessState state = ProcessState.QUEUED;
	private volatile EventTable table;
	private volatile boolean removed;
	/** Set by a caller about to remove the item; the worker doesn't pick it any more */
	private volatile boolean removing;

	WorkItem( int id, Path directory, int parentId ) {
		this.id = id;
		this.directory = directory;
		this.parentId = parentId;
	}

	public int getId() {
		return id;
	}

	public Path getDirectory() {
		return directory;
	}

	/** @return id of the root item this subdirectory belongs to or {@link #NO_PARENT} */
	public int getParentId() {
		return parentId;
	}

	public boolean isRoot() {
		return parentId == NO_PARENT;
	}

	public ProcessState getState() {
		return state;
	}

	/** @return the metadata table or null while the directory hasn't been read successfully */
	public EventTable getTable() {
		return state.hasTable() ? table : null;
	}

	public boolean isRemoved() {
		return removed;
	}

	void markRemoved() {
		removed = true;
	}

	public boolean isRemoving() {
		return removing;
	}

	void markRemoving() {
		removing = true;
	}

	boolean tryLock() {
		return processLock.tryLock();
	}

	void lock() {
		processLock.lock();
	}

	void unlock() {
		processLock.unlock();
	}

	boolean isLockedByCurrentThread() {
		return processLock.isHeldByCurrentThread();
	}

	void moveTo( ProcessState next ) {
		moveTo( next, table );
	}

	/**
	 * Changes the state together with the table.
	 *
	 * @throws IllegalStateException if the transition isn't part of the lifecycle or the lock isn't held for it
	 */
	void moveTo( ProcessState next, EventTable nextTable ) {
		ProcessState current = state;
		if ( ! current.canMoveTo( next ) ) {
			throw new IllegalStateException( "Illegal transition " + current + " -> " + next + " of " + directory );
		}
		if ( ( current.isBusy() || next.isBusy() ) && ! processLock.isHeldByCurrentThread() ) {
			throw new IllegalStateException( "Transition " + current + " -> " + next + " without lock of " + directory );
		}
		table = nextTable;
		state = next;
		log.trace( "'{}': {} -> {}", directory, current, next );
	}

	public String describe() {
		EventTable current = getTable();
		return current == null ? state.getDescription() : current.describe();
	}

	@Override
	public String toString() {
		return "WorkItem#" + id + "{" + directory + ", " + state + "}";
	}
}
