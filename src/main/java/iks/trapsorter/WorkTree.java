package iks.trapsorter;

import org.slf4j.*;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-level forest of directories: roots in insertion order, each with its subdirectories in insertion order.
 * <p>
 * Items live in an arena addressed by id, children refer to their root by id. Structural changes are guarded
 * by a re-entrant lock (removing the last child removes its root from inside the same removal). Every change
 * publishes an immutable snapshot of the leaves, so readers never need the lock.
 */
class WorkTree {
	private static final Logger log = LoggerFactory.getLogger( WorkTree.class );

	private final ReentrantLock structureLock = new ReentrantLock();
	private final Map< Integer, WorkItem > arena = new HashMap<>();
	private final List< Integer > rootIds = new ArrayList<>();
	private final Map< Integer, List< Integer > > childIds = new HashMap<>();
	/** Roots added with subdirectories. They never become units of work, even after losing their children */
	private final Set< Integer > containerIds = new HashSet<>();
	private int nextId;

	/** Leaves (units of work) in tree order */
	private volatile List< WorkItem > leaves = Collections.emptyList();
	private volatile List< WorkItem > allItems = Collections.emptyList();

	ReentrantLock getStructureLock() {
		return structureLock;
	}

	/**
	 * Adds a root directory with its subdirectories. A root without subdirectories is a unit of work itself.
	 *
	 * @return the root item or null if a root with that path already exists
	 */
	WorkItem addRoot( Path directory, List< Path > subdirectories ) {
		structureLock.lock();
		try {
			if ( findRoot( directory ) != null ) {
				return null;
			}
			WorkItem root = new WorkItem( nextId ++, directory, WorkItem.NO_PARENT );
			arena.put( root.getId(), root );
			rootIds.add( root.getId() );
			List< Integer > children = new ArrayList<>( subdirectories.size() );
			for ( Path subdirectory : subdirectories ) {
				WorkItem child = new WorkItem( nextId ++, subdirectory, root.getId() );
				arena.put( child.getId(), child );
				children.add( child.getId() );
			}
			childIds.put( root.getId(), children );
			if ( ! children.isEmpty() ) {
				containerIds.add( root.getId() );
			}
			publish();
			log.debug( "Added '{}' with {} subdirectories", directory, subdirectories.size() );
			return root;
		} finally {
			structureLock.unlock();
		}
	}

	/**
	 * Removes the item from the arena. Children of a root must be removed first.
	 */
	void remove( WorkItem item ) {
		structureLock.lock();
		try {
			if ( arena.remove( item.getId() ) == null ) {
				return;
			}
			if ( item.isRoot() ) {
				List< Integer > children = childIds.remove( item.getId() );
				if ( children != null && ! children.isEmpty() ) {
					throw new IllegalStateException( "Root " + item.getDirectory() + " still has subdirectories" );
				}
				rootIds.remove( Integer.valueOf( item.getId() ) );
				containerIds.remove( item.getId() );
			} else {
				List< Integer > siblings = childIds.get( item.getParentId() );
				if ( siblings != null ) {
					siblings.remove( Integer.valueOf( item.getId() ) );
				}
			}
			item.markRemoved();
			publish();
			log.debug( "Removed '{}'", item.getDirectory() );
		} finally {
			structureLock.unlock();
		}
	}

	WorkItem get( int id ) {
		structureLock.lock();
		try {
			return arena.get( id );
		} finally {
			structureLock.unlock();
		}
	}

	/** Lock free lookup in the last published snapshot */
	WorkItem lookup( int id ) {
		for ( WorkItem item : allItems ) {
			if ( item.getId() == id ) {
				return item;
			}
		}
		return null;
	}

	WorkItem findRoot( Path directory ) {
		structureLock.lock();
		try {
			for ( Integer id : rootIds ) {
				WorkItem root = arena.get( id );
				if ( root.getDirectory().equals( directory ) ) {
					return root;
				}
			}
			return null;
		} finally {
			structureLock.unlock();
		}
	}

	List< WorkItem > getChildren( int rootId ) {
		structureLock.lock();
		try {
			List< Integer > ids = childIds.getOrDefault( rootId, Collections.emptyList() );
			List< WorkItem > children = new ArrayList<>( ids.size() );
			for ( Integer id : ids ) {
				children.add( arena.get( id ) );
			}
			return children;
		} finally {
			structureLock.unlock();
		}
	}

	/** Units of work in tree order: a root without subdirectories or the children of a root */
	List< WorkItem > getLeaves() {
		return leaves;
	}

	/** Every item in tree order, roots before their children */
	List< WorkItem > getItems() {
		return allItems;
	}

	/** Next leaf waiting for a scan, skipping the given ones and those being removed */
	WorkItem nextUnread( Set< WorkItem > skipped ) {
		for ( WorkItem leaf : leaves ) {
			if ( leaf.getState() == ProcessState.QUEUED && ! leaf.isRemoving() && ! skipped.contains( leaf ) ) {
				return leaf;
			}
		}
		return null;
	}

	/** Leaves holding a table that wasn't classified yet, in tree order */
	List< WorkItem > getReadLeaves() {
		List< WorkItem > read = new ArrayList<>();
		for ( WorkItem leaf : leaves ) {
			if ( leaf.getState() == ProcessState.READ && ! leaf.isRemoving() ) {
				read.add( leaf );
			}
		}
		return read;
	}

	boolean hasWork( boolean classify ) {
		for ( WorkItem leaf : leaves ) {
			ProcessState state = leaf.getState();
			if ( leaf.isRemoving() ) {
				continue;
			}
			if ( state == ProcessState.QUEUED || ( classify && state == ProcessState.READ ) ) {
				return true;
			}
		}
		return false;
	}

	/** Every leaf has been scanned and at least one of them successfully */
	boolean isAllScanned() {
		boolean success = false;
		for ( WorkItem leaf : leaves ) {
			ProcessState state = leaf.getState();
			if ( state == ProcessState.QUEUED || state == ProcessState.SCANNING ) {
				return false;
			}
			success |= state.hasTable();
		}
		return success;
	}

	private void publish() {
		List< WorkItem > newLeaves = new ArrayList<>();
		List< WorkItem > newItems = new ArrayList<>();
		for ( Integer rootId : rootIds ) {
			WorkItem root = arena.get( rootId );
			newItems.add( root );
			List< Integer > children = childIds.get( rootId );
			if ( ! containerIds.contains( rootId ) ) {
				newLeaves.add( root );
			}
			for ( Integer childId : children ) {
				WorkItem child = arena.get( childId );
				newItems.add( child );
				newLeaves.add( child );
			}
		}
		leaves = Collections.unmodifiableList( newLeaves );
		allItems = Collections.unmodifiableList( newItems );
	}
}
