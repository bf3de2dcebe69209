package iks.trapsorter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class WorkTreeTest {
	private final WorkTree tree = new WorkTree();

	@Test
	void rootWithoutSubdirectoriesIsLeaf() {
		WorkItem root = tree.addRoot( Path.of( "/traps/a" ), Collections.emptyList() );

		assertEquals( List.of( root ), tree.getLeaves() );
		assertEquals( List.of( root ), tree.getItems() );
	}

	@Test
	void subdirectoriesAreLeavesInTreeOrder() {
		WorkItem first = tree.addRoot( Path.of( "/traps/a" ), List.of( Path.of( "/traps/a/1" ), Path.of( "/traps/a/2" ) ) );
		WorkItem second = tree.addRoot( Path.of( "/traps/b" ), Collections.emptyList() );

		List< WorkItem > leaves = tree.getLeaves();
		assertEquals( 3, leaves.size() );
		assertEquals( Path.of( "/traps/a/1" ), leaves.get( 0 ).getDirectory() );
		assertEquals( Path.of( "/traps/a/2" ), leaves.get( 1 ).getDirectory() );
		assertSame( second, leaves.get( 2 ) );
		assertEquals( first.getId(), leaves.get( 0 ).getParentId() );
		assertEquals( 4, tree.getItems().size() );
		assertEquals( 2, tree.getChildren( first.getId() ).size() );
	}

	@Test
	void rejectsDuplicateRoot() {
		tree.addRoot( Path.of( "/traps/a" ), Collections.emptyList() );

		assertNull( tree.addRoot( Path.of( "/traps/a" ), Collections.emptyList() ) );
		assertEquals( 1, tree.getItems().size() );
	}

	@Test
	void rootOfRemovedSubdirectoriesNeverBecomesLeaf() {
		WorkItem root = tree.addRoot( Path.of( "/traps/a" ), List.of( Path.of( "/traps/a/1" ) ) );
		WorkItem child = tree.getChildren( root.getId() ).get( 0 );

		tree.remove( child );

		assertTrue( child.isRemoved() );
		assertTrue( tree.getLeaves().isEmpty() );
		assertEquals( List.of( root ), tree.getItems() );
		assertNull( tree.nextUnread( new HashSet<>() ) );
	}

	@Test
	void rootWithSubdirectoriesCantBeRemovedFirst() {
		WorkItem root = tree.addRoot( Path.of( "/traps/a" ), List.of( Path.of( "/traps/a/1" ) ) );

		assertThrows( IllegalStateException.class, () -> tree.remove( root ) );
	}

	@Test
	void lookupUsesPublishedItems() {
		WorkItem root = tree.addRoot( Path.of( "/traps/a" ), Collections.emptyList() );

		assertSame( root, tree.lookup( root.getId() ) );
		tree.remove( root );
		assertNull( tree.lookup( root.getId() ) );
		assertNull( tree.get( root.getId() ) );
		assertNull( tree.findRoot( Path.of( "/traps/a" ) ) );
	}

	@Test
	void nextUnreadSkipsGivenItems() {
		tree.addRoot( Path.of( "/traps/a" ), List.of( Path.of( "/traps/a/1" ), Path.of( "/traps/a/2" ) ) );
		WorkItem first = tree.getLeaves().get( 0 );

		assertSame( first, tree.nextUnread( new HashSet<>() ) );
		assertSame( tree.getLeaves().get( 1 ), tree.nextUnread( new HashSet<>( List.of( first ) ) ) );
		assertTrue( tree.hasWork( false ) );
		assertFalse( tree.isAllScanned() );
	}

	@Test
	void itemBeingRemovedIsNotPicked() {
		tree.addRoot( Path.of( "/traps/a" ), List.of( Path.of( "/traps/a/1" ), Path.of( "/traps/a/2" ) ) );
		WorkItem first = tree.getLeaves().get( 0 );
		WorkItem second = tree.getLeaves().get( 1 );

		first.markRemoving();

		assertTrue( first.isRemoving() );
		assertSame( second, tree.nextUnread( new HashSet<>() ) );
		second.markRemoving();
		assertNull( tree.nextUnread( new HashSet<>() ) );
		assertFalse( tree.hasWork( true ) );
	}

	@Test
	void scannedItemBeingRemovedIsNotClassified() {
		WorkItem root = tree.addRoot( Path.of( "/traps/a" ), Collections.emptyList() );
		root.lock();
		try {
			root.moveTo( ProcessState.SCANNING );
			root.moveTo( ProcessState.READ, new EventTable( Collections.emptyList() ) );
		} finally {
			root.unlock();
		}
		assertEquals( List.of( root ), tree.getReadLeaves() );

		root.markRemoving();

		assertTrue( tree.getReadLeaves().isEmpty() );
		assertFalse( tree.hasWork( true ) );
	}

	@Test
	void emptyTreeIsNotScanned() {
		assertFalse( tree.isAllScanned() );
		assertFalse( tree.hasWork( true ) );
	}
}
