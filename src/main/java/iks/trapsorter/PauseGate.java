package iks.trapsorter;

import org.slf4j.*;

import java.util.concurrent.locks.*;

/**
 * Global pause flag. The worker waits at the gate before it picks the next item; running operations see
 * the flag through their progress callback.
 */
class PauseGate {
	private static final Logger log = LoggerFactory.getLogger( PauseGate.class );

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition resumed = lock.newCondition();
	private volatile boolean paused;

	void pause() {
		lock.lock();
		try {
			paused = true;
		} finally {
			lock.unlock();
		}
		log.debug( "Processing paused" );
	}

	void resume() {
		lock.lock();
		try {
			paused = false;
			resumed.signalAll();
		} finally {
			lock.unlock();
		}
		log.debug( "Processing resumed" );
	}

	boolean isPaused() {
		return paused;
	}

	/** Blocks while paused */
	void awaitResumed() throws InterruptedException {
		if ( ! paused ) {
			return;
		}
		lock.lock();
		try {
			while ( paused ) {
				log.trace( "Waiting for resume" );
				resumed.await();
			}
		} finally {
			lock.unlock();
		}
	}
}
