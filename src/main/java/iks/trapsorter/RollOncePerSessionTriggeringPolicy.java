package iks.trapsorter;

import ch.qos.logback.core.rolling.TriggeringPolicyBase;

import java.io.File;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolls a log file over once, on the first event of the process, so that every run starts a fresh log.
 */
public class RollOncePerSessionTriggeringPolicy<E> extends TriggeringPolicyBase<E> {
	private static final Set< String > rolledFiles = ConcurrentHashMap.newKeySet();

	@Override
	public boolean isTriggeringEvent( File activeFile, E event ) {
		return rolledFiles.add( activeFile.getAbsolutePath() );
	}

	/** Lets the next event of every log file trigger a rollover again */
	static void reset() {
		rolledFiles.clear();
	}
}
