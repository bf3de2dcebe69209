package iks.trapsorter;

import com.typesafe.config.*;

import java.time.Duration;

/**
 * Settings of the directory scan, read from the {@code trapsorter.scan} section of the configuration.
 */
public final class ScanOptions {
	private final int expectedVersion;
	private final Duration eventWindow;
	private final int progressStepPercent;

	public ScanOptions( int expectedVersion, Duration eventWindow, int progressStepPercent ) {
		if ( progressStepPercent < 1 || progressStepPercent > 100 ) {
			throw new IllegalArgumentException( "Progress step must be within 1..100%: " + progressStepPercent );
		}
		this.expectedVersion = expectedVersion;
		this.eventWindow = eventWindow;
		this.progressStepPercent = progressStepPercent;
	}

	/** Defaults from reference.conf overridden by application.conf and system properties */
	public static ScanOptions load() {
		return fromConfig( ConfigFactory.load() );
	}

	public static ScanOptions fromConfig( Config config ) {
		Config scan = config.getConfig( "trapsorter.scan" );
		return new ScanOptions(
				scan.getInt( "makernote-version" ),
				scan.getDuration( "event-window" ),
				scan.getInt( "progress-step-percent" )
		);
	}

	public int getExpectedVersion() {
		return expectedVersion;
	}

	public Duration getEventWindow() {
		return eventWindow;
	}

	public int getProgressStepPercent() {
		return progressStepPercent;
	}

	public DirectoryScanner createScanner() {
		return new DirectoryScanner(
				new ExifReader(), new MakerNoteDecoder( expectedVersion ),
				new EventConsolidator( eventWindow ), progressStepPercent
		);
	}
}
