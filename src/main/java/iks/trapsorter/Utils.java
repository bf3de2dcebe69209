package iks.trapsorter;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class Utils {
	private Utils() {}

	private static final String[] unitNames = { "bytes", "KB", "MB", "GB", "TB" };

	/**
	 * Formats a nanosecond interval for log messages.
	 *
	 * @return "N ns", "N.NNN µs", "N.NNN ms" below a second, "[H:]MM:SS.fff" above it
	 */
	public static String asHumanReadableInterval( long intervalNs ) {
		if ( intervalNs < 1_000L ) {
			return intervalNs + " ns";
		}
		if ( intervalNs < 1_000_000L ) {
			return String.format( Locale.ROOT, "%.3f µs", intervalNs / 1e3 );
		}
		if ( intervalNs < 1_000_000_000L ) {
			return String.format( Locale.ROOT, "%.3f ms", intervalNs / 1e6 );
		}
		long hours = TimeUnit.NANOSECONDS.toHours( intervalNs );
		long minutes = TimeUnit.NANOSECONDS.toMinutes( intervalNs ) % 60;
		long seconds = TimeUnit.NANOSECONDS.toSeconds( intervalNs ) % 60;
		long millis = TimeUnit.NANOSECONDS.toMillis( intervalNs ) % 1000;
		StringBuilder builder = new StringBuilder();
		if ( hours > 0 ) {
			builder.append( hours ).append( ':' );
		}
		return builder.append( String.format( Locale.ROOT, "%02d:%02d.%03d", minutes, seconds, millis ) ).toString();
	}

	/**
	 * @param fromTimeNs start time taken from {@link System#nanoTime()}
	 * @see Utils#asHumanReadableInterval(long)
	 */
	public static String asHumanReadableDelay( long fromTimeNs ) {
		return asHumanReadableInterval( System.nanoTime() - fromTimeNs );
	}

	public static String getFileSizeNice( long sizeInBytes ) {
		String theUnitName = unitNames[ 0 ];
		double size = sizeInBytes;
		for ( String unitName : unitNames ) {
			theUnitName = unitName;
			if ( size < 1024 ) {
				break;
			}
			size /= 1024.;
		}
		return ( (long) ( size * 100 ) ) / 100. + " " + theUnitName;
	}
}
