package iks.trapsorter;

import org.slf4j.*;

import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Scans camera-trap directories and logs what was found in each of them.
 */
public class TrapSorter {
	private static final Logger log = LoggerFactory.getLogger( TrapSorter.class );
	private static Thread mainThread;

	public static void main( String[] args ) {
		mainThread = Thread.currentThread();
		Runtime.getRuntime().addShutdownHook( new Thread() {
			@Override public void run() {
				log.info( "Interrupting processing by shutdown hook..." );
				mainThread.interrupt();
			}
		});

		if ( args.length == 0 ) {
			System.err.println( "Usage: trapsorter <camera-trap image directory>..." );
			System.exit( 1 );
		}
		ScanOptions scanOptions = ScanOptions.load();
		try ( PipelineController controller = new PipelineController( scanOptions.createScanner() ) ) {
			controller.addListener( new PipelineListener() {
				@Override
				public void failed( WorkItem item, Exception error ) {
					log.error( "'{}': {}", item.getDirectory(), error.getMessage() );
				}
			});
			for ( String arg : args ) {
				controller.addDir( Paths.get( arg ) );
			}
			controller.start();
			while ( ! controller.awaitIdle( 1, TimeUnit.SECONDS ) ) {
				log.trace( "Still scanning" );
			}
			for ( WorkItem item : controller.getLeaves() ) {
				log.info( "{}: {}", item.getDirectory(), item.describe() );
			}
			if ( ! controller.isAllScanned() ) {
				System.exit( 2 );
			}
		} catch ( InterruptedException ie ) {
			log.info( "Interrupted" );
		}
	}
}
