package iks.trapsorter;

import org.slf4j.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

import static iks.trapsorter.Utils.getFileSizeNice;

/**
 * Reads the metadata of all camera-trap JPEG files directly inside one directory (no recursion)
 * and consolidates them into an {@link EventTable}.
 * <p>
 * A file with unreadable or foreign metadata is skipped. Only a directory without a single usable
 * image fails the scan.
 */
public class DirectoryScanner {
	private static final Logger log = LoggerFactory.getLogger( DirectoryScanner.class );
	private static final Logger performanceLog = LoggerFactory.getLogger( "performance.DirectoryScanner" );
	public static final int DEFAULT_PROGRESS_STEP_PERCENT = 2;

	private final ExifReader exifReader;
	private final MakerNoteDecoder decoder;
	private final EventConsolidator consolidator;
	private final int progressStepPercent;

	public DirectoryScanner() {
		this( new ExifReader(), new MakerNoteDecoder(), new EventConsolidator(), DEFAULT_PROGRESS_STEP_PERCENT );
	}

	DirectoryScanner(
			ExifReader exifReader, MakerNoteDecoder decoder, EventConsolidator consolidator, int progressStepPercent ) {
		this.exifReader = exifReader;
		this.decoder = decoder;
		this.consolidator = consolidator;
		this.progressStepPercent = progressStepPercent;
	}

	public EventConsolidator getConsolidator() {
		return consolidator;
	}

	/**
	 * @param progress gets the share of processed files every few percent; false stops the scan
	 * @return table sorted by sort key
	 * @throws NoImagesFoundException if the directory has no usable image or can't be listed
	 * @throws ProcessingInterruptedException if the progress listener asked to stop
	 */
	public EventTable scan( Path directory, ProgressListener progress )
			throws NoImagesFoundException, ProcessingInterruptedException {
		long startTime = System.nanoTime();
		log.info( "Scanning directory '{}'", directory );
		List< Path > imageFiles = listImageFiles( directory );
		int fileCount = imageFiles.size();
		log.info( "Found {} .jpg files in '{}'", fileCount, directory );

		// report progress every few percent of files
		int step = Math.max( 1, fileCount * progressStepPercent / 100 );
		List< ImageRecord > records = new ArrayList<>( fileCount );
		long bytesRead = 0;
		for ( int i = 0; i < fileCount; ++ i ) {
			if ( i % step == 0 && ! progress.onProgress( i * 100 / fileCount ) ) {
				throw new ProcessingInterruptedException( "Scan of '" + directory + "' interrupted at file " + i );
			}
			Path file = imageFiles.get( i );
			try {
				byte[] blob = exifReader.readMakerNote( file );
				bytesRead += blob.length;
				records.add( ImageRecord.of( file, decoder.decode( blob ) ) );
			} catch ( IOException ioe ) {
				log.warn( "Skipping file '{}' - {}: {}", file.getFileName(), ioe.getClass().getSimpleName(), ioe.getMessage() );
			}
		}
		if ( records.isEmpty() ) {
			throw new NoImagesFoundException( directory );
		}
		List< ImageRecord > consolidated = consolidator.consolidate( records );
		if ( ! progress.onProgress( 100 ) ) {
			throw new ProcessingInterruptedException( "Scan of '" + directory + "' interrupted after the last file" );
		}
		EventTable table = new EventTable( consolidated );
		performanceLog.debug(
				"{} of {} files ({} of MakerNotes) in '{}' read in {}",
				records.size(), fileCount, getFileSizeNice( bytesRead ), directory, Utils.asHumanReadableDelay( startTime )
		);
		return table;
	}

	private static List< Path > listImageFiles( Path directory ) throws NoImagesFoundException {
		List< Path > files = new ArrayList<>();
		try ( DirectoryStream< Path > stream = Files.newDirectoryStream( directory ) ) {
			for ( Path entry : stream ) {
				if ( isImageFile( entry ) && Files.isRegularFile( entry ) ) {
					files.add( entry );
				}
			}
		} catch ( IOException ioe ) {
			throw new NoImagesFoundException( directory, ioe );
		} catch ( DirectoryIteratorException die ) {
			throw new NoImagesFoundException( directory, die.getCause() );
		}
		Collections.sort( files );
		return files;
	}

	static boolean isImageFile( Path file ) {
		String name = file.getFileName().toString().toLowerCase( Locale.ROOT );
		return name.endsWith( ".jpg" ) || name.endsWith( ".jpeg" );
	}
}
