package iks.trapsorter;

import net.jpountz.xxhash.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

import static iks.trapsorter.Utils.getFileSizeNice;

/**
 * Sorts classified images into one directory per label: {@code <output>/<label>/<original filename>}.
 * Images are linked symbolically or copied; a copy is verified by comparing xxHash64 checksums.
 */
public class ClassificationExporter {
	private static final Logger log = LoggerFactory.getLogger( ClassificationExporter.class );
	private static final Logger performanceLog = LoggerFactory.getLogger( "performance.ClassificationExporter" );
	private static final long HASH_SEED = 0x9747b2842093420L;
	private static final int BUFFER_SIZE = 64 * 1024;

	private static final XXHashFactory factory = XXHashFactory.fastestInstance();

	private final ExportMode mode;

	public ClassificationExporter( ExportMode mode ) {
		this.mode = mode;
	}

	/**
	 * @param labels vocabulary; only labels present in the records get a directory
	 * @throws FileAlreadyExistsException if a label directory exists already
	 */
	public void export( Path outputDir, List< ImageRecord > records, List< String > labels ) throws IOException {
		long startTime = System.nanoTime();
		log.info( "Writing output to directory '{}'", outputDir );
		Files.createDirectories( outputDir );
		long bytes = 0;
		for ( String label : labels ) {
			List< ImageRecord > labeled = new ArrayList<>();
			for ( ImageRecord record : records ) {
				if ( label.equals( record.getLabel() ) ) {
					labeled.add( record );
				}
			}
			if ( labeled.isEmpty() ) {
				continue;
			}
			Path targetDir = outputDir.resolve( label );
			log.debug( "Creating class directory '{}'", targetDir );
			// fails on an existing directory: results of an earlier run must not be mixed in
			Files.createDirectory( targetDir );
			for ( ImageRecord record : labeled ) {
				bytes += materialize( record.getPath(), targetDir.resolve( record.getFilename() ) );
			}
		}
		performanceLog.debug(
				"{} images ({}) exported to '{}' in {}", records.size(), getFileSizeNice( bytes ), outputDir,
				Utils.asHumanReadableDelay( startTime )
		);
	}

	private long materialize( Path source, Path target ) throws IOException {
		Path absoluteSource = source.toAbsolutePath();
		if ( mode == ExportMode.SYMLINK ) {
			Files.createSymbolicLink( target, absoluteSource );
			return 0;
		}
		Files.copy( absoluteSource, target, StandardCopyOption.COPY_ATTRIBUTES );
		long sourceHash = checksum( absoluteSource );
		long targetHash = checksum( target );
		if ( sourceHash != targetHash ) {
			throw new IOException( String.format(
					"Copy of '%s' is corrupted: checksum %016x, expected %016x", source, targetHash, sourceHash
			) );
		}
		return Files.size( target );
	}

	static long checksum( Path file ) throws IOException {
		try ( InputStream in = Files.newInputStream( file );
			  StreamingXXHash64 hash64 = factory.newStreamingHash64( HASH_SEED ) ) {
			byte[] buffer = new byte[ BUFFER_SIZE ];
			int read;
			while ( ( read = in.read( buffer ) ) != -1 ) {
				hash64.update( buffer, 0, read );
			}
			return hash64.getValue();
		}
	}
}
