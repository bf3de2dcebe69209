package iks.trapsorter;

import com.typesafe.config.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Settings of a classification run, read from the {@code trapsorter.classification} section of the
 * configuration. Immutable.
 */
public final class ClassificationOptions {
	private final Path outputDir;
	private final String outputSuffix;
	private final String modelPath;
	private final int batchSize;
	private final List< String > labels;
	private final boolean aggregateEvents;
	private final DuplicatePolicy duplicatePolicy;
	private final ExportMode exportMode;

	/**
	 * @param outputDir base directory of the results; null to write next to each input directory
	 */
	public ClassificationOptions(
			Path outputDir, String outputSuffix, String modelPath, int batchSize, List< String > labels,
			boolean aggregateEvents, DuplicatePolicy duplicatePolicy, ExportMode exportMode ) {
		if ( batchSize < 1 ) {
			throw new IllegalArgumentException( "Batch size must be positive: " + batchSize );
		}
		if ( labels.isEmpty() ) {
			throw new IllegalArgumentException( "Label vocabulary is empty" );
		}
		if ( new HashSet<>( labels ).size() != labels.size() ) {
			throw new IllegalArgumentException( "Label vocabulary has duplicates: " + labels );
		}
		this.outputDir = outputDir;
		this.outputSuffix = Objects.requireNonNull( outputSuffix );
		this.modelPath = modelPath;
		this.batchSize = batchSize;
		this.labels = List.copyOf( labels );
		this.aggregateEvents = aggregateEvents;
		this.duplicatePolicy = Objects.requireNonNull( duplicatePolicy );
		this.exportMode = Objects.requireNonNull( exportMode );
	}

	public static ClassificationOptions load() {
		return fromConfig( ConfigFactory.load() );
	}

	public static ClassificationOptions fromConfig( Config config ) {
		Config section = config.getConfig( "trapsorter.classification" );
		String outputDir = section.getString( "output-dir" );
		return new ClassificationOptions(
				outputDir.isBlank() ? null : Paths.get( outputDir ),
				section.getString( "output-suffix" ),
				section.getString( "model" ),
				section.getInt( "batch-size" ),
				section.getStringList( "labels" ),
				section.getBoolean( "aggregate-events" ),
				section.getEnum( DuplicatePolicy.class, "duplicate-policy" ),
				section.getEnum( ExportMode.class, "export-mode" )
		);
	}

	public Path getOutputDir() {
		return outputDir;
	}

	public String getOutputSuffix() {
		return outputSuffix;
	}

	/**
	 * Model reference for {@link Classifier} implementations that load one. The pipeline itself never reads it.
	 *
	 * @return configured reference; empty if none
	 */
	public String getModelPath() {
		return modelPath;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public List< String > getLabels() {
		return labels;
	}

	public boolean isAggregateEvents() {
		return aggregateEvents;
	}

	public DuplicatePolicy getDuplicatePolicy() {
		return duplicatePolicy;
	}

	public ExportMode getExportMode() {
		return exportMode;
	}

	/**
	 * Result directory of a work item: {@code <base>/<root>_<suffix>} for a root directory and
	 * {@code <base>/<root>_<suffix>/<subdirectory>} for a subdirectory. The base is the configured output
	 * directory or the parent of the root directory.
	 */
	public Path resolveOutputDir( Path rootDirectory, Path itemDirectory ) {
		Path absoluteRoot = rootDirectory.toAbsolutePath().normalize();
		Path base = outputDir != null ? outputDir : absoluteRoot.getParent();
		if ( base == null ) {
			base = absoluteRoot;
		}
		Path rootName = absoluteRoot.getFileName();
		Path target = base.resolve( ( rootName == null ? "root" : rootName.toString() ) + "_" + outputSuffix );
		if ( ! absoluteRoot.equals( itemDirectory.toAbsolutePath().normalize() ) ) {
			target = target.resolve( itemDirectory.getFileName().toString() );
		}
		return target;
	}

	@Override
	public String toString() {
		return "ClassificationOptions{outputDir=" + outputDir + ", suffix=" + outputSuffix + ", model=" + modelPath
				+ ", batchSize=" + batchSize + ", labels=" + labels + ", aggregateEvents=" + aggregateEvents
				+ ", duplicatePolicy=" + duplicatePolicy + ", exportMode=" + exportMode + "}";
	}
}
