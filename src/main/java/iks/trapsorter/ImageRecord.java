package iks.trapsorter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Metadata of a single camera-trap image plus the keys derived by {@link EventConsolidator}.
 * The decoded part never changes; label and confidence are set by classification.
 */
public final class ImageRecord {
	/** No duplicate sequence index in the trigger event */
	public static final int UNIQUE = 0;
	/** Some sequence index occurs twice but every copy carries the same label */
	public static final int REDUNDANT = 1;
	/** Some sequence index occurs twice and the copies disagree on the label */
	public static final int CONFLICT = 2;

	private final Path path;
	private final String filename;
	private final LocalDateTime timestamp;
	private final String serialNo;
	private final int event1;
	private final int event2;
	private final int sequenceIdx;
	private final int sequenceMax;
	private final Integer ambientTemp;
	private final Integer brightness;
	private final Integer sharpness;
	private final Integer saturation;
	private final Integer contrast;

	private String simpleEventKey;
	private String sortKey;
	private String eventKey;
	private int duplicate;
	private volatile String label;
	private volatile float confidence;

	ImageRecord(
			Path path, LocalDateTime timestamp, String serialNo, int event1, int event2,
			int sequenceIdx, int sequenceMax, Integer ambientTemp,
			Integer brightness, Integer sharpness, Integer saturation, Integer contrast ) {
		this.path = Objects.requireNonNull( path );
		this.filename = path.getFileName().toString();
		this.timestamp = Objects.requireNonNull( timestamp );
		this.serialNo = Objects.requireNonNull( serialNo );
		this.event1 = event1;
		this.event2 = event2;
		this.sequenceIdx = sequenceIdx;
		this.sequenceMax = sequenceMax;
		this.ambientTemp = ambientTemp;
		this.brightness = brightness;
		this.sharpness = sharpness;
		this.saturation = saturation;
		this.contrast = contrast;
	}

	/**
	 * Builds the record of an image file from its decoded MakerNote.
	 *
	 * @throws MakerNoteFormatException if a field needed for event grouping is missing
	 */
	static ImageRecord of( Path path, MakerNote makerNote ) throws MakerNoteFormatException {
		LocalDateTime timestamp = makerNote.getDateTimeOriginal();
		int[] sequence = makerNote.getInts( MakerNoteField.SEQUENCE );
		int[] event = makerNote.getInts( MakerNoteField.EVENT_NUMBER );
		String serialNo = makerNote.getText( MakerNoteField.SERIAL_NUMBER );
		if ( timestamp == null || sequence == null || event == null || serialNo == null ) {
			throw new MakerNoteFormatException( "MakerNote of " + path + " lacks date, sequence, event or serial number" );
		}
		return new ImageRecord(
				path, timestamp, serialNo, event[ 0 ], event[ 1 ], sequence[ 0 ], sequence[ 1 ],
				makerNote.getInt( MakerNoteField.AMBIENT_TEMPERATURE ),
				makerNote.getInt( MakerNoteField.BRIGHTNESS ),
				makerNote.getInt( MakerNoteField.SHARPNESS ),
				makerNote.getInt( MakerNoteField.SATURATION ),
				makerNote.getInt( MakerNoteField.CONTRAST )
		);
	}

	public Path getPath() {
		return path;
	}

	public String getFilename() {
		return filename;
	}

	public LocalDateTime getTimestamp() {
		return timestamp;
	}

	/** Seconds since epoch taking the camera clock as UTC */
	public long getEpochSecond() {
		return timestamp.toEpochSecond( ZoneOffset.UTC );
	}

	public String getSerialNo() {
		return serialNo;
	}

	public int getEvent1() {
		return event1;
	}

	public int getEvent2() {
		return event2;
	}

	public int getSequenceIdx() {
		return sequenceIdx;
	}

	public int getSequenceMax() {
		return sequenceMax;
	}

	/** Ambient temperature in °C */
	public Integer getAmbientTemp() {
		return ambientTemp;
	}

	public int getHour() {
		return timestamp.getHour();
	}

	public Integer getBrightness() {
		return brightness;
	}

	public Integer getSharpness() {
		return sharpness;
	}

	public Integer getSaturation() {
		return saturation;
	}

	public Integer getContrast() {
		return contrast;
	}

	public String getSimpleEventKey() {
		return simpleEventKey;
	}

	void setSimpleEventKey( String simpleEventKey ) {
		this.simpleEventKey = simpleEventKey;
	}

	public String getSortKey() {
		return sortKey;
	}

	void setSortKey( String sortKey ) {
		this.sortKey = sortKey;
	}

	/** Extended event key: the simple key merged over closely following trigger events */
	public String getEventKey() {
		return eventKey;
	}

	void setEventKey( String eventKey ) {
		this.eventKey = eventKey;
	}

	/** @return {@link #UNIQUE}, {@link #REDUNDANT} or {@link #CONFLICT} */
	public int getDuplicate() {
		return duplicate;
	}

	void setDuplicate( int duplicate ) {
		this.duplicate = duplicate;
	}

	public String getLabel() {
		return label;
	}

	public float getConfidence() {
		return confidence;
	}

	void setLabel( String label, float confidence ) {
		this.label = label;
		this.confidence = confidence;
	}

	@Override
	public String toString() {
		return filename + " [" + serialNo + " " + timestamp + " event " + event1 + "/" + event2
				+ " seq " + sequenceIdx + "/" + sequenceMax + ( label == null ? "" : " label " + label ) + "]";
	}
}
