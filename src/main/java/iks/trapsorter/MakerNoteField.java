package iks.trapsorter;

import static iks.trapsorter.FieldLayout.*;

/**
 * RECONYX HyperFire MakerNote field table in offset order.
 * A field's byte span ends where the next field begins (the last one ends with the blob).
 */
public enum MakerNoteField {
	VERSION( 0x00, u16() ),
	FIRMWARE_VERSION( 0x02, u16() ),
	TRIGGER_MODE( 0x0c, bytes( 2 ) ),
	/** index, max */
	SEQUENCE( 0x0e, u16( 2 ) ),
	/** num1, num2 */
	EVENT_NUMBER( 0x12, u16( 2 ) ),
	/** second, minute, hour, month, day, year */
	DATE_TIME_ORIGINAL( 0x16, u16( 6 ) ),
	MOON_PHASE( 0x24, u16() ),
	AMBIENT_TEMPERATURE_FAHRENHEIT( 0x26, i16() ),
	AMBIENT_TEMPERATURE( 0x28, i16() ),
	SERIAL_NUMBER( 0x2a, bytes( 30 ) ),
	CONTRAST( 0x48, u16() ),
	BRIGHTNESS( 0x4a, u16() ),
	SHARPNESS( 0x4c, u16() ),
	SATURATION( 0x4e, u16() ),
	INFRARED_ILLUMINATOR( 0x50, u16() ),
	MOTION_SENSITIVITY( 0x52, u16() ),
	BATTERY_VOLTAGE( 0x54, u16() ),
	USER_LABEL( 0x56, bytes( 22 ) );

	final int offset;
	final FieldLayout layout;

	MakerNoteField( int offset, FieldLayout layout ) {
		this.offset = offset;
		this.layout = layout;
	}

	/** Offset where this field's usable span ends for a blob of the given length */
	int spanEnd( int blobLength ) {
		MakerNoteField[] fields = values();
		int next = ordinal() + 1;
		return next < fields.length ? fields[ next ].offset : blobLength;
	}
}
