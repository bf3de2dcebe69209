package iks.trapsorter;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Decoded MakerNote fields. A field that couldn't be decoded has no value.
 */
public final class MakerNote {
	private final EnumMap< MakerNoteField, Object > values = new EnumMap<>( MakerNoteField.class );

	void put( MakerNoteField field, Object value ) {
		if ( value != null ) {
			values.put( field, value );
		}
	}

	public boolean has( MakerNoteField field ) {
		return values.containsKey( field );
	}

	/** @return single 16-bit value or null if the field is absent */
	public Integer getInt( MakerNoteField field ) {
		Object value = values.get( field );
		if ( value != null && ! ( value instanceof Integer ) ) {
			throw new IllegalArgumentException( field + " is not a single number field" );
		}
		return (Integer) value;
	}

	/** @return copy of repeated 16-bit values or null if the field is absent */
	public int[] getInts( MakerNoteField field ) {
		Object value = values.get( field );
		if ( value != null && ! ( value instanceof int[] ) ) {
			throw new IllegalArgumentException( field + " is not a repeated number field" );
		}
		return value == null ? null : ( (int[]) value ).clone();
	}

	public byte[] getBytes( MakerNoteField field ) {
		Object value = values.get( field );
		if ( value != null && ! ( value instanceof byte[] ) ) {
			throw new IllegalArgumentException( field + " is not a byte string field" );
		}
		return value == null ? null : ( (byte[]) value ).clone();
	}

	/** Byte string field as text with every NUL byte dropped */
	public String getText( MakerNoteField field ) {
		byte[] raw = getBytes( field );
		if ( raw == null ) {
			return null;
		}
		byte[] text = new byte[ raw.length ];
		int length = 0;
		for ( byte b : raw ) {
			if ( b != 0 ) {
				text[ length ++ ] = b;
			}
		}
		return new String( text, 0, length, StandardCharsets.ISO_8859_1 );
	}

	/** @return the original capture time or null if absent or not a valid date */
	public LocalDateTime getDateTimeOriginal() {
		int[] t = getInts( MakerNoteField.DATE_TIME_ORIGINAL );
		if ( t == null ) {
			return null;
		}
		try {
			return LocalDateTime.of( t[ 5 ], t[ 3 ], t[ 4 ], t[ 2 ], t[ 1 ], t[ 0 ] );
		} catch ( DateTimeException dte ) {
			return null;
		}
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder( "MakerNote{" );
		for ( Map.Entry< MakerNoteField, Object > entry : values.entrySet() ) {
			Object value = entry.getValue();
			builder.append( entry.getKey() ).append( '=' );
			if ( value instanceof int[] ) {
				builder.append( Arrays.toString( (int[]) value ) );
			} else if ( value instanceof byte[] ) {
				builder.append( '"' ).append( getText( entry.getKey() ) ).append( '"' );
			} else {
				builder.append( value );
			}
			builder.append( ", " );
		}
		if ( ! values.isEmpty() ) {
			builder.setLength( builder.length() - 2 );
		}
		return builder.append( '}' ).toString();
	}
}
