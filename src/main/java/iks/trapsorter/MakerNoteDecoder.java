package iks.trapsorter;

import org.slf4j.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Decodes the RECONYX HyperFire MakerNote binary record.
 * <p>
 * Every field is read from its span (up to the next field's offset), cut to the exact layout width.
 * A too short span leaves just that field undecoded. The version field is mandatory and must match
 * the expected magic value, otherwise the whole record is rejected.
 */
public class MakerNoteDecoder {
	private static final Logger log = LoggerFactory.getLogger( MakerNoteDecoder.class );
	public static final int HYPERFIRE_VERSION = 0xF101;

	private final int expectedVersion;

	public MakerNoteDecoder() {
		this( HYPERFIRE_VERSION );
	}

	public MakerNoteDecoder( int expectedVersion ) {
		this.expectedVersion = expectedVersion;
	}

	public MakerNote decode( byte[] blob ) throws MakerNoteFormatException {
		ByteBuffer buffer = ByteBuffer.wrap( blob ).order( ByteOrder.LITTLE_ENDIAN );
		MakerNote makerNote = new MakerNote();
		for ( MakerNoteField field : MakerNoteField.values() ) {
			makerNote.put( field, readField( field, buffer ) );
		}
		Integer version = makerNote.getInt( MakerNoteField.VERSION );
		if ( version == null ) {
			throw new MakerNoteFormatException( "MakerNote version is absent" );
		}
		if ( version != expectedVersion ) {
			throw new MakerNoteFormatException( String.format(
					"Unexpected MakerNote version 0x%04x (expected 0x%04x)", version, expectedVersion
			) );
		}
		return makerNote;
	}

	private Object readField( MakerNoteField field, ByteBuffer buffer ) {
		int length = buffer.limit();
		int span = Math.min( field.spanEnd( length ), length ) - field.offset;
		int width = field.layout.width();
		if ( span < width ) {
			log.warn(
					"MakerNote field {} ({}) needs {} bytes at offset 0x{} but only {} available",
					field, field.layout, width, Integer.toHexString( field.offset ), Math.max( span, 0 )
			);
			return null;
		}
		buffer.position( field.offset );
		return field.layout.read( buffer );
	}
}
