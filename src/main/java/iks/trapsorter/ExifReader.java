package iks.trapsorter;

import org.slf4j.*;

import java.io.*;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Locates the raw MakerNote blob of a JPEG file.
 * <p>
 * Walks JPEG markers up to the first APP1 "Exif" segment, then the TIFF structure inside it:
 * IFD0 -> Exif sub-IFD (tag 0x8769) -> MakerNote (tag 0x927C). Only the segments in front of the
 * image data are read.
 */
class ExifReader {
	private static final Logger log = LoggerFactory.getLogger( ExifReader.class );

	private static final int MARKER_SOI = 0xD8;
	private static final int MARKER_EOI = 0xD9;
	private static final int MARKER_SOS = 0xDA;
	private static final int MARKER_APP1 = 0xE1;
	private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes( StandardCharsets.ISO_8859_1 );

	static final int TAG_EXIF_IFD_POINTER = 0x8769;
	static final int TAG_MAKER_NOTE = 0x927C;
	private static final int TIFF_MAGIC = 42;
	private static final int IFD_ENTRY_SIZE = 12;
	/** Byte sizes of TIFF field types 1..13 */
	private static final int[] TYPE_SIZES = { 0, 1, 1, 2, 4, 8, 1, 1, 2, 4, 8, 4, 8, 4 };

	byte[] readMakerNote( Path file ) throws IOException {
		try ( DataInputStream in = new DataInputStream( new BufferedInputStream( Files.newInputStream( file ) ) ) ) {
			ByteBuffer tiff = findExifSegment( in, file );
			return findMakerNote( tiff, file );
		}
	}

	private ByteBuffer findExifSegment( DataInputStream in, Path file ) throws IOException {
		if ( in.readUnsignedByte() != 0xFF || in.readUnsignedByte() != MARKER_SOI ) {
			throw new MakerNoteFormatException( "Not a JPEG file (no SOI marker): " + file );
		}
		try {
			while ( true ) {
				int marker = nextMarker( in );
				if ( marker == MARKER_SOS || marker == MARKER_EOI ) {
					break;
				}
				if ( marker == 0x01 || ( marker >= 0xD0 && marker <= 0xD7 ) ) {
					// standalone marker without payload
					continue;
				}
				int length = in.readUnsignedShort() - 2;
				if ( length < 0 ) {
					throw new MakerNoteFormatException( "Broken JPEG segment length in " + file );
				}
				if ( marker != MARKER_APP1 || length < EXIF_HEADER.length ) {
					in.skipNBytes( length );
					continue;
				}
				byte[] payload = new byte[ length ];
				in.readFully( payload );
				if ( startsWithExifHeader( payload ) ) {
					log.trace( "Found Exif segment of {} bytes in '{}'", length, file );
					return ByteBuffer.wrap( payload, EXIF_HEADER.length, length - EXIF_HEADER.length ).slice();
				}
			}
		} catch ( EOFException eof ) {
			throw new MakerNoteFormatException( "Unexpected end of JPEG file " + file );
		}
		throw new MakerNoteFormatException( "No Exif segment in " + file );
	}

	private static int nextMarker( DataInputStream in ) throws IOException {
		int b = in.readUnsignedByte();
		if ( b != 0xFF ) {
			throw new MakerNoteFormatException( String.format( "Expected JPEG marker but found 0x%02x", b ) );
		}
		do {
			// 0xFF fill bytes may precede a marker
			b = in.readUnsignedByte();
		} while ( b == 0xFF );
		return b;
	}

	private static boolean startsWithExifHeader( byte[] payload ) {
		for ( int i = 0; i < EXIF_HEADER.length; ++ i ) {
			if ( payload[ i ] != EXIF_HEADER[ i ] ) {
				return false;
			}
		}
		return true;
	}

	private byte[] findMakerNote( ByteBuffer tiff, Path file ) throws MakerNoteFormatException {
		try {
			if ( tiff.get( 0 ) == 'I' && tiff.get( 1 ) == 'I' ) {
				tiff.order( ByteOrder.LITTLE_ENDIAN );
			} else if ( tiff.get( 0 ) == 'M' && tiff.get( 1 ) == 'M' ) {
				tiff.order( ByteOrder.BIG_ENDIAN );
			} else {
				throw new MakerNoteFormatException( "Unknown TIFF byte order in " + file );
			}
			if ( tiff.getShort( 2 ) != TIFF_MAGIC ) {
				throw new MakerNoteFormatException( "Bad TIFF header in " + file );
			}
			int exifEntry = findEntry( tiff, tiff.getInt( 4 ), TAG_EXIF_IFD_POINTER );
			if ( exifEntry < 0 ) {
				throw new MakerNoteFormatException( "No Exif sub-IFD in " + file );
			}
			int makerNoteEntry = findEntry( tiff, tiff.getInt( exifEntry + 8 ), TAG_MAKER_NOTE );
			if ( makerNoteEntry < 0 ) {
				throw new MakerNoteFormatException( "No MakerNote tag in " + file );
			}
			return readEntryValue( tiff, makerNoteEntry );
		} catch ( IndexOutOfBoundsException | BufferUnderflowException | IllegalArgumentException e ) {
			throw new MakerNoteFormatException( "Exif structure points outside of its segment in " + file );
		}
	}

	/** @return absolute position of the IFD entry with the given tag or -1 */
	private static int findEntry( ByteBuffer tiff, int ifdOffset, int tag ) {
		int count = Short.toUnsignedInt( tiff.getShort( ifdOffset ) );
		for ( int i = 0; i < count; ++ i ) {
			int entry = ifdOffset + 2 + i * IFD_ENTRY_SIZE;
			if ( Short.toUnsignedInt( tiff.getShort( entry ) ) == tag ) {
				return entry;
			}
		}
		return -1;
	}

	private static byte[] readEntryValue( ByteBuffer tiff, int entry ) {
		int type = Short.toUnsignedInt( tiff.getShort( entry + 2 ) );
		long count = Integer.toUnsignedLong( tiff.getInt( entry + 4 ) );
		int typeSize = type < TYPE_SIZES.length ? TYPE_SIZES[ type ] : 1;
		long byteLength = count * Math.max( typeSize, 1 );
		if ( byteLength > tiff.limit() ) {
			throw new IllegalArgumentException( "Value length " + byteLength + " exceeds Exif segment" );
		}
		int valueOffset = byteLength <= 4 ? entry + 8 : tiff.getInt( entry + 8 );
		byte[] value = new byte[ (int) byteLength ];
		ByteBuffer view = tiff.duplicate();
		view.position( valueOffset );
		view.get( value );
		return value;
	}
}
