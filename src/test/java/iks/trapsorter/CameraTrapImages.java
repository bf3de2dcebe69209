package iks.trapsorter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Builds HyperFire MakerNotes and minimal JPEG files carrying them.
 */
final class CameraTrapImages {
	static final int MAKER_NOTE_LENGTH = 0x56 + 22;

	private CameraTrapImages() {}

	static MakerNoteBuilder makerNote() {
		return new MakerNoteBuilder();
	}

	static final class MakerNoteBuilder {
		private int version = MakerNoteDecoder.HYPERFIRE_VERSION;
		private String serial = "ABC123";
		private LocalDateTime time = LocalDateTime.of( 2019, 3, 14, 6, 30, 0 );
		private int event1 = 1;
		private int event2 = 1;
		private int sequenceIdx = 1;
		private int sequenceMax = 3;
		private int temperature = 21;
		private String userLabel = "WATERHOLE";

		MakerNoteBuilder version( int version ) {
			this.version = version;
			return this;
		}

		MakerNoteBuilder serial( String serial ) {
			this.serial = serial;
			return this;
		}

		MakerNoteBuilder time( LocalDateTime time ) {
			this.time = time;
			return this;
		}

		MakerNoteBuilder event( int event1, int event2 ) {
			this.event1 = event1;
			this.event2 = event2;
			return this;
		}

		MakerNoteBuilder sequence( int index, int max ) {
			this.sequenceIdx = index;
			this.sequenceMax = max;
			return this;
		}

		MakerNoteBuilder temperature( int celsius ) {
			this.temperature = celsius;
			return this;
		}

		MakerNoteBuilder userLabel( String userLabel ) {
			this.userLabel = userLabel;
			return this;
		}

		byte[] build() {
			ByteBuffer buffer = ByteBuffer.allocate( MAKER_NOTE_LENGTH ).order( ByteOrder.LITTLE_ENDIAN );
			buffer.putShort( 0x00, (short) version );
			buffer.putShort( 0x02, (short) 0x0304 );
			buffer.put( 0x0c, (byte) 'M' ).put( 0x0d, (byte) 'T' );
			buffer.putShort( 0x0e, (short) sequenceIdx ).putShort( 0x10, (short) sequenceMax );
			buffer.putShort( 0x12, (short) event1 ).putShort( 0x14, (short) event2 );
			buffer.putShort( 0x16, (short) time.getSecond() )
					.putShort( 0x18, (short) time.getMinute() )
					.putShort( 0x1a, (short) time.getHour() )
					.putShort( 0x1c, (short) time.getMonthValue() )
					.putShort( 0x1e, (short) time.getDayOfMonth() )
					.putShort( 0x20, (short) time.getYear() );
			buffer.putShort( 0x24, (short) 4 );
			buffer.putShort( 0x26, (short) ( temperature * 9 / 5 + 32 ) );
			buffer.putShort( 0x28, (short) temperature );
			// camera writes the serial number as UTF-16
			byte[] serialBytes = serial.getBytes( StandardCharsets.UTF_16LE );
			buffer.position( 0x2a );
			buffer.put( serialBytes, 0, Math.min( serialBytes.length, 30 ) );
			buffer.putShort( 0x48, (short) 128 )
					.putShort( 0x4a, (short) 140 )
					.putShort( 0x4c, (short) 32 )
					.putShort( 0x4e, (short) 130 )
					.putShort( 0x50, (short) 1 )
					.putShort( 0x52, (short) 2 )
					.putShort( 0x54, (short) 8810 );
			byte[] labelBytes = userLabel.getBytes( StandardCharsets.ISO_8859_1 );
			buffer.position( 0x56 );
			buffer.put( labelBytes, 0, Math.min( labelBytes.length, 22 ) );
			return buffer.array();
		}

		Path writeTo( Path file ) throws IOException {
			return Files.write( file, jpeg( build(), ByteOrder.LITTLE_ENDIAN ) );
		}
	}

	/**
	 * JPEG with an APP0 segment, an APP1 Exif segment holding IFD0 -> Exif IFD -> MakerNote and no image data.
	 */
	static byte[] jpeg( byte[] makerNote, ByteOrder order ) {
		byte[] tiff = tiff( makerNote, order );
		byte[] app0 = { 'J', 'F', 'I', 'F', 0, 1, 1, 0, 0, 1, 0, 1, 0, 0 };
		ByteBuffer file = ByteBuffer.allocate( 2 + 4 + app0.length + 4 + 6 + tiff.length + 3 );
		file.put( (byte) 0xFF ).put( (byte) 0xD8 );
		file.put( (byte) 0xFF ).put( (byte) 0xE0 ).putShort( (short) ( app0.length + 2 ) ).put( app0 );
		file.put( (byte) 0xFF ).put( (byte) 0xE1 ).putShort( (short) ( 6 + tiff.length + 2 ) );
		file.put( "Exif\0\0".getBytes( StandardCharsets.ISO_8859_1 ) ).put( tiff );
		// fill byte in front of the marker
		file.put( (byte) 0xFF ).put( (byte) 0xFF ).put( (byte) 0xD9 );
		return file.array();
	}

	/** JPEG without any Exif segment */
	static byte[] plainJpeg() {
		return new byte[] { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xD9 };
	}

	private static byte[] tiff( byte[] makerNote, ByteOrder order ) {
		int exifIfdOffset = 8 + 2 + 12 + 4;
		int makerNoteOffset = exifIfdOffset + 2 + 12 + 4;
		ByteBuffer tiff = ByteBuffer.allocate( makerNoteOffset + makerNote.length ).order( order );
		if ( order == ByteOrder.LITTLE_ENDIAN ) {
			tiff.put( (byte) 'I' ).put( (byte) 'I' );
		} else {
			tiff.put( (byte) 'M' ).put( (byte) 'M' );
		}
		tiff.putShort( (short) 42 ).putInt( 8 );
		// IFD0: Exif IFD pointer (LONG)
		tiff.putShort( (short) 1 );
		tiff.putShort( (short) ExifReader.TAG_EXIF_IFD_POINTER ).putShort( (short) 4 ).putInt( 1 ).putInt( exifIfdOffset );
		tiff.putInt( 0 );
		// Exif IFD: MakerNote (UNDEFINED)
		tiff.putShort( (short) 1 );
		tiff.putShort( (short) ExifReader.TAG_MAKER_NOTE ).putShort( (short) 7 ).putInt( makerNote.length ).putInt( makerNoteOffset );
		tiff.putInt( 0 );
		tiff.put( makerNote );
		return tiff.array();
	}

	/** Record as the scanner would produce it, without keys */
	static ImageRecord record( String filename, String serial, LocalDateTime time, int event2, int sequenceIdx ) {
		return new ImageRecord(
				Path.of( filename ), time, serial, 1, event2, sequenceIdx, 3, 20, 140, 32, 130, 128
		);
	}
}
