package iks.trapsorter;

import java.nio.ByteBuffer;

/** Binary layout of a single MakerNote field: a repeated count of one primitive kind. */
final class FieldLayout {
	enum Kind {
		UNSIGNED_16( 2 ),
		SIGNED_16( 2 ),
		BYTE( 1 );

		final int size;

		Kind( int size ) {
			this.size = size;
		}
	}

	final Kind kind;
	final int count;

	private FieldLayout( Kind kind, int count ) {
		this.kind = kind;
		this.count = count;
	}

	static FieldLayout u16() {
		return new FieldLayout( Kind.UNSIGNED_16, 1 );
	}

	static FieldLayout u16( int count ) {
		return new FieldLayout( Kind.UNSIGNED_16, count );
	}

	static FieldLayout i16() {
		return new FieldLayout( Kind.SIGNED_16, 1 );
	}

	static FieldLayout bytes( int length ) {
		return new FieldLayout( Kind.BYTE, length );
	}

	/** Exact number of bytes the layout occupies */
	int width() {
		return kind.size * count;
	}

	/**
	 * Reads the value at the buffer's current position.
	 * A single 16-bit number is returned as {@link Integer}, repeated numbers as {@code int[]}
	 * and byte strings as {@code byte[]}.
	 */
	Object read( ByteBuffer buffer ) {
		if ( kind == Kind.BYTE ) {
			byte[] value = new byte[ count ];
			buffer.get( value );
			return value;
		}
		int[] values = new int[ count ];
		for ( int i = 0; i < count; ++ i ) {
			short raw = buffer.getShort();
			values[ i ] = kind == Kind.UNSIGNED_16 ? Short.toUnsignedInt( raw ) : raw;
		}
		return count == 1 ? (Object) values[ 0 ] : values;
	}

	@Override
	public String toString() {
		return count == 1 ? kind.name() : count + "x" + kind.name();
	}
}
