package iks.trapsorter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {
	@Test
	void formatsIntervals() {
		assertEquals( "512 ns", Utils.asHumanReadableInterval( 512 ) );
		assertEquals( "1.500 µs", Utils.asHumanReadableInterval( 1_500 ) );
		assertEquals( "12.345 ms", Utils.asHumanReadableInterval( 12_345_000 ) );
		assertEquals( "01:05.250", Utils.asHumanReadableInterval( 65_250_000_000L ) );
		assertEquals( "2:00:00.000", Utils.asHumanReadableInterval( 7_200_000_000_000L ) );
	}

	@Test
	void formatsFileSizes() {
		assertEquals( "100.0 bytes", Utils.getFileSizeNice( 100 ) );
		assertEquals( "1.5 KB", Utils.getFileSizeNice( 1536 ) );
		assertEquals( "3.0 MB", Utils.getFileSizeNice( 3L * 1024 * 1024 ) );
	}
}
