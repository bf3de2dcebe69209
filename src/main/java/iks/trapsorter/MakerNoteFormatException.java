package iks.trapsorter;

import java.io.IOException;

/** Malformed, absent or unexpected MakerNote data in a single image file. */
public class MakerNoteFormatException extends IOException {
	public MakerNoteFormatException( String message ) {
		super( message );
	}
}
