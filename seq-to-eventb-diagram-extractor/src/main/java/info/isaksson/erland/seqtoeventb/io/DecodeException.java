package info.isaksson.erland.seqtoeventb.io;

import java.io.IOException;

/**
 * Raised when a diagram document is not well-formed markup and cannot be loaded at all.
 */
public class DecodeException extends IOException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
