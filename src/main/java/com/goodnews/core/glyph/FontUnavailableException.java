package com.goodnews.core.glyph;

/**
 * Raised when neither the configured font file nor the fallback family yields a usable font.
 */
public class FontUnavailableException extends RuntimeException {

    public FontUnavailableException(String message) {
        super(message);
    }

    public FontUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
