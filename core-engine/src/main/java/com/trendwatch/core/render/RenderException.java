package com.trendwatch.core.render;

/**
 * Raised when artifacts for a trend cannot be rendered or written. The
 * trend's samples are unaffected; the next cycle renders them again.
 *
 * @since 1.0.0
 */
public class RenderException extends Exception {

    private static final long serialVersionUID = 1L;

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
