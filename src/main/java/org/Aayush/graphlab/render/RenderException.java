package org.Aayush.graphlab.render;

import org.Aayush.graphlab.GraphLabException;

/**
 * Thrown when the external renderer cannot display a graph.
 */
public final class RenderException extends GraphLabException {
    public static final String REASON_START_FAILED = "RENDER_START_FAILED";
    public static final String REASON_EXIT_NONZERO = "RENDER_EXIT_NONZERO";
    public static final String REASON_INTERRUPTED = "RENDER_INTERRUPTED";

    public RenderException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public RenderException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
