package org.Aayush.graphlab.graph;

import org.Aayush.graphlab.GraphLabException;

/**
 * Thrown when persisted graph text cannot be parsed into a valid {@link WeightedGraph}.
 */
public final class GraphFormatException extends GraphLabException {
    public static final String REASON_HEADER_INVALID = "GRAPH_HEADER_INVALID";
    public static final String REASON_EDGE_INVALID = "GRAPH_EDGE_INVALID";
    public static final String REASON_EDGE_MISSING = "GRAPH_EDGE_MISSING";
    public static final String REASON_VERTEX_OUT_OF_RANGE = "GRAPH_VERTEX_OUT_OF_RANGE";

    public GraphFormatException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public GraphFormatException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
