package uk.gegc.scriptflow.features.flowsync.domain.model;

/**
 * Well-known pin names. Any other source pin is a response choice id.
 */
public final class FlowPins {

    public static final String OUTPUT = "output";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String INPUT = "input";

    private FlowPins() {
    }
}
