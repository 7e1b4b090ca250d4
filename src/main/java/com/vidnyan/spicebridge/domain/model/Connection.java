package com.vidnyan.spicebridge.domain.model;

/**
 * Wires port {@code fromPort} of stage {@code fromStage} to port
 * {@code toPort} of stage {@code toStage}. Stage indices are zero-based.
 */
public record Connection(
    int fromStage,
    String fromPort,
    int toStage,
    String toPort
) {

    public static Connection between(int fromStage, String fromPort, int toStage, String toPort) {
        return new Connection(fromStage, fromPort, toStage, toPort);
    }

    public String format() {
        return fromStage + "." + fromPort + " -> " + toStage + "." + toPort;
    }
}
