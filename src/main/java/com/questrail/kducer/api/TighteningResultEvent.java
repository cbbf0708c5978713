package com.questrail.kducer.api;

import java.time.Instant;
import java.util.Objects;

/**
 * TighteningResultEvent
 * -----------------------------------------------------------------------------
 * One tightening result fetched from the device.
 *
 * <p>{@code result} holds the raw result registers (67 registers, big-endian).
 * When graph fetching is enabled the torque and angle series (71 registers each)
 * are attached; otherwise both graph arrays are empty.</p>
 *
 * <p>The record is immutable: all arrays are copied in and out.</p>
 */
public record TighteningResultEvent(
        Instant receivedAt,
        byte[] result,
        byte[] torqueGraph,
        byte[] angleGraph
) {
    public TighteningResultEvent {
        Objects.requireNonNull(receivedAt, "receivedAt");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(torqueGraph, "torqueGraph");
        Objects.requireNonNull(angleGraph, "angleGraph");
        result = result.clone();
        torqueGraph = torqueGraph.clone();
        angleGraph = angleGraph.clone();
    }

    public static TighteningResultEvent withoutGraph(Instant receivedAt, byte[] result) {
        return new TighteningResultEvent(receivedAt, result, new byte[0], new byte[0]);
    }

    @Override
    public byte[] result() {
        return result.clone();
    }

    @Override
    public byte[] torqueGraph() {
        return torqueGraph.clone();
    }

    @Override
    public byte[] angleGraph() {
        return angleGraph.clone();
    }

    public boolean hasGraph() {
        return torqueGraph.length > 0 || angleGraph.length > 0;
    }

    @Override
    public String toString() {
        return "TighteningResultEvent[receivedAt=" + receivedAt
                + ", resultBytes=" + result.length
                + ", graph=" + hasGraph() + "]";
    }
}
