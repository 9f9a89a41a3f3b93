package io.netfield.fieldops.envelope;

/** Envelope backlog per status plus the transport's current connectivity. */
public record EnvelopeStats(
    long pending, long sent, long failed, String channel, boolean transportConnected) {}
