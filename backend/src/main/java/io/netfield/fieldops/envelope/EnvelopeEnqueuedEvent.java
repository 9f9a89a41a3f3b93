package io.netfield.fieldops.envelope;

import java.util.UUID;

/** Published inside the producer's transaction; consumed after commit by the inline path. */
public record EnvelopeEnqueuedEvent(UUID envelopeId, String recipientAddress, String kind) {}
