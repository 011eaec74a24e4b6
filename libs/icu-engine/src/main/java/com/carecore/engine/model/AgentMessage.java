package com.carecore.engine.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A message between agents. Immutable once enqueued on the bus.
 *
 * @param messageId unique message id
 * @param sender    sending role
 * @param recipient addressed role, {@code null} for a broadcast
 * @param kind      message kind
 * @param patientId patient the message is about
 * @param payload   kind-specific fields
 * @param sentAt    send time
 * @param sequence  causal sequence number, strictly increasing per sender, starting at 1
 */
public record AgentMessage(
        String messageId,
        AgentRole sender,
        AgentRole recipient,
        MessageKind kind,
        String patientId,
        Map<String, String> payload,
        Instant sentAt,
        long sequence
) {

    public AgentMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be null or blank");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("patientId must not be null or blank");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        Set<String> missing = kind.missingPayload(payload);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires payload " + missing);
        }
        if (sentAt == null) {
            throw new IllegalArgumentException("sentAt must not be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
    }

    public boolean isBroadcast() {
        return recipient == null;
    }

    /** True if {@code role} should receive this message: addressed to it, or a broadcast from someone else. */
    public boolean isDeliverableTo(AgentRole role) {
        if (sender == role) {
            return false;
        }
        return recipient == null || recipient == role;
    }

    public Optional<AgentRole> recipientRole() {
        return Optional.ofNullable(recipient);
    }
}
