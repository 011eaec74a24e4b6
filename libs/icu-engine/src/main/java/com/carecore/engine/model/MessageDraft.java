package com.carecore.engine.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A message a decision function wants sent; the runtime adds sender, patient, time and sequence.
 *
 * @param recipient addressed role, or {@code null} to broadcast
 * @param kind      message kind
 * @param payload   kind-specific fields
 */
public record MessageDraft(AgentRole recipient, MessageKind kind, Map<String, String> payload) {

    public MessageDraft {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        Set<String> missing = kind.missingPayload(payload);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires payload " + missing);
        }
    }

    public static MessageDraft to(AgentRole recipient, MessageKind kind, Map<String, String> payload) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient must not be null, use broadcast()");
        }
        return new MessageDraft(recipient, kind, payload);
    }

    public static MessageDraft broadcast(MessageKind kind, Map<String, String> payload) {
        return new MessageDraft(null, kind, payload);
    }

    public Optional<AgentRole> recipientRole() {
        return Optional.ofNullable(recipient);
    }
}
