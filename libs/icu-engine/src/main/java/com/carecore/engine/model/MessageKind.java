package com.carecore.engine.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Kinds of inter-agent message and the payload fields each one carries. */
public enum MessageKind {

    CONSULT_REQUEST("question"),
    HANDOFF_NOTE("note"),
    MEDICATION_QUERY("drug", "concern"),
    ESCALATION_NOTICE("reason");

    private final List<String> requiredPayload;

    MessageKind(String... requiredPayload) {
        this.requiredPayload = List.of(requiredPayload);
    }

    public List<String> requiredPayload() {
        return requiredPayload;
    }

    public Set<String> missingPayload(Map<String, String> payload) {
        return requiredPayload.stream()
                .filter(field -> payload == null
                        || payload.get(field) == null
                        || payload.get(field).isBlank())
                .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
    }
}
