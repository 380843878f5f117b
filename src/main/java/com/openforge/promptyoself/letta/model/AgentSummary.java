package com.openforge.promptyoself.letta.model;

/**
 * The subset of a Letta agent record this service reads.
 * Timestamps are kept as the server sent them.
 */
public record AgentSummary(
        String id,
        String name,
        String createdAt,
        String lastUpdated
) {

    public String displayName() {
        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
