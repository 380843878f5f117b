package com.openforge.promptyoself.letta.model;

import java.util.List;

/**
 * A message sent to an agent.  Prompts are always delivered as a single
 * user-role message with one text part.
 */
public record MessageCreate(String role, List<TextContent> content) {

    public static MessageCreate user(String text) {
        return new MessageCreate("user", List.of(TextContent.of(text)));
    }
}
