package com.openforge.promptyoself.letta.model;

import java.util.List;

/** Body of {@code POST /v1/agents/{agent_id}/messages}. */
public record SendMessageRequest(List<MessageCreate> messages) {

    public static SendMessageRequest userText(String text) {
        return new SendMessageRequest(List.of(MessageCreate.user(text)));
    }
}
