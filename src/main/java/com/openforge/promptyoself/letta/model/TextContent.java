package com.openforge.promptyoself.letta.model;

/** One text part of a message's content array. */
public record TextContent(String type, String text) {

    public static TextContent of(String text) {
        return new TextContent("text", text);
    }
}
