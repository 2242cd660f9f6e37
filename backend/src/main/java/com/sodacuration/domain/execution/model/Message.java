package com.sodacuration.domain.execution.model;

/**
 * One turn of a conversation sent to a model.
 */
public record Message(Role role, String content) {

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }

    public Message withContent(String newContent) {
        return new Message(role, newContent);
    }
}
