package com.chauhraj.kdbtick.protocol;

/**
 * One decoded IPC message.
 * @param type the message kind from the header
 * @param value the deserialized body
 */
public record Message(MessageType type, Object value) {
}
