package com.example.products.model;

/**
 * Body returned when the controller answers with a plain message.
 */
public record MessageResponse(
    String message
) {
    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
