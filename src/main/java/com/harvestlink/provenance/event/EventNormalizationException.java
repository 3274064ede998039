package com.harvestlink.provenance.event;

/**
 * A raw log whose arguments do not fit the event's shape.
 */
public class EventNormalizationException extends RuntimeException {

    public EventNormalizationException(String message) {
        super(message);
    }
}
