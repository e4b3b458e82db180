package com.tessera.core.assignment;

/**
 * Thrown when there are items to assign but nobody to assign them to.
 */
public class NoParticipantsException extends RuntimeException {

    public NoParticipantsException(int itemCount) {
        super("Cannot assign " + itemCount + " work items: no participants");
    }

    public NoParticipantsException(String message) {
        super(message);
    }
}
