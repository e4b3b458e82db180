package com.tessera.core.assignment;

/**
 * An optimizer proposal that does not place every item exactly once.
 * Never escapes the engine.
 */
class AssignmentValidationException extends RuntimeException {

    AssignmentValidationException(String message) {
        super(message);
    }
}
