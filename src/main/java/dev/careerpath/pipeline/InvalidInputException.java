package dev.careerpath.pipeline;

/**
 * Rejected role input. Raised before any external call is made.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
