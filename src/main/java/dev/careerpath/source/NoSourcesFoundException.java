package dev.careerpath.source;

/**
 * No narrative survived retrieval, parsing and filtering.
 */
public class NoSourcesFoundException extends RuntimeException {

    public NoSourcesFoundException(String currentRole, String targetRole) {
        super("No transition stories found for " + currentRole + " -> " + targetRole);
    }
}
