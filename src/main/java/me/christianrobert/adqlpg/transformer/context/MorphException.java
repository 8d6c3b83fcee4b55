package me.christianrobert.adqlpg.transformer.context;

/**
 * Raised when a tree cannot be rewritten into the target dialect.
 */
public class MorphException extends AdqlException {

    public MorphException(String message) {
        super(message, null, "morphing");
    }

    public MorphException(String message, Throwable cause) {
        super(message, null, "morphing", cause);
    }
}
