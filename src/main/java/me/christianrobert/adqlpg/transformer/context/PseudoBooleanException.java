package me.christianrobert.adqlpg.transformer.context;

/**
 * CONTAINS and INTERSECTS return 0 or 1; they may only be compared to those values with = or !=.
 */
public class PseudoBooleanException extends MorphException {

    public PseudoBooleanException(String message) {
        super(message);
    }
}
