package me.christianrobert.adqlpg.transformer.context;

/**
 * A construct that parses and annotates but has no translation yet.
 */
public class UnsupportedConstructException extends MorphException {

    public UnsupportedConstructException(String message) {
        super(message);
    }
}
