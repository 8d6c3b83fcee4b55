package me.christianrobert.adqlpg.transformer.context;

public class AmbiguousChildException extends AdqlException {

    public AmbiguousChildException(String message) {
        super(message);
    }
}
