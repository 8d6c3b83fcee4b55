package me.christianrobert.adqlpg.transformer.context;

public class NoSuchChildException extends AdqlException {

    public NoSuchChildException(String message) {
        super(message);
    }
}
