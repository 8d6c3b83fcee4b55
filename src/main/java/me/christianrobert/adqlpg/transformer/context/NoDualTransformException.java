package me.christianrobert.adqlpg.transformer.context;

public class NoDualTransformException extends MorphException {

    public NoDualTransformException(String message) {
        super(message);
    }
}
