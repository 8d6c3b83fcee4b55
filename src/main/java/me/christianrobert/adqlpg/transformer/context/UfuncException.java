package me.christianrobert.adqlpg.transformer.context;

/**
 * Unknown user defined function or a call with the wrong number of arguments.
 */
public class UfuncException extends AdqlException {

    public UfuncException(String message) {
        super(message, null, "user function");
    }
}
