package me.christianrobert.adqlpg.transformer.context;

/**
 * More than one visible column matches an unqualified name.
 */
public class AmbiguousColumnException extends AdqlException {

    private final String name;

    public AmbiguousColumnException(String message, String name) {
        super(message, null, "annotation");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
