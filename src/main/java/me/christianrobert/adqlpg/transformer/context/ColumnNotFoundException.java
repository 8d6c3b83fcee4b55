package me.christianrobert.adqlpg.transformer.context;

/**
 * No column with the given name is visible from the referencing query.
 */
public class ColumnNotFoundException extends AdqlException {

    private final String name;

    public ColumnNotFoundException(String message, String name) {
        super(message, null, "annotation");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
