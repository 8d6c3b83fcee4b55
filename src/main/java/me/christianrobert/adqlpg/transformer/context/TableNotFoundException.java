package me.christianrobert.adqlpg.transformer.context;

/**
 * A table reference or column qualifier does not match any known table.
 */
public class TableNotFoundException extends AdqlException {

    private final String name;

    public TableNotFoundException(String message, String name) {
        super(message, null, "annotation");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
