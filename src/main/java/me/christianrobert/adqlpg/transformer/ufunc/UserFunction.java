package me.christianrobert.adqlpg.transformer.ufunc;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * A user defined function callable from ADQL.
 * <p>
 * The expansion turns the already translated arguments into target SQL. Functions
 * without an expansion are passed to the database under their own name.
 * </p>
 */
public class UserFunction {

    private final String name;
    private final String signature;
    private final String description;
    private final String returnType;
    private final String unit;
    private final String ucd;
    private final int arity;
    private final Function<List<String>, String> expansion;

    public UserFunction(String name, String signature, String description, String returnType,
                        String unit, String ucd, int arity, Function<List<String>, String> expansion) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("User function name cannot be null or empty");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("Arity cannot be negative");
        }
        this.name = name.toUpperCase(Locale.ROOT);
        this.signature = signature;
        this.description = description;
        this.returnType = returnType;
        this.unit = unit == null ? "" : unit;
        this.ucd = ucd == null ? "" : ucd;
        this.arity = arity;
        this.expansion = expansion;
    }

    /** Upper-cased name. */
    public String getName() {
        return name;
    }

    public String getSignature() {
        return signature;
    }

    public String getDescription() {
        return description;
    }

    public String getReturnType() {
        return returnType;
    }

    public String getUnit() {
        return unit;
    }

    public String getUcd() {
        return ucd;
    }

    public int getArity() {
        return arity;
    }

    public boolean hasExpansion() {
        return expansion != null;
    }

    /**
     * Renders a call with the given SQL arguments.
     */
    public String expand(List<String> sqlArgs) {
        if (expansion == null) {
            return name + "(" + String.join(", ", sqlArgs) + ")";
        }
        return expansion.apply(sqlArgs);
    }

    @Override
    public String toString() {
        return signature != null ? signature : name;
    }
}
