package me.christianrobert.adqlpg.transformer.context;

/**
 * Raised when the argument of REGION cannot be turned into a geometry.
 */
public class RegionException extends AdqlException {

    public RegionException(String message) {
        super(message, null, "region resolution");
    }

    public RegionException(String message, Throwable cause) {
        super(message, null, "region resolution", cause);
    }
}
