package me.christianrobert.adqlpg.transformer.context;

/**
 * Base exception for everything that can go wrong while translating an ADQL statement.
 * Captures the offending ADQL text and the pipeline phase in which the failure happened.
 */
public class AdqlException extends RuntimeException {

    private final String adql;
    private final String context;

    public AdqlException(String message) {
        super(message);
        this.adql = null;
        this.context = null;
    }

    public AdqlException(String message, Throwable cause) {
        super(message, cause);
        this.adql = null;
        this.context = null;
    }

    public AdqlException(String message, String adql, String context) {
        super(message);
        this.adql = adql;
        this.context = context;
    }

    public AdqlException(String message, String adql, String context, Throwable cause) {
        super(message, cause);
        this.adql = adql;
        this.context = context;
    }

    public String getAdql() {
        return adql;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the ADQL text and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (adql != null) {
            sb.append("\nADQL: ").append(adql);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
