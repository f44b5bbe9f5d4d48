package space.ketterling.wxpipeline.store;

/**
 * A fact was refused at the store boundary because it violates a column
 * constraint. Callers treat this as a per-record skip.
 */
public class FactRejectedException extends Exception {
    private final String column;
    private final Object value;

    public FactRejectedException(String column, Object value, String message) {
        super(message);
        this.column = column;
        this.value = value;
    }

    public FactRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.column = null;
        this.value = null;
    }

    /**
     * The offending column, or null when the database reported the violation.
     */
    public String column() {
        return column;
    }

    public Object value() {
        return value;
    }
}
