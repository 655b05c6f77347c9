package fun.fengwk.brickhub.core.service.inventory;

/**
 * Thrown when an inventory page does not have the expected structure.
 *
 * @author fengwk
 */
public class InventoryParseException extends RuntimeException {

    public enum Reason {
        TABLE_NOT_FOUND,
        MALFORMED_ROW,
        MISSING_SET_NAME
    }

    private final Reason reason;

    /**
     * Offending markdown line for {@link Reason#MALFORMED_ROW}, null otherwise.
     */
    private final String line;

    private InventoryParseException(Reason reason, String message, String line, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.line = line;
    }

    public static InventoryParseException tableNotFound() {
        return new InventoryParseException(Reason.TABLE_NOT_FOUND, "inventory table not found", null, null);
    }

    public static InventoryParseException malformedRow(String line, Throwable cause) {
        return new InventoryParseException(Reason.MALFORMED_ROW, "malformed inventory row: " + line, line, cause);
    }

    public static InventoryParseException missingSetName(String setNumber) {
        return new InventoryParseException(Reason.MISSING_SET_NAME, "set name not found for " + setNumber, null, null);
    }

    public Reason getReason() {
        return reason;
    }

    public String getLine() {
        return line;
    }

}
