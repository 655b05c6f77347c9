package fun.fengwk.brickhub.core.service.inventory.model;

/**
 * Grouping marker inside an inventory table.
 *
 * @author fengwk
 */
public enum PartSection {

    REGULAR("regular"),
    COUNTERPART("counterpart"),
    EXTRA("extra"),
    ALTERNATE("alternate");

    private final String value;

    PartSection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
