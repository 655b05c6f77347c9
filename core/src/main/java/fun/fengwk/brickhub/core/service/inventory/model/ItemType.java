package fun.fengwk.brickhub.core.service.inventory.model;

/**
 * Kind of row currently scanned in an inventory table.
 *
 * @author fengwk
 */
public enum ItemType {

    PARTS("catalog/catalogitem.page?P="),
    MINIFIGURES("catalogitem.page?M=");

    private final String linkMarker;

    ItemType(String linkMarker) {
        this.linkMarker = linkMarker;
    }

    /**
     * Url fragment identifying the catalog link of a row of this type.
     */
    public String getLinkMarker() {
        return linkMarker;
    }

}
