package fun.fengwk.brickhub.core.service.inventory.model;

/**
 * @author fengwk
 */
public enum ExtractionMode {

    /**
     * Set page: metadata, parts and minifigures, a set name is required.
     */
    FULL,

    /**
     * Nested minifigure or multipack page: parts only.
     */
    PARTS_ONLY

}
