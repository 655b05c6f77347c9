package fun.fengwk.brickhub.core.service.inventory.model;

/**
 * Breadcrumb entry of the catalog tree.
 *
 * @param id catalog category id, null for collection roots
 * @param name display name
 * @author fengwk
 */
public record Category(String id, String name) {

}
