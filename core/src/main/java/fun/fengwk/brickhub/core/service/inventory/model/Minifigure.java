package fun.fengwk.brickhub.core.service.inventory.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Minifigure row of an inventory, with its parts once enriched.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class Minifigure {

    String identifier;
    String name;
    int quantity;
    String imageUrl;
    String catalogUrl;
    String inventoryUrl;

    @Builder.Default
    List<Category> categories = List.of();

    @Builder.Default
    List<Part> parts = List.of();

}
