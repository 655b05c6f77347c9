package fun.fengwk.brickhub.core.service.inventory.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Part row of an inventory.
 *
 * <p>{@code subparts} holds the resolved contents of a multipack or sprue, empty for leaf parts.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class Part {

    String partId;
    String partUrl;
    String name;
    String colorName;
    String colorId;
    String imageUrl;
    int quantity;
    PartSection section;

    /**
     * Link to the part's own inventory, present for multipacks.
     */
    String inventoryUrl;

    @Builder.Default
    List<Part> subparts = List.of();

}
