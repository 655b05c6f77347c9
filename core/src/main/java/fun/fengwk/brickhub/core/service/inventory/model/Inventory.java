package fun.fengwk.brickhub.core.service.inventory.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized inventory of one catalog page.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class Inventory {

    String setNumber;
    String name;
    String thumbnailUrl;

    @Builder.Default
    List<Part> parts = List.of();

    @Builder.Default
    List<Category> categories = List.of();

    @Builder.Default
    List<Minifigure> minifigures = List.of();

}
