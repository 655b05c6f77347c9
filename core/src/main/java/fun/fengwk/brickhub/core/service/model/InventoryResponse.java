package fun.fengwk.brickhub.core.service.model;

import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class InventoryResponse {

    private int statusCode;
    private String setNumber;
    private Inventory inventory;
    private Long elapsedMs;
    private String error;

}
