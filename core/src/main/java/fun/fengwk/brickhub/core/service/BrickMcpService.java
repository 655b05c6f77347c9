package fun.fengwk.brickhub.core.service;

import fun.fengwk.brickhub.core.service.model.ColorGuideResponse;
import fun.fengwk.brickhub.core.service.model.InventoryResponse;
import fun.fengwk.brickhub.core.service.model.ThumbnailResponse;

/**
 * @author fengwk
 */
public interface BrickMcpService {

    InventoryResponse fetchSetInventory(String setNumber);

    ColorGuideResponse fetchColorGuide(String locale);

    ThumbnailResponse fetchThumbnail(String url);

}
