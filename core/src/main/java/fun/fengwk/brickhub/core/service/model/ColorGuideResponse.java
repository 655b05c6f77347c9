package fun.fengwk.brickhub.core.service.model;

import fun.fengwk.brickhub.core.service.color.ColorGuideEntry;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class ColorGuideResponse {

    private int statusCode;
    private String locale;
    private List<ColorGuideEntry> entries;
    private Long elapsedMs;
    private String error;

}
