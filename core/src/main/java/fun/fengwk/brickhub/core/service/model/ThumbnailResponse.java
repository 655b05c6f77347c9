package fun.fengwk.brickhub.core.service.model;

import lombok.Builder;
import lombok.Data;

/**
 * Thumbnail served from the fetch cache.
 *
 * @author fengwk
 */
@Data
@Builder
public class ThumbnailResponse {

    private int statusCode;
    private String url;
    private String mimeType;
    private Integer size;

    /**
     * Data URI: data:image/png;base64,...
     */
    private String dataUri;

    private Long elapsedMs;
    private String error;

}
