package fun.fengwk.brickhub.core.service.catalog;

import fun.fengwk.brickhub.core.service.fetch.HttpPayloadFetcher;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * BrickLink catalog access configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "brickhub.catalog")
public class CatalogProperties {

    /**
     * Catalog site root, inventory pages are resolved against it.
     */
    private String baseUrl = "https://www.bricklink.com";

    /**
     * Color guide page, {locale} is replaced by the requested locale.
     */
    private String colorGuideUrl = "https://v2.bricklink.com/{locale}/catalog/color-guide";

    private int requestTimeoutMs = 30000;

    private int connectTimeoutMs = 15000;

    /**
     * Max catalog pages downloaded at the same time.
     */
    private int maxConcurrentPages = 4;

    /**
     * How many levels of nested inventories are resolved below a set.
     */
    private int nestedInventoryDepth = 2;

    private String userAgent = HttpPayloadFetcher.DEFAULT_USER_AGENT;

}
