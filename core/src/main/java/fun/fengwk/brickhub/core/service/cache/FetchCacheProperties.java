package fun.fengwk.brickhub.core.service.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binary fetch cache configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "brickhub.cache")
public class FetchCacheProperties {

    /**
     * Directory holding one file per cached url.
     */
    private String directory = System.getProperty("user.home") + "/.brick-hub/cache";

    /**
     * Max entries kept in memory, older entries stay on disk only.
     */
    private int memoryLimit = 100;

    /**
     * Max downloads running at the same time.
     */
    private int maxConcurrentDownloads = 4;

    /**
     * Per-request timeout in milliseconds.
     */
    private int requestTimeoutMs = 30000;

}
