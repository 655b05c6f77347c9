package fun.fengwk.brickhub.core.configuration;

import fun.fengwk.brickhub.core.service.cache.DownloadPermitPool;
import fun.fengwk.brickhub.core.service.cache.FetchCacheManager;
import fun.fengwk.brickhub.core.service.cache.FetchCacheProperties;
import fun.fengwk.brickhub.core.service.catalog.CatalogPageClient;
import fun.fengwk.brickhub.core.service.catalog.CatalogProperties;
import fun.fengwk.brickhub.core.service.fetch.HttpPayloadFetcher;
import fun.fengwk.brickhub.core.service.inventory.InventoryEnricher;
import fun.fengwk.brickhub.core.service.inventory.InventoryExtractor;
import fun.fengwk.brickhub.core.service.scrape.parser.HtmlMarkdownConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the catalog pipeline and the fetch cache. Each component is created once here and
 * injected where needed.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class CatalogConfiguration {

    @Bean
    public HttpClient catalogHttpClient(CatalogProperties catalogProperties) {
        return HttpPayloadFetcher.newHttpClient(catalogProperties.getConnectTimeoutMs());
    }

    @Bean
    public CatalogPageClient catalogPageClient(HttpClient catalogHttpClient, CatalogProperties catalogProperties) {
        HttpPayloadFetcher fetcher = new HttpPayloadFetcher(
            catalogHttpClient,
            catalogProperties.getUserAgent(),
            catalogProperties.getRequestTimeoutMs()
        );
        return new CatalogPageClient(fetcher, new DownloadPermitPool(Math.max(1, catalogProperties.getMaxConcurrentPages())));
    }

    @Bean(name = "inventoryEnrichExecutor", destroyMethod = "shutdownNow")
    public ExecutorService inventoryEnrichExecutor() {
        // Enrichment tasks wait on nested batches, a bounded pool could starve itself.
        return Executors.newCachedThreadPool(daemonThreadFactory("brickhub-enrich-"));
    }

    @Bean
    public InventoryEnricher inventoryEnricher(CatalogPageClient catalogPageClient,
                                               HtmlMarkdownConverter htmlMarkdownConverter,
                                               InventoryExtractor inventoryExtractor,
                                               @Qualifier("inventoryEnrichExecutor") ExecutorService inventoryEnrichExecutor,
                                               CatalogProperties catalogProperties) {
        return new InventoryEnricher(
            catalogPageClient,
            htmlMarkdownConverter,
            inventoryExtractor,
            inventoryEnrichExecutor,
            catalogProperties.getBaseUrl()
        );
    }

    @Bean(name = "fetchCacheExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchCacheExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("brickhub-cache-"));
    }

    @Bean
    public FetchCacheManager fetchCacheManager(HttpClient catalogHttpClient,
                                               CatalogProperties catalogProperties,
                                               FetchCacheProperties fetchCacheProperties,
                                               @Qualifier("fetchCacheExecutor") ExecutorService fetchCacheExecutor) {
        HttpPayloadFetcher fetcher = new HttpPayloadFetcher(
            catalogHttpClient,
            catalogProperties.getUserAgent(),
            fetchCacheProperties.getRequestTimeoutMs()
        );
        Path directory = Path.of(fetchCacheProperties.getDirectory());
        log.info("fetch cache ready, directory={}, memoryLimit={}, maxConcurrentDownloads={}",
            directory, fetchCacheProperties.getMemoryLimit(), fetchCacheProperties.getMaxConcurrentDownloads());
        return new FetchCacheManager(
            fetcher,
            new DownloadPermitPool(fetchCacheProperties.getMaxConcurrentDownloads()),
            directory,
            fetchCacheProperties.getMemoryLimit(),
            fetchCacheExecutor
        );
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger threadIdGen = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

}
