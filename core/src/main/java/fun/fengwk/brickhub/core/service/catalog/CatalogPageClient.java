package fun.fengwk.brickhub.core.service.catalog;

import fun.fengwk.brickhub.core.service.cache.DownloadPermitPool;
import fun.fengwk.brickhub.core.service.fetch.PayloadFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Downloads catalog html pages with a bounded number of concurrent requests.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogPageClient {

    private final PayloadFetcher payloadFetcher;
    private final DownloadPermitPool pagePermitPool;

    public byte[] fetchHtml(String url) throws IOException {
        pagePermitPool.acquire();
        long start = System.currentTimeMillis();
        try {
            byte[] html = payloadFetcher.fetch(url).requireSuccess(url);
            log.debug("catalog page fetched, url={}, bytes={}, elapsedMs={}",
                url, html.length, System.currentTimeMillis() - start);
            return html;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while fetching " + url);
            interrupted.initCause(ex);
            throw interrupted;
        } finally {
            pagePermitPool.release();
        }
    }

}
