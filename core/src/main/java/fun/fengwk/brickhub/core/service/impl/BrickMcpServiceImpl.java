package fun.fengwk.brickhub.core.service.impl;

import fun.fengwk.brickhub.core.service.BrickMcpService;
import fun.fengwk.brickhub.core.service.cache.FetchCacheManager;
import fun.fengwk.brickhub.core.service.cache.ThumbnailMediaUtils;
import fun.fengwk.brickhub.core.service.color.ColorGuideEntry;
import fun.fengwk.brickhub.core.service.color.ColorGuideService;
import fun.fengwk.brickhub.core.service.fetch.InvalidResponseException;
import fun.fengwk.brickhub.core.service.inventory.InventoryParseException;
import fun.fengwk.brickhub.core.service.inventory.InventoryService;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import fun.fengwk.brickhub.core.service.model.ColorGuideResponse;
import fun.fengwk.brickhub.core.service.model.InventoryResponse;
import fun.fengwk.brickhub.core.service.model.ThumbnailResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Adapts the catalog services to tool responses. Failures become a status code plus error
 * message instead of an exception.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrickMcpServiceImpl implements BrickMcpService {

    private final InventoryService inventoryService;
    private final ColorGuideService colorGuideService;
    private final FetchCacheManager fetchCacheManager;

    @Override
    public InventoryResponse fetchSetInventory(String setNumber) {
        long start = System.currentTimeMillis();
        try {
            Inventory inventory = inventoryService.fetchInventory(setNumber);
            return InventoryResponse.builder()
                .statusCode(200)
                .setNumber(inventory.getSetNumber())
                .inventory(inventory)
                .elapsedMs(System.currentTimeMillis() - start)
                .build();
        } catch (Exception ex) {
            log.warn("fetch set inventory failed, setNumber={}, error={}", setNumber, ex.getMessage());
            return InventoryResponse.builder()
                .statusCode(resolveStatusCode(ex))
                .setNumber(setNumber)
                .elapsedMs(System.currentTimeMillis() - start)
                .error(resolveError(ex))
                .build();
        }
    }

    @Override
    public ColorGuideResponse fetchColorGuide(String locale) {
        long start = System.currentTimeMillis();
        try {
            List<ColorGuideEntry> entries = colorGuideService.fetchColorGuide(locale);
            return ColorGuideResponse.builder()
                .statusCode(200)
                .locale(locale)
                .entries(entries)
                .elapsedMs(System.currentTimeMillis() - start)
                .build();
        } catch (Exception ex) {
            log.warn("fetch color guide failed, locale={}, error={}", locale, ex.getMessage());
            return ColorGuideResponse.builder()
                .statusCode(resolveStatusCode(ex))
                .locale(locale)
                .entries(List.of())
                .elapsedMs(System.currentTimeMillis() - start)
                .error(resolveError(ex))
                .build();
        }
    }

    @Override
    public ThumbnailResponse fetchThumbnail(String url) {
        long start = System.currentTimeMillis();
        try {
            if (!isSupportedHttpUrl(url)) {
                throw new IllegalArgumentException("unsupported url protocol");
            }
            String normalizedUrl = url.trim();
            byte[] data = fetchCacheManager.get(normalizedUrl);
            String mimeType = ThumbnailMediaUtils.resolveMime(data, normalizedUrl);
            return ThumbnailResponse.builder()
                .statusCode(200)
                .url(normalizedUrl)
                .mimeType(mimeType)
                .size(data.length)
                .dataUri("data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(data))
                .elapsedMs(System.currentTimeMillis() - start)
                .build();
        } catch (Exception ex) {
            log.warn("fetch thumbnail failed, url={}, error={}", url, ex.getMessage());
            return ThumbnailResponse.builder()
                .statusCode(resolveStatusCode(ex))
                .url(url)
                .elapsedMs(System.currentTimeMillis() - start)
                .error(resolveError(ex))
                .build();
        }
    }

    static int resolveStatusCode(Exception ex) {
        if (ex instanceof IllegalArgumentException) {
            return 400;
        }
        if (ex instanceof InventoryParseException || ex instanceof IllegalStateException) {
            return 422;
        }
        if (ex instanceof IOException) {
            return 502;
        }
        return 500;
    }

    private static String resolveError(Exception ex) {
        if (ex instanceof InvalidResponseException invalid) {
            return "upstream responded " + invalid.getStatusCode();
        }
        return StringUtils.isBlank(ex.getMessage()) ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static boolean isSupportedHttpUrl(String url) {
        if (StringUtils.isBlank(url)) {
            return false;
        }
        String normalized = url.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("http://") || normalized.startsWith("https://");
    }

}
