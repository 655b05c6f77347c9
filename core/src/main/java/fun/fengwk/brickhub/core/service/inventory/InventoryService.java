package fun.fengwk.brickhub.core.service.inventory;

import fun.fengwk.brickhub.core.service.catalog.CatalogPageClient;
import fun.fengwk.brickhub.core.service.catalog.CatalogProperties;
import fun.fengwk.brickhub.core.service.inventory.model.Category;
import fun.fengwk.brickhub.core.service.inventory.model.ExtractionMode;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import fun.fengwk.brickhub.core.service.inventory.model.Minifigure;
import fun.fengwk.brickhub.core.service.scrape.parser.HtmlMarkdownConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Fetches a set inventory page and turns it into a fully enriched {@link Inventory}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryService {

    private static final String SET_ROOT_CATEGORY = "Sets";
    private static final String MINIFIGURE_ROOT_CATEGORY = "Minifigures";

    private final CatalogProperties catalogProperties;
    private final CatalogPageClient catalogPageClient;
    private final HtmlMarkdownConverter htmlMarkdownConverter;
    private final InventoryExtractor inventoryExtractor;
    private final InventoryEnricher inventoryEnricher;

    public Inventory fetchInventory(String setNumber) throws IOException {
        String normalized = normalizeSetNumber(setNumber);
        String url = buildInventoryUrl(normalized);
        long start = System.currentTimeMillis();

        byte[] html = catalogPageClient.fetchHtml(url);
        String markdown = htmlMarkdownConverter.convert(html, url);
        Inventory inventory = inventoryExtractor.extract(markdown, normalized, url, ExtractionMode.FULL);
        Inventory enriched = inventoryEnricher.enrich(inventory, catalogProperties.getNestedInventoryDepth());

        log.info("inventory fetched, setNumber={}, parts={}, minifigures={}, elapsedMs={}",
            normalized, enriched.getParts().size(), enriched.getMinifigures().size(),
            System.currentTimeMillis() - start);
        List<Minifigure> minifigures = enriched.getMinifigures().stream()
            .map(minifigure -> minifigure.toBuilder()
                .categories(stripRootCategory(minifigure.getCategories(), MINIFIGURE_ROOT_CATEGORY))
                .build())
            .toList();
        return enriched.toBuilder()
            .categories(stripRootCategory(enriched.getCategories(), SET_ROOT_CATEGORY))
            .minifigures(minifigures)
            .build();
    }

    /**
     * Appends the default {@code -1} variant when the set number carries none.
     */
    public static String normalizeSetNumber(String setNumber) {
        if (StringUtils.isBlank(setNumber)) {
            throw new IllegalArgumentException("setNumber is blank");
        }
        String trimmed = setNumber.trim();
        return trimmed.contains("-") ? trimmed : trimmed + "-1";
    }

    String buildInventoryUrl(String normalizedSetNumber) {
        return StringUtils.removeEnd(catalogProperties.getBaseUrl(), "/")
            + "/catalogItemInv.asp?S=" + URLEncoder.encode(normalizedSetNumber, StandardCharsets.UTF_8)
            + "&viewType=R";
    }

    /**
     * Drops the collection root, the breadcrumb starts at the first real category.
     */
    private static List<Category> stripRootCategory(List<Category> categories, String root) {
        if (!categories.isEmpty() && root.equalsIgnoreCase(categories.get(0).name())) {
            return List.copyOf(categories.subList(1, categories.size()));
        }
        return categories;
    }

}
