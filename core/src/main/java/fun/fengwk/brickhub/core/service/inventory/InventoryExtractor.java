package fun.fengwk.brickhub.core.service.inventory;

import fun.fengwk.brickhub.core.service.inventory.model.Category;
import fun.fengwk.brickhub.core.service.inventory.model.ExtractionMode;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import fun.fengwk.brickhub.core.service.inventory.model.ItemType;
import fun.fengwk.brickhub.core.service.inventory.model.Minifigure;
import fun.fengwk.brickhub.core.service.inventory.model.Part;
import fun.fengwk.brickhub.core.service.inventory.model.PartSection;
import fun.fengwk.brickhub.core.service.scrape.parser.MarkdownText;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the item table of a rendered inventory page.
 *
 * <p>The table is scanned line by line. Marker rows switch the current section
 * (regular/counterpart/extra/alternate) and the current item type (parts/minifigures), and both
 * stick until the next marker. Rows carrying a catalog link of the current item type become
 * records, everything else is skipped. A row that looks like an item but cannot be parsed aborts
 * the whole extraction.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class InventoryExtractor {

    static final String TABLE_HEADER_MARKER = "| **Image**";
    static final String BRICKLINK_HOST = "https://www.bricklink.com";

    private static final String ITEM_PICTURE_MARKER = "catalogItemPic.asp";
    private static final String SET_PICTURE_MARKER = "catalogItemPic.asp?S=";
    private static final String PART_INVENTORY_MARKER = "catalogItemInv.asp?P=";
    private static final String BREADCRUMB_MARKER = "[Catalog]";
    private static final String CATEGORY_LABEL = "Catalog:";

    private static final Pattern LINK_PATTERN = Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)");
    private static final Pattern IMAGE_PATTERN = Pattern.compile("!\\[[^\\]]*\\]\\(([^)]+)\\)");
    private static final Pattern SET_NAME_PATTERN = Pattern.compile("Name:\\s*([^)\\]]+)");
    private static final Pattern BOLD_PATTERN = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern QUANTITY_PATTERN = Pattern.compile("\\d{1,9}");
    private static final Pattern SECTION_PATTERN =
        Pattern.compile("(regular|extras?|counterparts?|alternates?)(?: items?)?");
    private static final Pattern PUNCTUATION_PATTERN = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    private static final List<String> SET_NAME_DISALLOWED_WORDS = List.of(
        "image", "qty", "parts", "regular items", "mid"
    );

    public Inventory extract(String markdown, String setNumber, String baseUrl, ExtractionMode mode) {
        List<String> lines = Arrays.asList(StringUtils.defaultString(markdown).split("\\R", -1));

        int headerIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(TABLE_HEADER_MARKER)) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw InventoryParseException.tableNotFound();
        }

        TableScan scan = new TableScan(lines, baseUrl, mode);
        // Item rows start after the header and its separator.
        scan.run(headerIndex + 2);

        Inventory.InventoryBuilder builder = Inventory.builder()
            .setNumber(setNumber)
            .parts(List.copyOf(scan.parts));
        if (mode == ExtractionMode.PARTS_ONLY) {
            return builder.name(setNumber).build();
        }

        String name = extractSetName(lines);
        if (StringUtils.isBlank(name)) {
            throw InventoryParseException.missingSetName(setNumber);
        }
        return builder
            .name(name)
            .thumbnailUrl(extractThumbnailUrl(lines))
            .categories(extractBreadcrumb(lines, baseUrl))
            .minifigures(List.copyOf(scan.minifigures))
            .build();
    }

    private final class TableScan {

        private final List<String> lines;
        private final String baseUrl;
        private final ExtractionMode mode;
        private final List<Part> parts = new ArrayList<>();
        private final List<Minifigure> minifigures = new ArrayList<>();

        private PartSection currentSection = PartSection.REGULAR;
        private ItemType currentItemType = ItemType.PARTS;

        private TableScan(List<String> lines, String baseUrl, ExtractionMode mode) {
            this.lines = lines;
            this.baseUrl = baseUrl;
            this.mode = mode;
        }

        private void run(int startIndex) {
            int index = startIndex;
            while (index < lines.size()) {
                String line = MarkdownText.trim(lines.get(index));
                index++;
                if (!line.startsWith("|")) {
                    continue;
                }

                List<String> columns = splitColumns(line);
                if (!containsItemLink(columns)) {
                    applyMarkers(line, columns);
                    continue;
                }
                if (!containsLink(columns, currentItemType.getLinkMarker())) {
                    continue;
                }

                // Multi-line cells are rendered as several physical lines, fold them back into one row.
                while (index < lines.size() && isContinuation(lines.get(index), columns.size())) {
                    mergeColumns(columns, splitColumns(MarkdownText.trim(lines.get(index))));
                    index++;
                }

                try {
                    if (currentItemType == ItemType.PARTS) {
                        parts.add(parsePartRow(columns, baseUrl, currentSection));
                    } else if (mode == ExtractionMode.FULL) {
                        minifigures.add(parseMinifigureRow(columns, baseUrl));
                    }
                } catch (RuntimeException ex) {
                    log.debug("inventory row rejected, line={}, error={}", line, ex.getMessage());
                    throw InventoryParseException.malformedRow(line, ex);
                }
            }
        }

        private void applyMarkers(String line, List<String> columns) {
            Optional<PartSection> section = matchSection(columns);
            if (section.isPresent()) {
                currentSection = section.get();
                return;
            }
            String lowerCaseLine = line.toLowerCase(Locale.ROOT);
            if (lowerCaseLine.contains(BREADCRUMB_MARKER.toLowerCase(Locale.ROOT))) {
                return;
            }
            if (lowerCaseLine.contains("minifigures:")) {
                currentItemType = ItemType.MINIFIGURES;
            } else if (lowerCaseLine.contains("parts:")) {
                currentItemType = ItemType.PARTS;
            }
        }

        private boolean isContinuation(String rawLine, int columnCount) {
            String line = MarkdownText.trim(rawLine);
            if (!line.startsWith("|")) {
                return false;
            }
            List<String> columns = splitColumns(line);
            if (columns.size() != columnCount || containsItemLink(columns) || containsLink(columns, ITEM_PICTURE_MARKER)) {
                return false;
            }
            String lowerCaseLine = line.toLowerCase(Locale.ROOT);
            return matchSection(columns).isEmpty()
                && !lowerCaseLine.contains("minifigures:")
                && !lowerCaseLine.contains("parts:");
        }

    }

    private Part parsePartRow(List<String> columns, String baseUrl, PartSection section) {
        String imageColumn = findImageColumn(columns);
        String linkColumn = findColumn(columns, ItemType.PARTS.getLinkMarker());
        String descriptionColumn = findDescriptionColumn(columns, "Part No:");

        Link link = firstLink(linkColumn)
            .orElseThrow(() -> new IllegalArgumentException("part link missing"));
        if (StringUtils.isBlank(link.text())) {
            throw new IllegalArgumentException("part id missing");
        }
        String partUrl = resolveUrl(link.url(), baseUrl);
        String partName = MarkdownText.normalizeWhitespace(extractItemName(imageColumn));
        String description = normalizeDescription(descriptionColumn);

        return Part.builder()
            .partId(MarkdownText.trim(link.text()))
            .partUrl(partUrl)
            .name(partName.isEmpty() ? description : partName)
            .colorName(extractColorName(description, partName))
            .colorId(queryParameter(partUrl, "idColor"))
            .imageUrl(extractImageUrl(imageColumn))
            .quantity(extractQuantity(columns))
            .section(section)
            .inventoryUrl(findRowLink(columns, PART_INVENTORY_MARKER, baseUrl))
            .build();
    }

    private Minifigure parseMinifigureRow(List<String> columns, String baseUrl) {
        String imageColumn = findImageColumn(columns);
        String linkColumn = findColumn(columns, ItemType.MINIFIGURES.getLinkMarker());
        String descriptionColumn = findDescriptionColumn(columns, "Minifig No:");

        List<Link> links = allLinks(linkColumn);
        if (links.isEmpty() || StringUtils.isBlank(links.get(0).text())) {
            throw new IllegalArgumentException("minifigure identifier missing");
        }
        Link catalogLink = links.get(0);
        String name = MarkdownText.normalizeWhitespace(extractItemName(imageColumn));
        if (name.isEmpty()) {
            name = normalizeDescription(descriptionColumn);
        }

        return Minifigure.builder()
            .identifier(MarkdownText.trim(catalogLink.text()))
            .name(name)
            .quantity(extractQuantity(columns))
            .imageUrl(extractImageUrl(imageColumn))
            .catalogUrl(resolveUrl(catalogLink.url(), baseUrl))
            .inventoryUrl(links.size() > 1 ? resolveUrl(links.get(1).url(), baseUrl) : null)
            .categories(extractRowCategories(columns, baseUrl))
            .build();
    }

    private List<Category> extractRowCategories(List<String> columns, String baseUrl) {
        for (String column : columns) {
            int labelIndex = column.indexOf(CATEGORY_LABEL);
            if (labelIndex >= 0) {
                return extractCategories(column.substring(labelIndex + CATEGORY_LABEL.length()), baseUrl);
            }
        }
        return List.of();
    }

    private List<Category> extractBreadcrumb(List<String> lines, String baseUrl) {
        for (String line : lines) {
            if (line.contains(BREADCRUMB_MARKER)) {
                return extractCategories(line, baseUrl);
            }
        }
        return List.of();
    }

    /**
     * Collects breadcrumb links up to the first link that points at an item or a set.
     */
    private List<Category> extractCategories(String text, String baseUrl) {
        List<Category> categories = new ArrayList<>();
        for (Link link : allLinks(text)) {
            String name = MarkdownText.normalizeWhitespace(link.text());
            if (isItemScoped(link.url())) {
                break;
            }
            if (name.isEmpty() || "Catalog".equalsIgnoreCase(name)) {
                continue;
            }
            String catString = queryParameter(resolveUrl(link.url(), baseUrl), "catString");
            String id = catString.isEmpty() ? null : catString.substring(catString.lastIndexOf('.') + 1);
            categories.add(new Category(id, name));
        }
        return List.copyOf(categories);
    }

    private boolean isItemScoped(String url) {
        String lowerCaseUrl = url.toLowerCase(Locale.ROOT);
        return lowerCaseUrl.contains("catalogitem.page")
            || lowerCaseUrl.contains("catalogiteminv.asp")
            || lowerCaseUrl.contains("catalogitempic.asp")
            || lowerCaseUrl.contains("?s=")
            || lowerCaseUrl.contains("&s=");
    }

    private String extractSetName(List<String> lines) {
        for (String line : lines) {
            if (!line.contains(SET_PICTURE_MARKER)) {
                continue;
            }
            Matcher nameMatcher = SET_NAME_PATTERN.matcher(line);
            if (nameMatcher.find()) {
                String name = MarkdownText.normalizeWhitespace(nameMatcher.group(1));
                if (!name.isEmpty()) {
                    return name;
                }
            }
            Matcher boldMatcher = BOLD_PATTERN.matcher(line);
            if (boldMatcher.find()) {
                String candidate = MarkdownText.normalizeWhitespace(boldMatcher.group(1));
                String lowerCaseCandidate = candidate.toLowerCase(Locale.ROOT);
                if (SET_NAME_DISALLOWED_WORDS.stream().noneMatch(lowerCaseCandidate::contains)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private String extractThumbnailUrl(List<String> lines) {
        String fallback = null;
        for (String line : lines) {
            if (!line.contains(SET_PICTURE_MARKER)) {
                continue;
            }
            Matcher matcher = IMAGE_PATTERN.matcher(line);
            while (matcher.find()) {
                String imageUrl = absolutizeImageUrl(matcher.group(1));
                if (imageUrl.contains("/S/")) {
                    return promoteToHighResolution(imageUrl);
                }
                if (fallback == null) {
                    fallback = imageUrl;
                }
            }
        }
        return fallback;
    }

    private String promoteToHighResolution(String imageUrl) {
        try {
            URI uri = URI.create(imageUrl);
            if (uri.getHost() == null || !uri.getHost().contains("bricklink.com")
                || uri.getRawPath() == null || !uri.getRawPath().contains("/S/")) {
                return imageUrl;
            }
            return new URI(
                uri.getScheme(),
                uri.getRawAuthority(),
                uri.getRawPath().replace("/S/", "/SL/"),
                uri.getRawQuery(),
                uri.getRawFragment()
            ).toString();
        } catch (IllegalArgumentException | URISyntaxException ex) {
            log.debug("keep thumbnail url as is, url={}, error={}", imageUrl, ex.getMessage());
            return imageUrl;
        }
    }

    private String extractImageUrl(String column) {
        if (column == null) {
            return null;
        }
        Matcher matcher = IMAGE_PATTERN.matcher(column);
        return matcher.find() ? absolutizeImageUrl(matcher.group(1)) : null;
    }

    private static String absolutizeImageUrl(String rawUrl) {
        String url = MarkdownText.trim(rawUrl);
        if (url.startsWith("//")) {
            return "https:" + url;
        }
        if (url.matches("(?i)[a-z][a-z0-9+.-]*:.*")) {
            return url;
        }
        return BRICKLINK_HOST + (url.startsWith("/") ? "" : "/") + url;
    }

    /**
     * Reads the item name from the image alt text, {@code Name: <text>](}.
     */
    private String extractItemName(String column) {
        if (column == null) {
            return "";
        }
        int nameIndex = column.indexOf("Name:");
        if (nameIndex < 0) {
            return "";
        }
        String remainder = column.substring(nameIndex + "Name:".length());
        int endIndex = remainder.indexOf("](");
        if (endIndex < 0) {
            return "";
        }
        return MarkdownText.trim(remainder.substring(0, endIndex));
    }

    private String extractColorName(String description, String partName) {
        if (!partName.isEmpty()) {
            int nameIndex = description.indexOf(partName);
            if (nameIndex >= 0) {
                String colorName = MarkdownText.trim(description.substring(0, nameIndex));
                if (!colorName.isEmpty()) {
                    return colorName;
                }
            }
        }
        return description;
    }

    private String normalizeDescription(String column) {
        if (column == null) {
            return "";
        }
        String firstLine = column.split("\n", -1)[0];
        return MarkdownText.normalizeWhitespace(firstLine.replace("**", ""));
    }

    private int extractQuantity(List<String> columns) {
        for (String column : columns) {
            if (QUANTITY_PATTERN.matcher(column).matches()) {
                return Integer.parseInt(column);
            }
        }
        return 0;
    }

    private String findImageColumn(List<String> columns) {
        String column = findColumn(columns, ITEM_PICTURE_MARKER);
        return column != null ? column : findColumn(columns, "![");
    }

    private String findDescriptionColumn(List<String> columns, String excludedLabel) {
        for (String column : columns) {
            if (column.contains("**") && !column.contains(excludedLabel) && !column.contains(ITEM_PICTURE_MARKER)) {
                return column;
            }
        }
        return null;
    }

    private String findRowLink(List<String> columns, String marker, String baseUrl) {
        for (String column : columns) {
            for (Link link : allLinks(column)) {
                if (link.url().contains(marker)) {
                    return resolveUrl(link.url(), baseUrl);
                }
            }
        }
        return null;
    }

    private static String findColumn(List<String> columns, String marker) {
        for (String column : columns) {
            if (column.contains(marker)) {
                return column;
            }
        }
        return null;
    }

    private static boolean containsLink(List<String> columns, String marker) {
        return findColumn(columns, marker) != null;
    }

    private static boolean containsItemLink(List<String> columns) {
        return containsLink(columns, ItemType.PARTS.getLinkMarker())
            || containsLink(columns, ItemType.MINIFIGURES.getLinkMarker());
    }

    private static Optional<PartSection> matchSection(List<String> columns) {
        for (String column : columns) {
            String normalized = MarkdownText.normalizeWhitespace(
                PUNCTUATION_PATTERN.matcher(column.toLowerCase(Locale.ROOT)).replaceAll("")
            );
            Matcher matcher = SECTION_PATTERN.matcher(normalized);
            if (!matcher.matches()) {
                continue;
            }
            String keyword = matcher.group(1);
            if (keyword.startsWith("regular")) {
                return Optional.of(PartSection.REGULAR);
            }
            if (keyword.startsWith("extra")) {
                return Optional.of(PartSection.EXTRA);
            }
            if (keyword.startsWith("counterpart")) {
                return Optional.of(PartSection.COUNTERPART);
            }
            return Optional.of(PartSection.ALTERNATE);
        }
        return Optional.empty();
    }

    /**
     * Splits a table line into positional cells, the outer pipes do not produce cells.
     */
    private static List<String> splitColumns(String line) {
        String[] segments = line.split("\\|", -1);
        List<String> columns = new ArrayList<>();
        int end = line.endsWith("|") ? segments.length - 1 : segments.length;
        for (int i = 1; i < end; i++) {
            columns.add(MarkdownText.trim(segments[i]));
        }
        return columns;
    }

    private static void mergeColumns(List<String> columns, List<String> continuation) {
        for (int i = 0; i < columns.size(); i++) {
            String addition = continuation.get(i);
            if (addition.isEmpty()) {
                continue;
            }
            String current = columns.get(i);
            columns.set(i, current.isEmpty() ? addition : current + "\n" + addition);
        }
    }

    private static Optional<Link> firstLink(String text) {
        List<Link> links = allLinks(text);
        return links.isEmpty() ? Optional.empty() : Optional.of(links.get(0));
    }

    private static List<Link> allLinks(String text) {
        List<Link> links = new ArrayList<>();
        if (text == null) {
            return links;
        }
        Matcher matcher = LINK_PATTERN.matcher(text);
        while (matcher.find()) {
            links.add(new Link(matcher.group(1), MarkdownText.trim(matcher.group(2))));
        }
        return links;
    }

    private static String resolveUrl(String url, String baseUrl) {
        if (StringUtils.isBlank(baseUrl)) {
            return url;
        }
        try {
            return URI.create(baseUrl).resolve(url).toString();
        } catch (IllegalArgumentException ex) {
            return url;
        }
    }

    static String queryParameter(String url, String name) {
        if (url == null) {
            return "";
        }
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return "";
        }
        int fragmentStart = url.indexOf('#', queryStart);
        String query = fragmentStart < 0 ? url.substring(queryStart + 1) : url.substring(queryStart + 1, fragmentStart);
        for (String pair : query.split("&")) {
            int separator = pair.indexOf('=');
            String key = separator < 0 ? pair : pair.substring(0, separator);
            if (key.equalsIgnoreCase(name)) {
                return separator < 0 ? "" : pair.substring(separator + 1);
            }
        }
        return "";
    }

    private record Link(String text, String url) {

    }

}
