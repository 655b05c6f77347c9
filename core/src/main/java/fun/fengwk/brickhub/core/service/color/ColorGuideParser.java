package fun.fengwk.brickhub.core.service.color;

import fun.fengwk.brickhub.core.service.scrape.dom.DomElement;
import fun.fengwk.brickhub.core.service.scrape.dom.DomQueries;
import fun.fengwk.brickhub.core.service.scrape.dom.DomTreeBuilder;
import fun.fengwk.brickhub.core.service.scrape.parser.MarkdownText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the color table of the BrickLink color guide page.
 *
 * <p>Rows with fewer than eight cells, or missing the name, the LEGO mapping or a numeric id, are
 * not colors and are skipped.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColorGuideParser {

    private static final int MIN_CELL_COUNT = 8;
    private static final String LEGO_COLOR_LABEL = "LEGO Color:";
    private static final String SWATCH_PROPERTY = "--bl-castor-table-swatch-with-image-background-color";

    private final DomTreeBuilder domTreeBuilder;

    public List<ColorGuideEntry> parse(byte[] html, String baseUrl) {
        DomElement root = domTreeBuilder.build(html, baseUrl);
        List<ColorGuideEntry> entries = new ArrayList<>();
        for (DomElement row : DomQueries.descendants(root, "tr")) {
            parseRow(row).ifPresent(entries::add);
        }
        if (entries.isEmpty()) {
            throw new IllegalStateException("color guide table not found");
        }
        log.debug("color guide parsed, entries={}", entries.size());
        return List.copyOf(entries);
    }

    private Optional<ColorGuideEntry> parseRow(DomElement row) {
        List<DomElement> cells = DomQueries.childElements(row, "td");
        if (cells.size() < MIN_CELL_COUNT) {
            return Optional.empty();
        }

        DomElement nameCell = cells.get(1);
        Optional<DomElement> legoInfo = DomQueries.firstDescendant(nameCell, element ->
            "span".equals(element.tag()) && DomQueries.textContent(element).contains(LEGO_COLOR_LABEL));
        Optional<DomElement> nameElement = DomQueries.firstDescendant(nameCell, element -> "p".equals(element.tag()));
        if (legoInfo.isEmpty() || nameElement.isEmpty()) {
            return Optional.empty();
        }

        String idText = MarkdownText.trim(DomQueries.textContent(cells.get(cells.size() - 1))).replace(",", "");
        Integer brickLinkId = parseInteger(idText);
        if (brickLinkId == null) {
            return Optional.empty();
        }

        String legoText = MarkdownText.trim(DomQueries.textContent(legoInfo.get()).replace('\u00a0', ' '));
        String legoDetails = MarkdownText.trim(legoText.replace(LEGO_COLOR_LABEL, ""));
        String legoName = legoDetails.isEmpty() ? null : legoDetails;
        Integer legoId = null;
        int hyphen = legoDetails.lastIndexOf('-');
        if (hyphen >= 0) {
            legoName = MarkdownText.trim(legoDetails.substring(0, hyphen));
            legoId = parseInteger(MarkdownText.trim(legoDetails.substring(hyphen + 1)));
        }

        return Optional.of(new ColorGuideEntry(
            brickLinkId,
            MarkdownText.trim(DomQueries.textContent(nameElement.get())),
            legoName,
            legoId,
            hexColor(cells.get(0))
        ));
    }

    private static String hexColor(DomElement swatchCell) {
        for (String declaration : swatchCell.attribute("style").split(";")) {
            String trimmed = MarkdownText.trim(declaration);
            if (!trimmed.startsWith(SWATCH_PROPERTY + ":")) {
                continue;
            }
            String value = MarkdownText.trim(trimmed.substring(SWATCH_PROPERTY.length() + 1));
            if (value.startsWith("#")) {
                return value;
            }
        }
        return null;
    }

    private static Integer parseInteger(String text) {
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

}
