package fun.fengwk.brickhub.core.service.scrape.parser;

import fun.fengwk.brickhub.core.service.scrape.dom.DomElement;
import fun.fengwk.brickhub.core.service.scrape.dom.DomNode;
import fun.fengwk.brickhub.core.service.scrape.dom.DomText;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders the page tree as markdown.
 *
 * <p>Only the tag subset found on catalog pages is handled. Unknown tags contribute their
 * children's text without markup, and page chrome such as scripts, forms and footers is dropped.
 * Block-level output always ends with a blank line.
 *
 * @author fengwk
 */
@Component
public class MarkdownRenderer {

    private static final Set<String> SUPPRESSED_TAGS = Set.of(
        "script", "style", "iframe", "nav", "meta", "link", "title",
        "select", "input", "button", "noscript", "footer"
    );

    private static final Set<String> TABLE_SECTION_TAGS = Set.of("thead", "tbody", "tfoot");

    public String render(DomNode node) {
        return render(node, false);
    }

    private String render(DomNode node, boolean insidePre) {
        if (node instanceof DomText text) {
            return renderText(text);
        }
        DomElement element = (DomElement) node;
        if (SUPPRESSED_TAGS.contains(element.tag())) {
            return "";
        }
        String result = renderElement(element, insidePre);
        if (DomElement.isBlockLevel(element)) {
            result = MarkdownText.ensureTwoTrailingNewlines(result);
        }
        return result;
    }

    private String renderElement(DomElement element, boolean insidePre) {
        String tag = element.tag();
        return switch (tag) {
            case "p", "div" -> renderContainer(element, insidePre);
            case "b", "strong" -> wrapInline(renderChildren(element, insidePre), "**");
            case "i", "em" -> wrapInline(renderChildren(element, insidePre), "*");
            case "code" -> insidePre
                ? renderChildren(element, true)
                : wrapInline(renderChildren(element, false), "`");
            case "a" -> renderLink(element, insidePre);
            case "img" -> renderImage(element);
            case "figcaption" -> "\n" + MarkdownText.trim(renderChildren(element, insidePre));
            case "br" -> "\n";
            case "ul" -> renderList(element, false, insidePre);
            case "ol" -> renderList(element, true, insidePre);
            case "li" -> MarkdownText.trim(renderChildren(element, insidePre));
            case "h1", "h2", "h3", "h4", "h5", "h6" -> renderHeading(element, insidePre);
            case "blockquote" -> renderBlockquote(element, insidePre);
            case "pre" -> renderPre(element);
            case "table" -> renderTable(element, insidePre);
            case "tr" -> renderStandaloneRow(element, insidePre);
            case "th" -> "**" + normalizeCell(MarkdownText.trim(renderChildren(element, insidePre))) + "**";
            case "td" -> normalizeCell(MarkdownText.trim(renderChildren(element, insidePre)));
            default -> renderChildren(element, insidePre);
        };
    }

    private String renderChildren(DomElement element, boolean insidePre) {
        StringBuilder builder = new StringBuilder();
        for (DomNode child : element.children()) {
            builder.append(render(child, insidePre));
        }
        return builder.toString();
    }

    private String renderText(DomText text) {
        String content = text.content();
        if (text.preserveWhitespace()) {
            return content;
        }
        // Only a literal space survives at the edges, a line break from source formatting does not.
        boolean leadingSpace = content.startsWith(" ");
        boolean trailingSpace = content.endsWith(" ");
        String body = MarkdownText.normalizeWhitespace(content);
        if (body.isEmpty()) {
            return leadingSpace || trailingSpace ? " " : "";
        }
        return (leadingSpace ? " " : "") + body + (trailingSpace ? " " : "");
    }

    private String renderContainer(DomElement element, boolean insidePre) {
        String content = "";
        for (DomNode child : element.children()) {
            if (DomElement.isBlockLevel(child)) {
                content = MarkdownText.ensureTwoTrailingNewlines(content);
            }
            content += render(child, insidePre);
        }
        return MarkdownText.trim(content);
    }

    private String wrapInline(String content, String marker) {
        String trimmed = MarkdownText.trim(content);
        if (trimmed.isEmpty()) {
            return content.isEmpty() ? "" : " ";
        }
        String leading = MarkdownText.startsWithWhitespace(content) ? " " : "";
        String trailing = MarkdownText.endsWithWhitespace(content) ? " " : "";
        return leading + marker + trimmed + marker + trailing;
    }

    private String renderLink(DomElement element, boolean insidePre) {
        String href = element.attribute("href");
        String content = MarkdownText.trim(renderChildren(element, insidePre));
        if (hasFragment(href)) {
            return content;
        }
        if (!href.isEmpty() && !content.isEmpty()) {
            return "[" + content + "](" + href + ")";
        }
        return "";
    }

    private boolean hasFragment(String href) {
        if (href.indexOf('#') < 0) {
            return false;
        }
        try {
            return URI.create(href).getRawFragment() != null;
        } catch (IllegalArgumentException ex) {
            return !href.substring(href.indexOf('#') + 1).isEmpty();
        }
    }

    private String renderImage(DomElement element) {
        String src = element.attribute("src");
        String alt = element.attributes().getOrDefault("alt", "Image");
        if (src.isEmpty() || src.startsWith("data:")) {
            return "";
        }
        return "![" + alt + "](" + src + ")";
    }

    private String renderList(DomElement element, boolean ordered, boolean insidePre) {
        StringBuilder builder = new StringBuilder();
        int index = 1;
        for (DomNode child : element.children()) {
            String childText = render(child, insidePre);
            if (childText.isEmpty()) {
                continue;
            }
            if (ordered) {
                builder.append(index).append(". ");
                index++;
            } else {
                builder.append("- ");
            }
            builder.append(childText).append("\n");
        }
        return builder.toString();
    }

    private String renderHeading(DomElement element, boolean insidePre) {
        int level = element.tag().charAt(1) - '0';
        return "#".repeat(level) + " " + renderChildren(element, insidePre);
    }

    private String renderBlockquote(DomElement element, boolean insidePre) {
        List<String> parts = new ArrayList<>();
        for (DomNode child : element.children()) {
            String childText = MarkdownText.trim(render(child, insidePre));
            if (!childText.isEmpty()) {
                parts.add(childText);
            }
        }
        if (parts.isEmpty()) {
            return "";
        }
        return "> " + String.join("\n", parts).replace("\n", "\n> ");
    }

    private String renderPre(DomElement element) {
        List<DomNode> children = element.children();
        String content;
        if (children.size() == 1 && children.get(0) instanceof DomElement code && "code".equals(code.tag())) {
            content = renderChildren(code, true);
        } else {
            content = renderChildren(element, true);
        }
        return "```\n" + MarkdownText.trimNewlines(content) + "\n```\n";
    }

    private String renderStandaloneRow(DomElement row, boolean insidePre) {
        List<String> cells = new ArrayList<>();
        for (DomNode cell : row.children()) {
            cells.add(MarkdownText.trim(render(cell, insidePre)));
        }
        return String.join(" | ", cells) + "\n";
    }

    private String renderTable(DomElement table, boolean insidePre) {
        List<List<String>> rows = new ArrayList<>();
        int columnCount = 0;
        for (DomElement row : collectRows(table)) {
            List<String> cells = new ArrayList<>();
            for (DomNode cell : row.children()) {
                cells.add(MarkdownText.trim(render(cell, insidePre)));
            }
            columnCount = Math.max(columnCount, cells.size());
            rows.add(cells);
        }
        if (rows.isEmpty() || columnCount == 0) {
            return "";
        }
        for (List<String> row : rows) {
            while (row.size() < columnCount) {
                row.add("");
            }
        }
        return formatTable(rows, columnCount);
    }

    private List<DomElement> collectRows(DomElement table) {
        List<DomElement> rows = new ArrayList<>();
        for (DomNode child : table.children()) {
            if (!(child instanceof DomElement element)) {
                continue;
            }
            if ("tr".equals(element.tag())) {
                rows.add(element);
            } else if (TABLE_SECTION_TAGS.contains(element.tag())) {
                for (DomNode sectionChild : element.children()) {
                    if (sectionChild instanceof DomElement row && "tr".equals(row.tag())) {
                        rows.add(row);
                    }
                }
            }
        }
        return rows;
    }

    private String formatTable(List<List<String>> rows, int columnCount) {
        int[] columnWidths = new int[columnCount];
        for (List<String> row : rows) {
            for (int i = 0; i < columnCount; i++) {
                for (String line : row.get(i).split("\n", -1)) {
                    columnWidths[i] = Math.max(columnWidths[i], MarkdownText.width(line));
                }
            }
        }

        StringBuilder table = new StringBuilder();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            List<String[]> cellLines = new ArrayList<>();
            int lineCount = 1;
            for (String cell : rows.get(rowIndex)) {
                String[] lines = cell.split("\n", -1);
                cellLines.add(lines);
                lineCount = Math.max(lineCount, lines.length);
            }
            for (int lineIndex = 0; lineIndex < lineCount; lineIndex++) {
                table.append('|');
                for (int i = 0; i < columnCount; i++) {
                    String[] lines = cellLines.get(i);
                    String line = lineIndex < lines.length ? lines[lineIndex] : "";
                    table.append(' ').append(padRight(line, columnWidths[i])).append(" |");
                }
                table.append('\n');
            }
            if (rowIndex == 0) {
                List<String> separators = new ArrayList<>();
                for (int width : columnWidths) {
                    // Markdown needs at least three dashes per column.
                    separators.add("-".repeat(Math.max(width, 3)));
                }
                table.append("| ").append(String.join(" | ", separators)).append(" |\n");
            }
        }
        return table.toString();
    }

    private String padRight(String line, int width) {
        int padding = width - MarkdownText.width(line);
        return padding > 0 ? line + " ".repeat(padding) : line;
    }

    private String normalizeCell(String content) {
        String normalized = content.replace("\r\n", "\n").replaceAll("\n{2,}", "\n");
        List<String> lines = new ArrayList<>();
        for (String line : normalized.split("\n", -1)) {
            lines.add(MarkdownText.trim(line));
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }

}
