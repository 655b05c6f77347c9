package fun.fengwk.brickhub.core.service.scrape.dom;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams jsoup's lenient parse result as open/text/close events.
 *
 * <p>Only elements and text nodes are emitted, comments, doctypes and script data are skipped.
 *
 * @author fengwk
 */
@Component
public class JsoupHtmlEventSource implements HtmlEventSource {

    @Override
    public void parse(byte[] html, String baseUrl, HtmlEventHandler handler) {
        Document document;
        try {
            document = Jsoup.parse(
                new ByteArrayInputStream(html),
                StandardCharsets.UTF_8.name(),
                StringUtils.defaultString(baseUrl)
            );
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to decode html: " + ex.getMessage(), ex);
        }

        NodeVisitor visitor = new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof Element element) {
                    handler.openTag(element.normalName(), toAttributeMap(element));
                } else if (node instanceof TextNode textNode) {
                    handler.text(textNode.getWholeText());
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element) {
                    handler.closeTag(element.normalName());
                }
            }
        };
        for (Element child : document.children()) {
            NodeTraversor.traverse(visitor, child);
        }
    }

    private Map<String, String> toAttributeMap(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return attributes;
    }

}
