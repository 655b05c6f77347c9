package fun.fengwk.brickhub.core.service.scrape.dom;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assembles the page tree from the tokenizer's event stream.
 *
 * <p>Link targets are made absolute against the page url while the tree is built, and
 * whitespace-only text in list/table/container elements is dropped so that source indentation
 * does not turn into paragraph breaks.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DomTreeBuilder {

    private static final Set<String> WHITESPACE_SENSITIVE_TAGS = Set.of("pre", "code");

    private static final Set<String> WHITESPACE_DISCARDING_TAGS = Set.of(
        "ul", "ol", "body", "div", "blockquote", "tr", "table"
    );

    private static final Pattern BLANK = Pattern.compile("(?U)\\s*");

    private final HtmlEventSource eventSource;

    public DomTreeBuilder(HtmlEventSource eventSource) {
        this.eventSource = eventSource;
    }

    public DomElement build(byte[] html, String baseUrl) {
        if (html == null || html.length == 0) {
            throw new IllegalArgumentException("html is empty");
        }
        TreeAssembler assembler = new TreeAssembler(parseBaseUri(baseUrl));
        eventSource.parse(html, baseUrl, assembler);
        if (assembler.root == null) {
            throw new IllegalStateException("html has no root element");
        }
        return assembler.root;
    }

    private URI parseBaseUri(String baseUrl) {
        if (StringUtils.isBlank(baseUrl)) {
            return null;
        }
        try {
            return URI.create(baseUrl.trim());
        } catch (IllegalArgumentException ex) {
            log.debug("ignore unparsable base url, baseUrl={}, error={}", baseUrl, ex.getMessage());
            return null;
        }
    }

    private static final class TreeAssembler implements HtmlEventHandler {

        private final URI baseUri;
        private final Deque<DomElement> openElements = new ArrayDeque<>();
        private DomElement root;

        private TreeAssembler(URI baseUri) {
            this.baseUri = baseUri;
        }

        @Override
        public void openTag(String name, Map<String, String> attributes) {
            Map<String, String> rewritten = new LinkedHashMap<>(attributes);
            if ("a".equals(name)) {
                rewriteHref(rewritten);
            }
            DomElement element = new DomElement(name, rewritten);
            DomElement current = openElements.peek();
            if (current != null) {
                current.appendChild(element);
            } else if (root == null) {
                root = element;
            } else {
                // A second top-level element is kept under the first root to stay single-rooted.
                root.appendChild(element);
            }
            openElements.push(element);
        }

        @Override
        public void text(String content) {
            DomElement current = openElements.peek();
            if (current == null) {
                return;
            }
            if (insideWhitespaceSensitiveElement()) {
                current.appendChild(new DomText(content, true));
                return;
            }
            if (BLANK.matcher(content).matches() && WHITESPACE_DISCARDING_TAGS.contains(current.tag())) {
                return;
            }
            current.appendChild(new DomText(content, false));
        }

        @Override
        public void closeTag(String name) {
            // Unbalanced close tags from broken markup are ignored.
            if (!openElements.isEmpty()) {
                openElements.pop();
            }
        }

        private boolean insideWhitespaceSensitiveElement() {
            for (DomElement element : openElements) {
                if (WHITESPACE_SENSITIVE_TAGS.contains(element.tag())) {
                    return true;
                }
            }
            return false;
        }

        private void rewriteHref(Map<String, String> attributes) {
            String href = attributes.get("href");
            if (href == null) {
                return;
            }
            if (href.trim().toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                attributes.remove("href");
                return;
            }
            if (baseUri == null) {
                return;
            }
            try {
                attributes.put("href", baseUri.resolve(href.trim()).toString());
            } catch (IllegalArgumentException ex) {
                log.debug("keep unresolvable href, href={}, error={}", href, ex.getMessage());
            }
        }

    }

}
