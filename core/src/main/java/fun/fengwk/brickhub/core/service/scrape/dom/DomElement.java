package fun.fengwk.brickhub.core.service.scrape.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Element of the page tree.
 *
 * <p>Children are appended only while the tree is being built; consumers see an unmodifiable view.
 *
 * @author fengwk
 */
public record DomElement(String tag, Map<String, String> attributes, List<DomNode> children) implements DomNode {

    private static final Set<String> BLOCK_LEVEL_TAGS = Set.of(
        "p", "div", "ul", "ol", "h1", "h2", "h3", "h4", "h5", "h6",
        "blockquote", "pre", "figure", "table", "noscript"
    );

    public DomElement(String tag, Map<String, String> attributes) {
        this(tag, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), new ArrayList<>());
    }

    @Override
    public String name() {
        return tag;
    }

    @Override
    public List<DomNode> children() {
        return Collections.unmodifiableList(children);
    }

    public String attribute(String key) {
        return attributes.getOrDefault(key, "");
    }

    void appendChild(DomNode child) {
        children.add(child);
    }

    public static boolean isBlockLevel(DomNode node) {
        return node instanceof DomElement element && BLOCK_LEVEL_TAGS.contains(element.tag());
    }

}
