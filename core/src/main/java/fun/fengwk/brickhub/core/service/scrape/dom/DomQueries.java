package fun.fengwk.brickhub.core.service.scrape.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Small lookup helpers over the page tree.
 *
 * @author fengwk
 */
public final class DomQueries {

    private DomQueries() {
    }

    /**
     * Depth-first list of elements named {@code tag}, including {@code element} itself.
     */
    public static List<DomElement> descendants(DomElement element, String tag) {
        List<DomElement> result = new ArrayList<>();
        collect(element, tag, result);
        return result;
    }

    public static Optional<DomElement> firstDescendant(DomElement element, Predicate<DomElement> predicate) {
        for (DomNode child : element.children()) {
            if (child instanceof DomElement childElement) {
                if (predicate.test(childElement)) {
                    return Optional.of(childElement);
                }
                Optional<DomElement> match = firstDescendant(childElement, predicate);
                if (match.isPresent()) {
                    return match;
                }
            }
        }
        return Optional.empty();
    }

    public static List<DomElement> childElements(DomElement element, String tag) {
        List<DomElement> result = new ArrayList<>();
        for (DomNode child : element.children()) {
            if (child instanceof DomElement childElement && childElement.tag().equals(tag)) {
                result.add(childElement);
            }
        }
        return result;
    }

    public static String textContent(DomNode node) {
        if (node instanceof DomText text) {
            return text.content();
        }
        StringBuilder builder = new StringBuilder();
        for (DomNode child : ((DomElement) node).children()) {
            builder.append(textContent(child));
        }
        return builder.toString();
    }

    private static void collect(DomElement element, String tag, List<DomElement> result) {
        if (element.tag().equals(tag)) {
            result.add(element);
        }
        for (DomNode child : element.children()) {
            if (child instanceof DomElement childElement) {
                collect(childElement, tag, result);
            }
        }
    }

}
