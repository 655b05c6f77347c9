package fun.fengwk.brickhub.core.service.scrape.dom;

/**
 * Node of the page tree, either an element or a text run.
 *
 * @author fengwk
 */
public sealed interface DomNode permits DomElement, DomText {

    /**
     * Tag name for elements, {@code #text} for text runs.
     */
    String name();

}
