package fun.fengwk.brickhub.core.service.scrape.dom;

/**
 * Text run of the page tree.
 *
 * @param content raw text as emitted by the tokenizer
 * @param preserveWhitespace true inside {@code pre}/{@code code}, where whitespace is rendered verbatim
 * @author fengwk
 */
public record DomText(String content, boolean preserveWhitespace) implements DomNode {

    public static final String NAME = "#text";

    public DomText {
        content = content == null ? "" : content;
    }

    @Override
    public String name() {
        return NAME;
    }

}
