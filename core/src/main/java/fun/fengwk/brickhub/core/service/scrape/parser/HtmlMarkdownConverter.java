package fun.fengwk.brickhub.core.service.scrape.parser;

import fun.fengwk.brickhub.core.service.scrape.dom.DomElement;
import fun.fengwk.brickhub.core.service.scrape.dom.DomTreeBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts html page bytes into a trimmed markdown document.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class HtmlMarkdownConverter {

    private final DomTreeBuilder domTreeBuilder;
    private final MarkdownRenderer markdownRenderer;

    public String convert(byte[] html, String baseUrl) {
        DomElement root = domTreeBuilder.build(html, baseUrl);
        return MarkdownText.trim(markdownRenderer.render(root));
    }

}
