package fun.fengwk.brickhub.core.service.scrape.dom;

import java.util.Map;

/**
 * Receiver of the tokenizer's event stream.
 *
 * @author fengwk
 */
public interface HtmlEventHandler {

    void openTag(String name, Map<String, String> attributes);

    void text(String content);

    void closeTag(String name);

}
