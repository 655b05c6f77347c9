package fun.fengwk.brickhub.core.service.scrape.dom;

/**
 * Error-tolerant tokenizer that streams parse events for an html document.
 *
 * @author fengwk
 */
public interface HtmlEventSource {

    void parse(byte[] html, String baseUrl, HtmlEventHandler handler);

}
