package fun.fengwk.brickhub.core.service.scrape.dom;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class DomTreeBuilderTest {

    private static final String BASE_URL = "https://www.bricklink.com/catalogItemInv.asp?S=41050-1&viewType=R";

    private final DomTreeBuilder domTreeBuilder = new DomTreeBuilder(new JsoupHtmlEventSource());

    @Test
    void shouldResolveRelativeHrefsAndDropJavascriptHrefs() {
        DomElement root = build("""
            <div>
              <a href="/catalog.asp">Catalog</a>
              <a href="javascript:void(0)">Toggle</a>
              <a href="https://img.bricklink.com/S/1.jpg">Image</a>
            </div>
            """);

        List<DomElement> links = DomQueries.descendants(root, "a");

        assertThat(links).hasSize(3);
        assertThat(links.get(0).attribute("href")).isEqualTo("https://www.bricklink.com/catalog.asp");
        assertThat(links.get(1).attributes()).doesNotContainKey("href");
        assertThat(links.get(2).attribute("href")).isEqualTo("https://img.bricklink.com/S/1.jpg");
    }

    @Test
    void shouldKeepUnresolvableHrefVerbatim() {
        DomElement root = build("<p><a href=\"bad path\">x</a></p>");

        DomElement link = DomQueries.descendants(root, "a").get(0);

        assertThat(link.attribute("href")).isEqualTo("bad path");
    }

    @Test
    void shouldDiscardIndentationInsideContainers() {
        DomElement root = build("""
            <ul>
              <li>first</li>
              <li>second</li>
            </ul>
            """);

        DomElement list = DomQueries.descendants(root, "ul").get(0);

        assertThat(list.children()).hasSize(2).allMatch(child -> child instanceof DomElement);
    }

    @Test
    void shouldKeepWhitespaceTextInsideInlineElements() {
        DomElement root = build("<p>a<b> </b>b</p>");

        DomElement bold = DomQueries.descendants(root, "b").get(0);

        assertThat(bold.children()).containsExactly(new DomText(" ", false));
    }

    @Test
    void shouldPreserveTextInsidePre() {
        DomElement root = build("<pre><code>  first\n    second</code></pre>");

        DomElement code = DomQueries.descendants(root, "code").get(0);

        assertThat(code.children()).containsExactly(new DomText("  first\n    second", true));
    }

    @Test
    void shouldIgnoreUnbalancedCloseTags() {
        DomTreeBuilder builder = new DomTreeBuilder((html, baseUrl, handler) -> {
            handler.closeTag("div");
            handler.openTag("p", Map.of());
            handler.text("hello");
            handler.closeTag("p");
            handler.closeTag("p");
            handler.closeTag("body");
        });

        DomElement root = builder.build(new byte[] {1}, null);

        assertThat(root.tag()).isEqualTo("p");
        assertThat(DomQueries.textContent(root)).isEqualTo("hello");
    }

    @Test
    void shouldKeepLaterTopLevelElementsUnderTheFirstRoot() {
        DomTreeBuilder builder = new DomTreeBuilder((html, baseUrl, handler) -> {
            handler.openTag("div", Map.of());
            handler.closeTag("div");
            handler.openTag("span", Map.of());
            handler.closeTag("span");
        });

        DomElement root = builder.build(new byte[] {1}, null);

        assertThat(root.tag()).isEqualTo("div");
        assertThat(DomQueries.childElements(root, "span")).hasSize(1);
    }

    @Test
    void shouldRejectEmptyHtml() {
        assertThatThrownBy(() -> domTreeBuilder.build(new byte[0], BASE_URL))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("html is empty");
    }

    @Test
    void shouldFailWithoutRootElement() {
        DomTreeBuilder builder = new DomTreeBuilder((html, baseUrl, handler) -> handler.text("orphan"));

        assertThatThrownBy(() -> builder.build(new byte[] {1}, null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldSkipScriptData() {
        DomElement root = build("<div>keep<script>var hidden = 1;</script></div>");

        DomElement script = DomQueries.descendants(root, "script").get(0);

        assertThat(script.children()).isEmpty();
    }

    private DomElement build(String html) {
        return domTreeBuilder.build(html.getBytes(StandardCharsets.UTF_8), BASE_URL);
    }

}
