package fun.fengwk.brickhub.core.mcp;

import freemarker.template.Template;
import freemarker.template.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool responses with the FreeMarker templates under {@code /mcp/templates/}.
 *
 * <p>The response is exposed to the template as {@code data}. Rendering problems are returned as
 * text so the tool call itself never fails.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    static final String MODEL_NAME = "data";

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String format(String templateName, Object response) {
        if (response == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            template.process(Map.of(MODEL_NAME, response), result);
            return result.toString();
        } catch (IOException ex) {
            log.warn("load tool result template failed, template={}, error={}", templateName, ex.getMessage());
            return "format error: " + ex.getMessage();
        } catch (TemplateException ex) {
            log.warn("render tool result failed, template={}, responseType={}, error={}",
                templateName, response.getClass().getSimpleName(), ex.getMessageWithoutStackTop());
            return "format error: " + ex.getMessageWithoutStackTop();
        }
    }

}
