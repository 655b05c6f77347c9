package fun.fengwk.brickhub.core.configuration;

import freemarker.template.TemplateExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * FreeMarker setup for tool result templates.
 *
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    public static final String TEMPLATE_PATH = "/mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), TEMPLATE_PATH);
        cfg.setDefaultEncoding("UTF-8");
        // Ids and quantities must not be grouped, 1,000 would read as two values in a table.
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

}
