package fun.fengwk.brickhub.cli.all;

import fun.fengwk.brickhub.core.mcp.BrickMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.brickhub")
public class BrickHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrickHubApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider brickTools(BrickMcp brickMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(brickMcp)
            .build();
    }

}
