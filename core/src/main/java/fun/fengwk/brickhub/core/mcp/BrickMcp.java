package fun.fengwk.brickhub.core.mcp;

import fun.fengwk.brickhub.core.service.BrickMcpService;
import fun.fengwk.brickhub.core.service.model.ColorGuideResponse;
import fun.fengwk.brickhub.core.service.model.InventoryResponse;
import fun.fengwk.brickhub.core.service.model.ThumbnailResponse;
import fun.fengwk.brickhub.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class BrickMcp {

    private final BrickMcpService brickMcpService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "fetch_set_inventory",
        description = """
            Fetch the BrickLink inventory of a LEGO set, including the parts of its minifigures and of multipack parts.
            Return format: set name, thumbnail, categories, part list grouped by section and minifigure list; \
            or an error message with a status code.""",
        resultConverter = StringToolCallResultConverter.class)
    public String fetchSetInventory(
        @ToolParam(description = "set number, e.g. 10294 or 10294-1; -1 is appended when no variant is given") String setNumber
    ) {
        InventoryResponse response = brickMcpService.fetchSetInventory(setNumber);
        return mcpFormatter.format("brick_set_inventory_result.ftl", response);
    }

    @Tool(name = "fetch_color_guide",
        description = """
            Fetch the BrickLink color guide with the matching LEGO color names and ids.
            Return format: markdown table of BrickLink id, BrickLink name, LEGO name, LEGO id and hex color; \
            or an error message with a status code.""",
        resultConverter = StringToolCallResultConverter.class)
    public String fetchColorGuide(
        @ToolParam(description = "page locale, default en-us", required = false) String locale
    ) {
        ColorGuideResponse response = brickMcpService.fetchColorGuide(locale);
        return mcpFormatter.format("brick_color_guide_result.ftl", response);
    }

    @Tool(name = "fetch_thumbnail",
        description = """
            Fetch a catalog image through the local thumbnail cache.
            Return format: mime type, size and a base64 data uri; or an error message with a status code.""",
        resultConverter = StringToolCallResultConverter.class)
    public String fetchThumbnail(
        @ToolParam(description = "absolute http/https image url, e.g. a thumbnail url from fetch_set_inventory") String url
    ) {
        ThumbnailResponse response = brickMcpService.fetchThumbnail(url);
        return mcpFormatter.format("brick_thumbnail_result.ftl", response);
    }

}
