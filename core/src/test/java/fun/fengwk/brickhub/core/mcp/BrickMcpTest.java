package fun.fengwk.brickhub.core.mcp;

import fun.fengwk.brickhub.core.service.BrickMcpService;
import fun.fengwk.brickhub.core.service.model.ColorGuideResponse;
import fun.fengwk.brickhub.core.service.model.InventoryResponse;
import fun.fengwk.brickhub.core.service.model.ThumbnailResponse;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class BrickMcpTest {

    @Mock
    private BrickMcpService brickMcpService;

    @Mock
    private McpFormatter mcpFormatter;

    private BrickMcp brickMcp;

    @BeforeEach
    void setUp() {
        brickMcp = new BrickMcp(brickMcpService, mcpFormatter);
    }

    @Test
    public void testFetchSetInventory() {
        InventoryResponse response = InventoryResponse.builder()
            .statusCode(200)
            .setNumber("41050-1")
            .build();
        when(brickMcpService.fetchSetInventory("41050")).thenReturn(response);
        when(mcpFormatter.format("brick_set_inventory_result.ftl", response)).thenReturn("ok");

        String result = brickMcp.fetchSetInventory("41050");
        log.info("fetch_set_inventory result:\n{}", result);

        assertThat(result).isEqualTo("ok");
        verify(brickMcpService).fetchSetInventory("41050");
    }

    @Test
    public void testFetchColorGuide() {
        ColorGuideResponse response = ColorGuideResponse.builder()
            .statusCode(200)
            .entries(List.of())
            .build();
        when(brickMcpService.fetchColorGuide(null)).thenReturn(response);
        when(mcpFormatter.format("brick_color_guide_result.ftl", response)).thenReturn("colors");

        assertThat(brickMcp.fetchColorGuide(null)).isEqualTo("colors");
    }

    @Test
    public void testFetchThumbnailReturnsError() {
        ThumbnailResponse response = ThumbnailResponse.builder()
            .statusCode(400)
            .error("unsupported url protocol")
            .build();
        when(brickMcpService.fetchThumbnail("ftp://x")).thenReturn(response);
        when(mcpFormatter.format("brick_thumbnail_result.ftl", response)).thenReturn("error: unsupported url protocol");

        assertThat(brickMcp.fetchThumbnail("ftp://x")).isEqualTo("error: unsupported url protocol");
        verify(mcpFormatter).format("brick_thumbnail_result.ftl", response);
    }

}
