package fun.fengwk.brickhub.core.service.impl;

import fun.fengwk.brickhub.core.service.cache.FetchCacheManager;
import fun.fengwk.brickhub.core.service.color.ColorGuideService;
import fun.fengwk.brickhub.core.service.fetch.InvalidResponseException;
import fun.fengwk.brickhub.core.service.inventory.InventoryParseException;
import fun.fengwk.brickhub.core.service.inventory.InventoryService;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import fun.fengwk.brickhub.core.service.model.ColorGuideResponse;
import fun.fengwk.brickhub.core.service.model.InventoryResponse;
import fun.fengwk.brickhub.core.service.model.ThumbnailResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BrickMcpServiceImplTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A};

    @Mock
    private InventoryService inventoryService;

    @Mock
    private ColorGuideService colorGuideService;

    @Mock
    private FetchCacheManager fetchCacheManager;

    private BrickMcpServiceImpl brickMcpService;

    @BeforeEach
    void setUp() {
        brickMcpService = new BrickMcpServiceImpl(inventoryService, colorGuideService, fetchCacheManager);
    }

    @Test
    public void testFetchSetInventory() throws IOException {
        Inventory inventory = Inventory.builder().setNumber("41050-1").name("Bracelet").build();
        when(inventoryService.fetchInventory("41050")).thenReturn(inventory);

        InventoryResponse response = brickMcpService.fetchSetInventory("41050");

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getSetNumber()).isEqualTo("41050-1");
        assertThat(response.getInventory()).isSameAs(inventory);
        assertThat(response.getError()).isNull();
    }

    @Test
    public void testInvalidSetNumberMapsTo400() throws IOException {
        when(inventoryService.fetchInventory(" ")).thenThrow(new IllegalArgumentException("setNumber is blank"));

        InventoryResponse response = brickMcpService.fetchSetInventory(" ");

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("setNumber is blank");
    }

    @Test
    public void testParseErrorMapsTo422() throws IOException {
        when(inventoryService.fetchInventory("41050")).thenThrow(InventoryParseException.tableNotFound());

        InventoryResponse response = brickMcpService.fetchSetInventory("41050");

        assertThat(response.getStatusCode()).isEqualTo(422);
        assertThat(response.getError()).isEqualTo("inventory table not found");
    }

    @Test
    public void testUpstreamStatusMapsTo502() throws IOException {
        when(inventoryService.fetchInventory("99999"))
            .thenThrow(new InvalidResponseException("https://www.bricklink.com/catalogItemInv.asp?S=99999-1", 404));

        InventoryResponse response = brickMcpService.fetchSetInventory("99999");

        assertThat(response.getStatusCode()).isEqualTo(502);
        assertThat(response.getError()).isEqualTo("upstream responded 404");
    }

    @Test
    public void testTransportErrorMapsTo502() throws IOException {
        when(colorGuideService.fetchColorGuide("en-us")).thenThrow(new SocketTimeoutException("timed out"));

        ColorGuideResponse response = brickMcpService.fetchColorGuide("en-us");

        assertThat(response.getStatusCode()).isEqualTo(502);
        assertThat(response.getEntries()).isEmpty();
        assertThat(response.getError()).isEqualTo("timed out");
    }

    @Test
    public void testUnexpectedErrorMapsTo500() throws IOException {
        when(colorGuideService.fetchColorGuide(null)).thenThrow(new NullPointerException());

        ColorGuideResponse response = brickMcpService.fetchColorGuide(null);

        assertThat(response.getStatusCode()).isEqualTo(500);
        assertThat(response.getError()).isEqualTo("NullPointerException");
    }

    @Test
    public void testFetchThumbnail() throws IOException {
        String url = "https://img.bricklink.com/ItemImage/PT/11/3001.t1.png";
        when(fetchCacheManager.get(url)).thenReturn(PNG);

        ThumbnailResponse response = brickMcpService.fetchThumbnail(" " + url + " ");

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getUrl()).isEqualTo(url);
        assertThat(response.getMimeType()).isEqualTo("image/png");
        assertThat(response.getSize()).isEqualTo(PNG.length);
        assertThat(response.getDataUri()).isEqualTo("data:image/png;base64,iVBORw0K");
    }

    @Test
    public void testThumbnailRejectsNonHttpUrl() throws IOException {
        ThumbnailResponse response = brickMcpService.fetchThumbnail("file:///etc/passwd");

        assertThat(response.getStatusCode()).isEqualTo(400);
        verify(fetchCacheManager, never()).get(anyString());
    }

}
