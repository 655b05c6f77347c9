package fun.fengwk.brickhub.core.service.cache;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class ThumbnailMediaUtilsTest {

    @Test
    void shouldPreferMagicBytesOverExtension() {
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0};

        assertThat(ThumbnailMediaUtils.resolveMime(jpeg, "https://img.bricklink.com/a.png")).isEqualTo("image/jpeg");
    }

    @Test
    void shouldDetectWebp() {
        byte[] webp = "RIFF\0\0\0\0WEBPVP8 ".getBytes(StandardCharsets.US_ASCII);

        assertThat(ThumbnailMediaUtils.resolveMime(webp, null)).isEqualTo("image/webp");
    }

    @Test
    void shouldFallBackToExtension() {
        byte[] unknown = {1, 2, 3};

        assertThat(ThumbnailMediaUtils.resolveMime(unknown, "https://img.bricklink.com/SL/41050-1.JPG?v=2#x"))
            .isEqualTo("image/jpeg");
        assertThat(ThumbnailMediaUtils.resolveMime(unknown, "https://img.bricklink.com/file"))
            .isEqualTo(ThumbnailMediaUtils.OCTET_STREAM);
    }

}
