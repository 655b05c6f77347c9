package fun.fengwk.brickhub.core.service.cache;

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Media type detection for cached payloads, which are stored without headers.
 *
 * @author fengwk
 */
public final class ThumbnailMediaUtils {

    public static final String OCTET_STREAM = "application/octet-stream";

    private ThumbnailMediaUtils() {
    }

    public static String resolveMime(byte[] data, String url) {
        if (startsWith(data, (byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G')) {
            return "image/png";
        }
        if (startsWith(data, (byte) 0xFF, (byte) 0xD8, (byte) 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(data, (byte) 'G', (byte) 'I', (byte) 'F', (byte) '8')) {
            return "image/gif";
        }
        if (data != null && data.length >= 12
            && "RIFF".equals(new String(data, 0, 4, StandardCharsets.US_ASCII))
            && "WEBP".equals(new String(data, 8, 4, StandardCharsets.US_ASCII))) {
            return "image/webp";
        }
        return resolveMimeFromExtension(url);
    }

    static String resolveMimeFromExtension(String url) {
        if (StringUtils.isBlank(url)) {
            return OCTET_STREAM;
        }

        String lowerUrl = url.toLowerCase(Locale.ROOT);
        int fragmentIndex = lowerUrl.indexOf('#');
        if (fragmentIndex >= 0) {
            lowerUrl = lowerUrl.substring(0, fragmentIndex);
        }
        int queryIndex = lowerUrl.indexOf('?');
        if (queryIndex >= 0) {
            lowerUrl = lowerUrl.substring(0, queryIndex);
        }
        if (lowerUrl.endsWith(".png")) {
            return "image/png";
        }
        if (lowerUrl.endsWith(".jpg") || lowerUrl.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        if (lowerUrl.endsWith(".gif")) {
            return "image/gif";
        }
        if (lowerUrl.endsWith(".webp")) {
            return "image/webp";
        }
        return OCTET_STREAM;
    }

    private static boolean startsWith(byte[] data, byte... prefix) {
        if (data == null || data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

}
