package fun.fengwk.brickhub.core.service.fetch;

import lombok.Getter;

import java.io.IOException;

/**
 * Upstream answered with a status outside 2xx.
 *
 * @author fengwk
 */
@Getter
public class InvalidResponseException extends IOException {

    private final String url;
    private final int statusCode;

    public InvalidResponseException(String url, int statusCode) {
        super("invalid response, statusCode=" + statusCode + ", url=" + url);
        this.url = url;
        this.statusCode = statusCode;
    }

}
