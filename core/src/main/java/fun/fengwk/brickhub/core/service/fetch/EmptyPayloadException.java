package fun.fengwk.brickhub.core.service.fetch;

import lombok.Getter;

import java.io.IOException;

/**
 * Upstream answered 2xx without a body.
 *
 * @author fengwk
 */
@Getter
public class EmptyPayloadException extends IOException {

    private final String url;

    public EmptyPayloadException(String url) {
        super("empty payload, url=" + url);
        this.url = url;
    }

}
