package fun.fengwk.brickhub.core.service.fetch;

import java.io.IOException;

/**
 * Raw result of a single GET.
 *
 * @author fengwk
 */
public record FetchedPayload(int statusCode, byte[] body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Returns the body of a successful, non-empty response.
     *
     * @throws InvalidResponseException status outside 2xx
     * @throws EmptyPayloadException empty body
     */
    public byte[] requireSuccess(String url) throws IOException {
        if (!isSuccess()) {
            throw new InvalidResponseException(url, statusCode);
        }
        if (body == null || body.length == 0) {
            throw new EmptyPayloadException(url);
        }
        return body;
    }

}
