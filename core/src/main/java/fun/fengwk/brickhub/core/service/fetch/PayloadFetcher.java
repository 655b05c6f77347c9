package fun.fengwk.brickhub.core.service.fetch;

import java.io.IOException;

/**
 * @author fengwk
 */
public interface PayloadFetcher {

    /**
     * Performs one GET without interpreting the status code.
     *
     * @param url absolute http/https url
     * @return status and body as received
     * @throws IOException transport failure
     * @throws InterruptedException the calling thread was interrupted while waiting
     */
    FetchedPayload fetch(String url) throws IOException, InterruptedException;

}
