package fun.fengwk.brickhub.core.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link PayloadFetcher} backed by the JDK http client.
 *
 * @author fengwk
 */
@Slf4j
public class HttpPayloadFetcher implements PayloadFetcher {

    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private static final int MIN_TIMEOUT_MS = 500;

    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpPayloadFetcher(HttpClient httpClient, String userAgent, int requestTimeoutMs) {
        this.httpClient = httpClient;
        this.userAgent = StringUtils.isBlank(userAgent) ? DEFAULT_USER_AGENT : userAgent;
        this.requestTimeout = Duration.ofMillis(Math.max(MIN_TIMEOUT_MS, requestTimeoutMs));
    }

    public static HttpClient newHttpClient(int connectTimeoutMs) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(Math.max(MIN_TIMEOUT_MS, connectTimeoutMs)))
            .build();
    }

    @Override
    public FetchedPayload fetch(String url) throws IOException, InterruptedException {
        HttpRequest request = buildGetRequest(url);
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        log.debug("fetched payload, url={}, statusCode={}, bytes={}",
            url, response.statusCode(), response.body() == null ? 0 : response.body().length);
        return new FetchedPayload(response.statusCode(), response.body());
    }

    private HttpRequest buildGetRequest(String url) {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("url is blank");
        }
        String normalized = url.trim();
        String lowerCaseUrl = normalized.toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("unsupported url protocol: " + url);
        }

        return HttpRequest.newBuilder(URI.create(normalized))
            .GET()
            .header("Accept", "*/*")
            .header("Cache-Control", "no-cache")
            .header("User-Agent", userAgent)
            .timeout(requestTimeout)
            .build();
    }

}
