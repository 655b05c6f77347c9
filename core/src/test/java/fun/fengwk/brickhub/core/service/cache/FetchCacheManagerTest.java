package fun.fengwk.brickhub.core.service.cache;

import fun.fengwk.brickhub.core.service.fetch.EmptyPayloadException;
import fun.fengwk.brickhub.core.service.fetch.FetchedPayload;
import fun.fengwk.brickhub.core.service.fetch.InvalidResponseException;
import fun.fengwk.brickhub.core.service.fetch.PayloadFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class FetchCacheManagerTest {

    private static final String URL = "https://img.bricklink.com/SL/41050-1.jpg";

    @TempDir
    Path cacheDirectory;

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldShareOneDownloadBetweenConcurrentCallers() throws Exception {
        AtomicInteger fetchCount = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        FetchCacheManager manager = newManager(url -> {
            fetchCount.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
            return ok(url);
        }, 4, 100);

        ExecutorService callers = Executors.newFixedThreadPool(10);
        try {
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                results.add(callers.submit(() -> manager.get(URL)));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<byte[]> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(fetchCount.get()).isEqualTo(1);
        assertThat(manager.inFlightSize()).isZero();
    }

    @Test
    void shouldEvictLeastRecentlyUsedFromMemoryOnly() throws IOException {
        AtomicInteger fetchCount = new AtomicInteger();
        FetchCacheManager manager = newManager(url -> {
            fetchCount.incrementAndGet();
            return ok(url);
        }, 4, 100);

        for (int i = 0; i < 100; i++) {
            manager.get(url(i));
        }
        manager.get(url(0));
        manager.get(url(100));

        assertThat(manager.memorySize()).isEqualTo(100);
        assertThat(manager.isInMemory(url(0))).isTrue();
        assertThat(manager.isInMemory(url(1))).isFalse();
        assertThat(Files.exists(manager.resolveCacheFile(url(1)))).isTrue();

        assertThat(manager.get(url(1))).isEqualTo(url(1).getBytes(StandardCharsets.UTF_8));
        assertThat(fetchCount.get()).isEqualTo(101);
    }

    @Test
    void shouldBoundConcurrentDownloads() throws Exception {
        AtomicInteger started = new AtomicInteger();
        CountDownLatch gate = new CountDownLatch(1);
        FetchCacheManager manager = newManager(url -> {
            started.incrementAndGet();
            gate.await(5, TimeUnit.SECONDS);
            return ok(url);
        }, 2, 100);

        List<CompletableFuture<byte[]>> futures = List.of(
            manager.getAsync(url(1)), manager.getAsync(url(2)), manager.getAsync(url(3)));
        long deadline = System.currentTimeMillis() + 5000;
        while (started.get() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(100);
        assertThat(started.get()).isEqualTo(2);

        gate.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        assertThat(started.get()).isEqualTo(3);
    }

    @Test
    void shouldServeDiskEntryWithoutDownloading() throws IOException {
        AtomicInteger fetchCount = new AtomicInteger();
        FetchCacheManager manager = newManager(url -> {
            fetchCount.incrementAndGet();
            return ok(url);
        }, 4, 100);
        Files.write(manager.resolveCacheFile(URL), "cached".getBytes(StandardCharsets.UTF_8));

        assertThat(manager.get(URL)).isEqualTo("cached".getBytes(StandardCharsets.UTF_8));
        assertThat(fetchCount.get()).isZero();
    }

    @Test
    void shouldReplaceEmptyDiskEntry() throws IOException {
        AtomicInteger fetchCount = new AtomicInteger();
        FetchCacheManager manager = newManager(url -> {
            fetchCount.incrementAndGet();
            return ok(url);
        }, 4, 100);
        Path file = manager.resolveCacheFile(URL);
        Files.write(file, new byte[0]);

        assertThat(manager.get(URL)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
        assertThat(fetchCount.get()).isEqualTo(1);
        assertThat(Files.readAllBytes(file)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldInvalidateBothTiers() throws IOException {
        AtomicInteger fetchCount = new AtomicInteger();
        FetchCacheManager manager = newManager(url -> {
            fetchCount.incrementAndGet();
            return ok(url);
        }, 4, 100);
        manager.get(URL);

        manager.invalidate(URL);

        assertThat(manager.isInMemory(URL)).isFalse();
        assertThat(Files.exists(manager.resolveCacheFile(URL))).isFalse();
        manager.get(URL);
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    void shouldNotStoreDownloadInvalidatedWhileRunning() throws Exception {
        AtomicInteger fetchCount = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        FetchCacheManager manager = newManager(url -> {
            if (fetchCount.incrementAndGet() == 1) {
                started.countDown();
                gate.await(5, TimeUnit.SECONDS);
            }
            return ok(url);
        }, 4, 100);

        CompletableFuture<byte[]> running = manager.getAsync(URL);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        manager.invalidate(URL);
        gate.countDown();

        assertThat(running.get(5, TimeUnit.SECONDS)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
        assertThat(manager.isInMemory(URL)).isFalse();
        assertThat(Files.exists(manager.resolveCacheFile(URL))).isFalse();
        assertThat(manager.inFlightSize()).isZero();

        manager.get(URL);
        assertThat(fetchCount.get()).isEqualTo(2);
        assertThat(manager.isInMemory(URL)).isTrue();
    }

    @Test
    void shouldHandOutPrivateCopies() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        FetchCacheManager manager = newManager(url -> {
            gate.await(5, TimeUnit.SECONDS);
            return new FetchedPayload(200, "abc".getBytes(StandardCharsets.UTF_8));
        }, 4, 100);

        CompletableFuture<byte[]> first = manager.getAsync(URL);
        CompletableFuture<byte[]> second = manager.getAsync(URL);
        gate.countDown();
        byte[] firstBytes = first.get(5, TimeUnit.SECONDS);
        firstBytes[0] = 'Z';
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("abc".getBytes(StandardCharsets.UTF_8));

        byte[] fromMemory = manager.get(URL);
        fromMemory[0] = 'Z';
        assertThat(manager.get(URL)).isEqualTo("abc".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldNotCacheFailedResponses() throws IOException {
        AtomicInteger fetchCount = new AtomicInteger();
        FetchCacheManager manager = newManager(url -> fetchCount.incrementAndGet() == 1
            ? new FetchedPayload(503, new byte[0])
            : ok(url), 4, 100);

        assertThatThrownBy(() -> manager.get(URL))
            .isInstanceOfSatisfying(InvalidResponseException.class,
                ex -> assertThat(ex.getStatusCode()).isEqualTo(503));
        assertThat(manager.isInMemory(URL)).isFalse();
        assertThat(Files.exists(manager.resolveCacheFile(URL))).isFalse();
        assertThat(manager.inFlightSize()).isZero();

        assertThat(manager.get(URL)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    void shouldRejectEmptyPayload() {
        FetchCacheManager manager = newManager(url -> new FetchedPayload(200, new byte[0]), 4, 100);

        assertThatThrownBy(() -> manager.get(URL)).isInstanceOf(EmptyPayloadException.class);
    }

    @Test
    void shouldPropagateTransportErrorUnchanged() {
        FetchCacheManager manager = newManager(url -> {
            throw new ConnectException("connection refused");
        }, 4, 100);

        assertThatThrownBy(() -> manager.get(URL))
            .isInstanceOf(ConnectException.class)
            .hasMessage("connection refused");
    }

    @Test
    void shouldKeepSharedDownloadWhenOneCallerCancels() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        FetchCacheManager manager = newManager(url -> {
            gate.await(5, TimeUnit.SECONDS);
            return ok(url);
        }, 4, 100);

        CompletableFuture<byte[]> first = manager.getAsync(URL);
        CompletableFuture<byte[]> second = manager.getAsync(URL);
        first.cancel(true);
        gate.countDown();

        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(URL.getBytes(StandardCharsets.UTF_8));
        assertThat(first.isCancelled()).isTrue();
    }

    @Test
    void shouldRejectBlankUrl() {
        FetchCacheManager manager = newManager(url -> ok(url), 4, 100);

        assertThat(manager.getAsync(" ")).isCompletedExceptionally();
    }

    private FetchCacheManager newManager(PayloadFetcher fetcher, int maxDownloads, int memoryLimit) {
        return new FetchCacheManager(fetcher, new DownloadPermitPool(maxDownloads), cacheDirectory, memoryLimit, executor);
    }

    private static FetchedPayload ok(String url) {
        return new FetchedPayload(200, url.getBytes(StandardCharsets.UTF_8));
    }

    private static String url(int index) {
        return "https://img.bricklink.com/ItemImage/PT/11/" + index + ".t1.png";
    }

}
