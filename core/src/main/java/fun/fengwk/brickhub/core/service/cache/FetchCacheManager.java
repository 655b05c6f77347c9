package fun.fengwk.brickhub.core.service.cache;

import fun.fengwk.brickhub.core.service.fetch.PayloadFetcher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Two-tier cache for binary payloads such as thumbnails.
 *
 * <p>Lookups go memory, then disk, then network. Concurrent requests for the same url share one
 * download, and the number of running downloads is bounded by a {@link DownloadPermitPool}.
 * Memory and in-flight bookkeeping is guarded by a single lock. Disk writes are best-effort, a
 * failed write never fails the request. Failed downloads are not cached.
 *
 * <p>Every caller receives its own copy of the payload, the cached bytes never change for a url.
 *
 * @author fengwk
 */
@Slf4j
public class FetchCacheManager {

    private final PayloadFetcher payloadFetcher;
    private final DownloadPermitPool downloadPermitPool;
    private final Path cacheDirectory;
    private final Executor executor;

    private final Object lock = new Object();
    private final LinkedHashMap<String, byte[]> memory;
    private final Map<String, CompletableFuture<byte[]>> inFlight = new HashMap<>();

    public FetchCacheManager(PayloadFetcher payloadFetcher, DownloadPermitPool downloadPermitPool,
                             Path cacheDirectory, int memoryLimit, Executor executor) {
        if (memoryLimit <= 0) {
            throw new IllegalArgumentException("memoryLimit must be positive");
        }
        this.payloadFetcher = payloadFetcher;
        this.downloadPermitPool = downloadPermitPool;
        this.cacheDirectory = cacheDirectory;
        this.executor = executor;
        // Access order turns the map into an LRU.
        this.memory = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest) {
                return size() > memoryLimit;
            }
        };
    }

    /**
     * Blocking variant of {@link #getAsync(String)}.
     */
    public byte[] get(String url) throws IOException {
        try {
            return getAsync(url).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while fetching " + url);
            interrupted.initCause(ex);
            throw interrupted;
        } catch (ExecutionException ex) {
            throw rethrow(ex.getCause());
        }
    }

    /**
     * Returns the payload for the url. The returned future and its array are private to the caller,
     * cancelling the future does not cancel a download shared with other callers.
     */
    public CompletableFuture<byte[]> getAsync(String url) {
        if (StringUtils.isBlank(url)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("url is blank"));
        }

        CompletableFuture<byte[]> shared;
        boolean owner = false;
        synchronized (lock) {
            byte[] cached = memory.get(url);
            if (cached != null) {
                log.debug("fetch cache memory hit, url={}", url);
                return CompletableFuture.completedFuture(cached.clone());
            }
            shared = inFlight.get(url);
            if (shared == null) {
                shared = new CompletableFuture<>();
                inFlight.put(url, shared);
                owner = true;
            }
        }

        if (owner) {
            CompletableFuture<byte[]> loading = shared;
            try {
                executor.execute(() -> load(url, loading));
            } catch (RejectedExecutionException ex) {
                log.warn("fetch cache load rejected, url={}, error={}", url, ex.getMessage());
                fail(url, loading, ex);
            }
        }
        return shared.thenApply(byte[]::clone);
    }

    /**
     * Drops the url from both tiers. A download still running for the url completes for its
     * current callers but is not stored, the next lookup fetches again.
     */
    public void invalidate(String url) {
        Path file = resolveCacheFile(url);
        synchronized (lock) {
            memory.remove(url);
            if (inFlight.remove(url) != null) {
                log.debug("detach in-flight fetch on invalidate, url={}", url);
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException ex) {
                log.warn("delete cache file failed, url={}, file={}, error={}", url, file, ex.getMessage());
            }
        }
    }

    int memorySize() {
        synchronized (lock) {
            return memory.size();
        }
    }

    boolean isInMemory(String url) {
        synchronized (lock) {
            return memory.containsKey(url);
        }
    }

    int inFlightSize() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    Path resolveCacheFile(String url) {
        return cacheDirectory.resolve(sha256Hex(url));
    }

    private void load(String url, CompletableFuture<byte[]> future) {
        try {
            byte[] data = readFromDisk(url);
            boolean downloaded = data == null;
            if (downloaded) {
                data = download(url);
            }
            synchronized (lock) {
                // Invalidated while loading, the payload is handed out but not stored.
                if (inFlight.remove(url, future)) {
                    memory.put(url, data);
                    if (downloaded) {
                        writeToDisk(url, data);
                    }
                } else {
                    log.debug("skip storing invalidated fetch, url={}", url);
                }
            }
            future.complete(data);
        } catch (Exception ex) {
            log.warn("fetch failed, url={}, error={}", url, ex.getMessage());
            fail(url, future, ex);
        }
    }

    private void fail(String url, CompletableFuture<byte[]> future, Throwable error) {
        synchronized (lock) {
            inFlight.remove(url, future);
        }
        future.completeExceptionally(error);
    }

    private byte[] download(String url) throws IOException {
        downloadPermitPool.acquire();
        try {
            return payloadFetcher.fetch(url).requireSuccess(url);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while downloading " + url);
            interrupted.initCause(ex);
            throw interrupted;
        } finally {
            downloadPermitPool.release();
        }
    }

    private byte[] readFromDisk(String url) {
        Path file = resolveCacheFile(url);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            byte[] data = Files.readAllBytes(file);
            if (data.length > 0) {
                log.debug("fetch cache disk hit, url={}", url);
                return data;
            }
            log.debug("discard empty cache file, url={}, file={}", url, file);
        } catch (IOException ex) {
            log.debug("discard unreadable cache file, url={}, file={}, error={}", url, file, ex.getMessage());
        }
        deleteQuietly(file);
        return null;
    }

    private void writeToDisk(String url, byte[] data) {
        Path target = resolveCacheFile(url);
        Path tmpPath = cacheDirectory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(cacheDirectory);
            Files.write(tmpPath, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                Files.move(tmpPath, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException ex) {
                Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            log.warn("write cache file failed, url={}, file={}, error={}", url, target, ex.getMessage());
            deleteQuietly(tmpPath);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.debug("delete cache file failed, file={}, error={}", file, ex.getMessage());
        }
    }

    static String sha256Hex(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static IOException rethrow(Throwable cause) {
        Throwable error = cause;
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        if (error instanceof IOException io) {
            return io;
        }
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new IOException(error.getMessage(), error);
    }

}
