package fun.fengwk.brickhub.core.service.inventory;

import fun.fengwk.brickhub.core.service.catalog.CatalogPageClient;
import fun.fengwk.brickhub.core.service.inventory.model.ExtractionMode;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import fun.fengwk.brickhub.core.service.inventory.model.Minifigure;
import fun.fengwk.brickhub.core.service.inventory.model.Part;
import fun.fengwk.brickhub.core.service.scrape.parser.HtmlMarkdownConverter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Resolves the nested inventories of minifigures and multipack parts.
 *
 * <p>Each item of a batch is resolved by its own task. Results are written to the slot of the
 * item's index, so the output order always matches the input order no matter which task finishes
 * first. The first failure fails the whole batch and the remaining tasks are cancelled, a partial
 * result is never returned.
 *
 * <p>Tasks block on the batches they spawn for deeper levels, so the executor must not be a small
 * fixed pool.
 *
 * @author fengwk
 */
@Slf4j
public class InventoryEnricher {

    private final CatalogPageClient catalogPageClient;
    private final HtmlMarkdownConverter htmlMarkdownConverter;
    private final InventoryExtractor inventoryExtractor;
    private final Executor executor;
    private final String baseUrl;

    public InventoryEnricher(CatalogPageClient catalogPageClient, HtmlMarkdownConverter htmlMarkdownConverter,
                             InventoryExtractor inventoryExtractor, Executor executor, String baseUrl) {
        this.catalogPageClient = catalogPageClient;
        this.htmlMarkdownConverter = htmlMarkdownConverter;
        this.inventoryExtractor = inventoryExtractor;
        this.executor = executor;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    /**
     * Enriches the minifigures and the parts of a set inventory. Both batches run at the same time
     * and a failure in either one fails the call without waiting for the other.
     */
    public Inventory enrich(Inventory inventory, int depth) throws IOException {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        CompletableFuture<List<Minifigure>> minifigures = supplyBatch(
            () -> enrichMinifigures(inventory.getMinifigures(), depth), firstFailure);
        CompletableFuture<List<Part>> parts = supplyBatch(
            () -> enrichParts(inventory.getParts(), depth), firstFailure);

        List<CompletableFuture<?>> batches = List.of(minifigures, parts);
        await(batches, CompletableFuture.anyOf(CompletableFuture.allOf(minifigures, parts), firstFailure));

        return inventory.toBuilder()
            .parts(parts.join())
            .minifigures(minifigures.join())
            .build();
    }

    private <R> CompletableFuture<R> supplyBatch(Batch<R> batch, CompletableFuture<Void> firstFailure) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return batch.run();
            } catch (IOException | RuntimeException ex) {
                firstFailure.completeExceptionally(ex);
                throw new CompletionException(ex);
            }
        }, executor);
    }

    /**
     * Fills in the parts of every minifigure from its inventory page.
     *
     * @param depth levels of nested inventories to resolve, the minifigure page itself counts as one
     */
    public List<Minifigure> enrichMinifigures(List<Minifigure> minifigures, int depth) throws IOException {
        if (depth <= 0 || minifigures.isEmpty()) {
            return minifigures;
        }
        return fanOut(minifigures, minifigure -> {
            String url = StringUtils.isBlank(minifigure.getInventoryUrl())
                ? defaultMinifigureInventoryUrl(minifigure.getIdentifier())
                : minifigure.getInventoryUrl();
            List<Part> parts = fetchParts(url, minifigure.getIdentifier());
            return minifigure.toBuilder()
                .parts(enrichParts(parts, depth - 1))
                .build();
        });
    }

    /**
     * Fills in the subparts of every part that links to an inventory of its own. Other parts are
     * returned as they are.
     */
    public List<Part> enrichParts(List<Part> parts, int depth) throws IOException {
        if (depth <= 0 || parts.stream().noneMatch(part -> StringUtils.isNotBlank(part.getInventoryUrl()))) {
            return parts;
        }
        return fanOut(parts, part -> {
            if (StringUtils.isBlank(part.getInventoryUrl())) {
                return part;
            }
            List<Part> subparts = fetchParts(part.getInventoryUrl(), part.getPartId());
            return part.toBuilder()
                .subparts(List.copyOf(enrichParts(subparts, depth - 1)))
                .build();
        });
    }

    String defaultMinifigureInventoryUrl(String identifier) {
        return baseUrl + "/catalogItemInv.asp?M=" + URLEncoder.encode(identifier, StandardCharsets.UTF_8) + "&viewType=R";
    }

    private List<Part> fetchParts(String url, String identifier) throws IOException {
        byte[] html = catalogPageClient.fetchHtml(url);
        String markdown = htmlMarkdownConverter.convert(html, url);
        List<Part> parts = inventoryExtractor.extract(markdown, identifier, url, ExtractionMode.PARTS_ONLY).getParts();
        log.debug("nested inventory resolved, identifier={}, url={}, parts={}", identifier, url, parts.size());
        return parts;
    }

    private <T> List<T> fanOut(List<T> items, ItemResolver<T> resolver) throws IOException {
        AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(items.size());
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(items.size());

        for (int i = 0; i < items.size(); i++) {
            int index = i;
            T item = items.get(i);
            tasks.add(CompletableFuture.runAsync(() -> {
                try {
                    slots.set(index, resolver.resolve(item));
                } catch (IOException | RuntimeException ex) {
                    firstFailure.completeExceptionally(ex);
                    throw new CompletionException(ex);
                }
            }, executor));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
        await(tasks, CompletableFuture.anyOf(all, firstFailure));

        List<T> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            results.add(slots.get(i));
        }
        return List.copyOf(results);
    }

    /**
     * Waits for the completion signal, cancelling every task if it fails or the wait is interrupted.
     */
    private void await(List<? extends CompletableFuture<?>> tasks, CompletableFuture<?> completion) throws IOException {
        try {
            completion.get();
        } catch (InterruptedException ex) {
            cancelAll(tasks);
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while resolving inventories");
            interrupted.initCause(ex);
            throw interrupted;
        } catch (ExecutionException ex) {
            cancelAll(tasks);
            throw rethrow(ex.getCause());
        } catch (CancellationException ex) {
            cancelAll(tasks);
            throw ex;
        }
    }

    private static void cancelAll(List<? extends CompletableFuture<?>> tasks) {
        for (CompletableFuture<?> task : tasks) {
            task.cancel(true);
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

    @FunctionalInterface
    private interface Batch<R> {

        R run() throws IOException;

    }

    @FunctionalInterface
    private interface ItemResolver<T> {

        T resolve(T item) throws IOException;

    }

}
