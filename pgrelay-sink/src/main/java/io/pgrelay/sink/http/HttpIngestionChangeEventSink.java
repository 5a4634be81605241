/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.pgrelay.annotation.ThreadSafe;
import io.pgrelay.data.Change;
import io.pgrelay.sink.ChangeEventSinkConfig;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.sink.spi.SinkException;
import io.pgrelay.util.Strings;
import io.pgrelay.util.Threads;

/**
 * Pushes row changes to an HTTP ingestion endpoint, batched per destination table.
 * <p>
 * Rows are sent as {@code POST <url>/pipelines/<pipeline>/destinations/<destination>/rows} with a
 * {@code {"rows":[...]}} body. A destination's batch is pushed once it is full, and every pending batch is pushed when
 * a transaction commits or the sink is closed. Transaction starts and relation announcements are not pushed.
 * <p>
 * All requests run on a single thread owned by the sink, so rows reach the endpoint in change order.
 */
@ThreadSafe
public class HttpIngestionChangeEventSink implements ChangeEventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpIngestionChangeEventSink.class);

    static final String OPERATION_FIELD = "_op";
    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final CloseableHttpClient client;
    private final String url;
    private final String pipeline;
    private final String apiKey;
    private final int batchSize;
    private final DestinationRouter router;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService executor = Threads.newSingleThreadExecutor("http-sink");

    // only accessed from the executor thread
    private final Map<String, List<Map<String, Object>>> batches = new LinkedHashMap<>();

    public HttpIngestionChangeEventSink(ChangeEventSinkConfig config) {
        this(HttpClients.createDefault(), config.httpUrl(), config.httpPipeline(), config.httpApiKey(), config.httpBatchSize(),
                new DestinationRouter(config.httpTables()));
        LOGGER.info("Pushing rows to pipeline '{}' at {} ({} routing, batch size {})", pipeline, url,
                router.isDynamic() ? "dynamic" : "allow-list", batchSize);
    }

    public HttpIngestionChangeEventSink(CloseableHttpClient client, String url, String pipeline, String apiKey, int batchSize,
                                        DestinationRouter router) {
        this.client = client;
        this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.pipeline = pipeline;
        this.apiKey = Strings.isNullOrBlank(apiKey) ? null : apiKey;
        this.batchSize = Math.max(1, batchSize);
        this.router = router;
    }

    @Override
    public CompletableFuture<Void> deliver(Change change) {
        switch (change.operation()) {
            case INSERT:
                return enqueue((Change.TableChange) change, ((Change.Insert) change).newTuple());
            case UPDATE:
                return enqueue((Change.TableChange) change, ((Change.Update) change).newTuple());
            case DELETE:
                return enqueue((Change.TableChange) change, ((Change.Delete) change).oldTuple());
            case COMMIT:
                return CompletableFuture.runAsync(this::flushAll, executor);
            default:
                return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> enqueue(Change.TableChange change, Map<String, String> tuple) {
        final String destination = router.route(change).orElse(null);
        if (destination == null) {
            LOGGER.debug("Dropping {} change of {} which is not an allowed destination", change.operation(), change.qualifiedName());
            return CompletableFuture.completedFuture(null);
        }
        final Map<String, Object> row = new LinkedHashMap<>(tuple);
        row.put(OPERATION_FIELD, change.operation().code());
        return CompletableFuture.runAsync(() -> {
            final List<Map<String, Object>> batch = batches.computeIfAbsent(destination, k -> new ArrayList<>());
            batch.add(row);
            if (batch.size() >= batchSize) {
                batches.remove(destination);
                push(destination, batch);
            }
        }, executor);
    }

    /**
     * Push the pending batch of every destination. A failed push does not prevent the pushes of the other destinations;
     * the first failure is thrown with the later ones suppressed.
     */
    private void flushAll() {
        SinkException failure = null;
        final Iterator<Map.Entry<String, List<Map<String, Object>>>> pending = batches.entrySet().iterator();
        while (pending.hasNext()) {
            final Map.Entry<String, List<Map<String, Object>>> entry = pending.next();
            final String destination = entry.getKey();
            final List<Map<String, Object>> rows = entry.getValue();
            pending.remove();
            try {
                push(destination, rows);
            }
            catch (SinkException e) {
                if (failure == null) {
                    failure = e;
                }
                else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void push(String destination, List<Map<String, Object>> rows) {
        final String endpoint = url + "/pipelines/" + pipeline + "/destinations/" + destination + "/rows";
        final HttpPost request = new HttpPost(endpoint);
        try {
            request.setEntity(new StringEntity(mapper.writeValueAsString(Map.of("rows", rows)), ContentType.APPLICATION_JSON));
        }
        catch (JsonProcessingException e) {
            throw new SinkException("Failed to serialize rows for destination '" + destination + "'", e);
        }
        if (apiKey != null) {
            request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        try (CloseableHttpResponse response = client.execute(request)) {
            final int status = response.getStatusLine().getStatusCode();
            final String body = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
            if (status < 200 || status >= 300) {
                throw new SinkException(String.format("Ingestion of %d row(s) into '%s' failed with HTTP %d: %s",
                        rows.size(), destination, status, body));
            }
            LOGGER.debug("Pushed {} row(s) to destination '{}'", rows.size(), destination);
        }
        catch (IOException e) {
            throw new SinkException("Failed to push rows to " + endpoint, e);
        }
    }

    @Override
    public String name() {
        return "http";
    }

    /**
     * Push every pending batch, then release the client.
     *
     * @throws SinkException if the final push failed
     */
    @Override
    public void close() {
        SinkException failure = null;
        try {
            CompletableFuture.runAsync(this::flushAll, executor).get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new SinkException("Interrupted while pushing pending rows", e);
        }
        catch (ExecutionException e) {
            failure = new SinkException("Failed to push pending rows on close", e.getCause());
        }
        catch (TimeoutException e) {
            failure = new SinkException("Timed out pushing pending rows on close", e);
        }
        finally {
            executor.shutdown();
            try {
                client.close();
            }
            catch (IOException e) {
                LOGGER.warn("Failed to close HTTP client", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
