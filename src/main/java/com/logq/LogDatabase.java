package com.logq;

import com.logq.config.LogQConfig;
import com.logq.json.JsonNode;
import com.logq.log.RecordDecoder;
import com.logq.query.Filter;
import com.logq.query.FilterEvaluator;
import com.logq.query.FilterParser;
import com.logq.query.FindOptions;
import com.logq.query.QueryExecutor;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Read-only query access to a document log.
 * <p>
 * Every call reads the whole file, decodes the visible records and evaluates the query against
 * that snapshot. Nothing is cached, so concurrent calls never share state and each sees the log
 * as it was when its own read happened.
 *
 * <pre>
 * LogDatabase db = new LogDatabase(Path.of("people.log"), List.of("name", "bio"));
 * MutableList&lt;JsonNode.JsonObject&gt; adults = db.find(
 *     Filter.where("age", Condition.gt(17)),
 *     FindOptions.sorted(SortSpec.by("name", Direction.ASCENDING)));
 * </pre>
 */
public class LogDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(LogDatabase.class);

    private final Path logFile;
    private final RecordDecoder decoder = new RecordDecoder();
    private final FilterParser filterParser = new FilterParser();
    private final QueryExecutor executor;
    private final Executor ioExecutor;

    public LogDatabase(Path logFile, Iterable<String> textSearchFields) {
        this(LogQConfig.builder().logFile(logFile).textSearchFields(textSearchFields).build());
    }

    public LogDatabase(LogQConfig config) {
        this(config, ForkJoinPool.commonPool());
    }

    /**
     * @param ioExecutor runs the file reads of {@link #findAsync(Filter, FindOptions)}
     */
    public LogDatabase(LogQConfig config, Executor ioExecutor) {
        this.logFile = config.logFile();
        this.executor = new QueryExecutor(new FilterEvaluator(config.textSearchFields(), config.operandPresence()));
        this.ioExecutor = ioExecutor;
    }

    public MutableList<JsonNode.JsonObject> find(Filter filter) throws IOException {
        return find(filter, FindOptions.NONE);
    }

    /**
     * @throws com.logq.query.InvalidFilterException if {@code filterJson} is malformed; the log is not read
     * @throws IOException if the log cannot be read or a visible line does not decode
     */
    public MutableList<JsonNode.JsonObject> find(String filterJson, FindOptions options) throws IOException {
        return find(filterParser.parse(filterJson), options);
    }

    public MutableList<JsonNode.JsonObject> find(Filter filter, FindOptions options) throws IOException {
        LOG.debug("Querying {} with {}", logFile, filter);
        try {
            MutableList<JsonNode.JsonObject> results = evaluate(readLog(), filter, options);
            LOG.debug("Query on {} returned {} records", logFile, results.size());
            return results;
        } catch (IOException e) {
            LOG.warn("Query on {} failed: {}", logFile, e.getMessage());
            throw e;
        }
    }

    public CompletableFuture<MutableList<JsonNode.JsonObject>> findAsync(Filter filter) {
        return findAsync(filter, FindOptions.NONE);
    }

    /**
     * Runs the read on the I/O executor and the evaluation in the completion stage. Any failure,
     * checked or not, completes the future exceptionally; an {@link IOException} is the cause of
     * the resulting {@link CompletionException}.
     */
    public CompletableFuture<MutableList<JsonNode.JsonObject>> findAsync(Filter filter, FindOptions options) {
        return CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return readLog();
                    } catch (IOException e) {
                        throw new CompletionException(e);
                    }
                }, ioExecutor)
                .thenApply(content -> {
                    try {
                        return evaluate(content, filter, options);
                    } catch (IOException e) {
                        throw new CompletionException(e);
                    }
                })
                .whenComplete((results, failure) -> {
                    if (failure != null) {
                        LOG.warn("Async query on {} failed: {}", logFile, failure.getMessage());
                    }
                });
    }

    // Malformed UTF-8 is replaced rather than rejected: a bad byte on a hidden line must not fail the query.
    private String readLog() throws IOException {
        return new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
    }

    private MutableList<JsonNode.JsonObject> evaluate(String content, Filter filter, FindOptions options)
            throws IOException {
        return executor.execute(filter, options, decoder.decode(content));
    }
}
