package com.logq;

import com.logq.config.LogQConfig;
import com.logq.json.JsonNode;
import com.logq.json.LogJsonParser;
import com.logq.log.RecordDecodeException;
import com.logq.query.Condition;
import com.logq.query.Filter;
import com.logq.query.FindOptions;
import com.logq.query.InvalidFilterException;
import com.logq.query.OperandPresence;
import com.logq.query.ProjectionSpec;
import com.logq.query.SortSpec;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedFileSystemException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class LogDatabaseTest {

    @TempDir
    Path tempDir;

    private final LogJsonParser parser = new LogJsonParser();

    private Path writeLog(String... lines) throws IOException {
        Path file = tempDir.resolve("data.log");
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testEndToEndScenario() throws IOException {
        Path file = writeLog(
                "E{\"name\":\"Ann\",\"age\":30}",
                "X{\"name\":\"Bob\",\"age\":25}",
                "E{\"name\":\"Cid\",\"age\":25}");
        LogDatabase db = new LogDatabase(file, List.of());

        MutableList<JsonNode.JsonObject> results = db.find(
                "{\"age\":{\"$lt\":30}}",
                FindOptions.sorted(SortSpec.by("name", SortSpec.Direction.ASCENDING)));

        assertEquals(1, results.size());
        assertEquals(parser.parseObject("{\"name\":\"Cid\",\"age\":25}"), results.get(0));
    }

    @Test
    public void testFindWithoutOptionsReturnsFullRecordsInLogOrder() throws IOException {
        Path file = writeLog(
                "E{\"name\":\"Zed\",\"age\":50}",
                "E{\"name\":\"Amy\",\"age\":20}");
        LogDatabase db = new LogDatabase(file, List.of());

        MutableList<JsonNode.JsonObject> results = db.find(Filter.all());

        assertEquals(2, results.size());
        assertEquals("Zed", ((JsonNode.JsonString) results.get(0).get("name")).value());
        assertEquals(2, results.get(0).fields().size());
    }

    @Test
    public void testSortAndProjection() throws IOException {
        Path file = writeLog(
                "E{\"name\":\"Ann\",\"age\":30,\"city\":\"Oslo\"}",
                "E{\"name\":\"Bob\",\"age\":30,\"city\":\"Rome\"}",
                "E{\"name\":\"Cid\",\"age\":25,\"city\":\"Lima\"}");
        LogDatabase db = new LogDatabase(file, List.of());

        MutableList<JsonNode.JsonObject> results = db.find(Filter.all(), new FindOptions(
                SortSpec.by("age", SortSpec.Direction.ASCENDING).then("name", SortSpec.Direction.DESCENDING),
                ProjectionSpec.of("name")));

        assertEquals(List.of(
                parser.parseObject("{\"name\":\"Cid\"}"),
                parser.parseObject("{\"name\":\"Bob\"}"),
                parser.parseObject("{\"name\":\"Ann\"}")), results);
    }

    @Test
    public void testTextSearchUsesConfiguredFields() throws IOException {
        Path file = writeLog(
                "E{\"title\":\"The Cat sat\",\"tag\":\"dog\"}",
                "E{\"title\":\"concatenate\",\"tag\":\"cat\"}");
        LogDatabase db = new LogDatabase(file, List.of("title"));

        assertEquals(1, db.find(Filter.text("cat")).size());
        assertEquals(0, db.find(Filter.text("dog")).size());
    }

    @Test
    public void testEveryCallSeesCurrentLog() throws IOException {
        Path file = writeLog("E{\"name\":\"Ann\"}");
        LogDatabase db = new LogDatabase(file, List.of());
        assertEquals(1, db.find(Filter.all()).size());

        Files.writeString(file, "E{\"name\":\"Bob\"}\nXnot-json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertEquals(2, db.find(Filter.all()).size());
    }

    @Test
    public void testMissingFileFails() {
        LogDatabase db = new LogDatabase(tempDir.resolve("missing.log"), List.of());

        assertThrows(NoSuchFileException.class, () -> db.find(Filter.all()));
    }

    @Test
    public void testDecodeFailureAbortsQuery() throws IOException {
        Path file = writeLog(
                "E{\"name\":\"Ann\"}",
                "E{broken",
                "E{\"name\":\"Cid\"}");
        LogDatabase db = new LogDatabase(file, List.of());

        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> db.find(Filter.all()));
        assertEquals(2, e.lineNumber());
    }

    @Test
    public void testInvalidFilterRejectedBeforeReading() {
        LogDatabase db = new LogDatabase(tempDir.resolve("missing.log"), List.of());

        assertThrows(InvalidFilterException.class, () -> db.find("{\"$and\":[],\"$or\":[]}", FindOptions.NONE));
    }

    @Test
    public void testOperandPresenceFromConfig() throws IOException {
        Path file = writeLog("E{\"count\":0}", "E{\"count\":3}");
        Filter zero = Filter.where("count", Condition.eq(0));

        LogDatabase lenient = new LogDatabase(LogQConfig.builder().logFile(file).textSearchFields().build());
        LogDatabase strict = new LogDatabase(LogQConfig.builder()
                .logFile(file)
                .textSearchFields()
                .operandPresence(OperandPresence.PRESENT)
                .build());

        assertEquals(2, lenient.find(zero).size());
        assertEquals(1, strict.find(zero).size());
    }

    @Test
    public void testFindAsync() throws Exception {
        Path file = writeLog(
                "E{\"name\":\"Ann\",\"age\":30}",
                "E{\"name\":\"Cid\",\"age\":25}");
        LogDatabase db = new LogDatabase(LogQConfig.builder().logFile(file).textSearchFields().build(), Runnable::run);

        CompletableFuture<MutableList<JsonNode.JsonObject>> future = db.findAsync(Filter.where("age", Condition.gt(26)));

        assertEquals(1, future.get().size());
    }

    @Test
    public void testFindAsyncFailsWithIOException() {
        LogDatabase db = new LogDatabase(tempDir.resolve("missing.log"), List.of());

        ExecutionException e = assertThrows(ExecutionException.class, () -> db.findAsync(Filter.all()).get());
        assertTrue(e.getCause() instanceof NoSuchFileException);
    }

    @Test
    public void testFindAsyncDecodeFailure() throws IOException {
        Path file = writeLog("E[]");
        LogDatabase db = new LogDatabase(file, List.of());

        ExecutionException e = assertThrows(ExecutionException.class, () -> db.findAsync(Filter.all()).get());
        assertTrue(e.getCause() instanceof RecordDecodeException);
    }

    @Test
    public void testInvalidUtf8OnHiddenLineIsIgnored() throws IOException {
        Path file = tempDir.resolve("data.log");
        byte[] visible = "E{\"name\":\"Ann\"}\nX".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[visible.length + 3];
        System.arraycopy(visible, 0, content, 0, visible.length);
        content[visible.length] = (byte) 0xC3;
        content[visible.length + 1] = (byte) 0x28;
        content[visible.length + 2] = '\n';
        Files.write(file, content);
        LogDatabase db = new LogDatabase(file, List.of());

        MutableList<JsonNode.JsonObject> results = db.find(Filter.all());

        assertEquals(1, results.size());
        assertEquals(parser.parseObject("{\"name\":\"Ann\"}"), results.get(0));
    }

    private Path logOnClosedFileSystem() throws IOException {
        Path zip = tempDir.resolve("logs.zip");
        Path file;
        try (FileSystem zipFs = FileSystems.newFileSystem(zip, Map.of("create", "true"))) {
            file = zipFs.getPath("data.log");
            Files.writeString(file, "E{\"name\":\"Ann\"}\n", StandardCharsets.UTF_8);
        }
        return file;
    }

    @Test
    public void testFindAsyncFailsOnUncheckedReadErrorWithDirectExecutor() throws IOException {
        Path file = logOnClosedFileSystem();
        LogDatabase db = new LogDatabase(LogQConfig.builder().logFile(file).textSearchFields().build(), Runnable::run);

        CompletableFuture<MutableList<JsonNode.JsonObject>> future = db.findAsync(Filter.all());

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertTrue(e.getCause() instanceof ClosedFileSystemException);
    }

    @Test
    public void testFindAsyncFailsOnUncheckedReadErrorWithPooledExecutor() throws IOException {
        Path file = logOnClosedFileSystem();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            LogDatabase db = new LogDatabase(LogQConfig.builder().logFile(file).textSearchFields().build(), pool);

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> db.findAsync(Filter.all()).get(5, TimeUnit.SECONDS));
            assertTrue(e.getCause() instanceof ClosedFileSystemException);
        } finally {
            pool.shutdownNow();
        }
    }
}
