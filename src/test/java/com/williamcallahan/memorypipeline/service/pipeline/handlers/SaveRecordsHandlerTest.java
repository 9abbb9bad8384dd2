package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.chunking.ChunkerOptions;
import com.williamcallahan.memorypipeline.service.embedding.LocalHashingEmbeddingClient;
import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies memory record contents, idempotent saves and purging of records the document no longer produces.
 */
class SaveRecordsHandlerTest {
    private static final ChunkerOptions SMALL = new ChunkerOptions(10, 30, 5);

    @TempDir
    Path tempDir;

    private HandlerFixture fixture;
    private final LocalHashingEmbeddingClient embeddingClient = new LocalHashingEmbeddingClient(16);

    @BeforeEach
    void setUp() throws IOException {
        fixture = new HandlerFixture(tempDir);
    }

    @Test
    void savesOneTaggedRecordPerPartition() throws IOException {
        Pipeline embedded = embedded(HandlerFixture.words(100), Map.of("team", "search"));
        int partitions = embedded.recordIds().size();

        Pipeline saved = HandlerFixture.successOf(handler().invoke(embedded));

        List<MemoryRecord> records = sorted(fixture.memoryDb.getList(HandlerFixture.INDEX, HandlerFixture.DOCUMENT_ID));
        assertEquals(partitions, records.size());
        MemoryRecord first = records.get(0);
        assertEquals("d=doc-1//p=notes.txt.partition.0.txt", first.id());
        assertEquals(16, first.vector().length);
        assertEquals("search", first.tags().get("team"));
        assertEquals(HandlerFixture.DOCUMENT_ID, first.tags().get(MemoryRecord.DOCUMENT_ID_TAG));
        assertEquals("notes.txt", first.tags().get(MemoryRecord.FILE_ID_TAG));
        assertEquals(MimeTypes.PLAIN_TEXT, first.tags().get(MemoryRecord.FILE_TYPE_TAG));
        assertEquals("notes.txt.partition.0.txt", first.tags().get(MemoryRecord.FILE_PARTITION_TAG));
        assertEquals(LocalHashingEmbeddingClient.PROVIDER_NAME, first.payload().get(MemoryRecord.VECTOR_PROVIDER_FIELD));
        assertEquals(fixture.storage.readText(HandlerFixture.INDEX, HandlerFixture.DOCUMENT_ID,
                "notes.txt.partition.0.txt"), first.text());
        assertTrue(saved.previousExecutionRecordIds().isEmpty());
    }

    @Test
    void savingAgainOverwritesInsteadOfDuplicating() throws IOException {
        Pipeline embedded = embedded(HandlerFixture.words(100), Map.of());
        SaveRecordsHandler handler = handler();

        HandlerFixture.successOf(handler.invoke(embedded));
        int afterFirst = fixture.memoryDb.size(HandlerFixture.INDEX);
        HandlerFixture.successOf(handler.invoke(embedded));

        assertEquals(afterFirst, fixture.memoryDb.size(HandlerFixture.INDEX));
    }

    @Test
    void recordsOfSupersededExecutionArePurged() throws IOException {
        MemoryRecord stale = new MemoryRecord("d=doc-1//p=old.txt.partition.0.txt", new float[16],
                Map.of(MemoryRecord.DOCUMENT_ID_TAG, HandlerFixture.DOCUMENT_ID), Map.of());
        MemoryRecord untracked = new MemoryRecord("d=doc-1//p=old.txt.partition.1.txt", new float[16],
                Map.of(MemoryRecord.DOCUMENT_ID_TAG, "someone-else"), Map.of());
        fixture.memoryDb.upsert(HandlerFixture.INDEX, stale);
        fixture.memoryDb.upsert(HandlerFixture.INDEX, untracked);
        Pipeline embedded = embedded(HandlerFixture.words(20), Map.of())
                .withPreviousExecutionRecordIds(List.of(stale.id(), untracked.id()));

        HandlerFixture.successOf(handler().invoke(embedded));

        List<String> ids = fixture.memoryDb.getList(HandlerFixture.INDEX, HandlerFixture.DOCUMENT_ID).stream()
                .map(MemoryRecord::id)
                .toList();
        assertEquals(embedded.recordIds().size(), ids.size());
        assertTrue(ids.containsAll(embedded.recordIds()));
        assertTrue(fixture.memoryDb.getList(HandlerFixture.INDEX, "someone-else").isEmpty());
    }

    @Test
    void missingEmbeddingIsPermanentFailure() throws IOException {
        Pipeline partitioned = fixture.extractedAndPartitioned(
                fixture.upload("notes.txt", MimeTypes.PLAIN_TEXT, HandlerFixture.words(20)), SMALL);

        assertInstanceOf(HandlerResult.PermanentFailure.class, handler().invoke(partitioned));
    }

    @Test
    void recordsWithoutVectorsWhenEmbeddingsAreDisabled() throws IOException {
        fixture.appProperties.getEmbeddings().setEnabled(false);
        Pipeline partitioned = fixture.extractedAndPartitioned(fixture.upload(
                "notes.txt", MimeTypes.PLAIN_TEXT, HandlerFixture.words(20).getBytes(StandardCharsets.UTF_8),
                Map.of()), SMALL);

        HandlerFixture.successOf(handler().invoke(partitioned));

        MemoryRecord record = fixture.memoryDb.getList(HandlerFixture.INDEX, HandlerFixture.DOCUMENT_ID).get(0);
        assertEquals(0, record.vector().length);
        assertNull(record.payload().get(MemoryRecord.VECTOR_PROVIDER_FIELD));
    }

    private SaveRecordsHandler handler() {
        return new SaveRecordsHandler(fixture.storage, fixture.memoryDb, embeddingClient, fixture.json,
                fixture.clock, fixture.appProperties);
    }

    private Pipeline embedded(String text, Map<String, String> tags) throws IOException {
        Pipeline uploaded = fixture.upload("notes.txt", MimeTypes.PLAIN_TEXT,
                text.getBytes(StandardCharsets.UTF_8), tags);
        Pipeline partitioned = fixture.extractedAndPartitioned(uploaded, SMALL);
        return HandlerFixture.successOf(new GenerateEmbeddingsHandler(
                fixture.storage, embeddingClient, fixture.json, fixture.hasher, fixture.appProperties)
                .invoke(partitioned));
    }

    private static List<MemoryRecord> sorted(List<MemoryRecord> records) {
        return records.stream().sorted(Comparator.comparing(MemoryRecord::id)).toList();
    }
}
