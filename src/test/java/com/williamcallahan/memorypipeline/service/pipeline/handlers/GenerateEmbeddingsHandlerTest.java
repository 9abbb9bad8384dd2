package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.GeneratedFileDescriptor;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.chunking.ChunkerOptions;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingProviderRejectedException;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies embedding file generation, skipping of processed partitions, batching and failure mapping.
 */
class GenerateEmbeddingsHandlerTest {
    private static final ChunkerOptions SMALL = new ChunkerOptions(10, 30, 5);

    @TempDir
    Path tempDir;

    private HandlerFixture fixture;
    private EmbeddingClient embeddingClient;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new HandlerFixture(tempDir);
        embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.providerName()).thenReturn("test");
        when(embeddingClient.modelName()).thenReturn("mini");
        when(embeddingClient.embed(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new float[] {text.length(), 1f});
            }
            return vectors;
        });
    }

    @Test
    void writesOneEmbeddingFilePerPartition() throws IOException {
        Pipeline partitioned = partitioned(HandlerFixture.words(20), new ChunkerOptions(300, 2000, 30));

        Pipeline embedded = HandlerFixture.successOf(handler().invoke(partitioned));

        FileRecord file = embedded.files().get(0);
        List<GeneratedFileDescriptor> embeddings = file.generatedFilesOfType(ArtifactType.TEXT_EMBEDDING_VECTOR);
        assertEquals(1, embeddings.size());
        GeneratedFileDescriptor embedding = embeddings.get(0);
        assertEquals("notes.txt.partition.0.txt.test.mini.text_embedding", embedding.name());
        assertEquals("notes.txt.partition.0.txt", embedding.sourcePartitionName());
        assertTrue(file.generatedFilesOfType(ArtifactType.TEXT_PARTITION).get(0)
                .alreadyProcessedBy(PipelineSteps.GEN_EMBEDDINGS));

        GenerateEmbeddingsHandler.EmbeddingFileContent content = fixture.json.read(
                fixture.storage.readText(HandlerFixture.INDEX, HandlerFixture.DOCUMENT_ID, embedding.name()),
                GenerateEmbeddingsHandler.EmbeddingFileContent.class);
        assertEquals("test", content.provider());
        assertEquals(2, content.dimensions());
        assertArrayEquals(new float[] {HandlerFixture.words(20).length(), 1f}, content.vector());
    }

    @Test
    void rerunDoesNotEmbedProcessedPartitionsAgain() throws IOException {
        Pipeline partitioned = partitioned(HandlerFixture.words(100), SMALL);
        GenerateEmbeddingsHandler handler = handler();

        Pipeline first = HandlerFixture.successOf(handler.invoke(partitioned));
        Pipeline second = HandlerFixture.successOf(handler.invoke(first));

        verify(embeddingClient, times(1)).embed(anyList());
        assertEquals(first.files(), second.files());
    }

    @Test
    void partitionsAreSentInConfiguredBatches() throws IOException {
        fixture.appProperties.getEmbeddings().setBatchSize(2);
        Pipeline partitioned = partitioned(HandlerFixture.words(100), SMALL);
        int partitions = partitioned.files().get(0).generatedFilesOfType(ArtifactType.TEXT_PARTITION).size();

        HandlerFixture.successOf(handler().invoke(partitioned));

        verify(embeddingClient, times((partitions + 1) / 2)).embed(anyList());
    }

    @Test
    void throttlingIsTransient() throws IOException {
        when(embeddingClient.embed(anyList())).thenThrow(new EmbeddingServiceUnavailableException("HTTP 429"));
        Pipeline partitioned = partitioned(HandlerFixture.words(20), SMALL);

        HandlerResult result = handler().invoke(partitioned);

        HandlerResult.TransientFailure failure = assertInstanceOf(HandlerResult.TransientFailure.class, result);
        assertTrue(failure.reason().contains("429"));
    }

    @Test
    void rejectedInputIsPermanent() throws IOException {
        when(embeddingClient.embed(anyList())).thenThrow(new EmbeddingProviderRejectedException("input too long"));
        Pipeline partitioned = partitioned(HandlerFixture.words(20), SMALL);

        assertInstanceOf(HandlerResult.PermanentFailure.class, handler().invoke(partitioned));
    }

    @Test
    void vectorCountMismatchIsTransient() throws IOException {
        when(embeddingClient.embed(anyList())).thenReturn(List.of());
        Pipeline partitioned = partitioned(HandlerFixture.words(20), SMALL);

        assertInstanceOf(HandlerResult.TransientFailure.class, handler().invoke(partitioned));
    }

    @Test
    void disabledEmbeddingsLeavePipelineUntouched() throws IOException {
        fixture.appProperties.getEmbeddings().setEnabled(false);
        Pipeline partitioned = partitioned(HandlerFixture.words(20), SMALL);

        Pipeline result = HandlerFixture.successOf(handler().invoke(partitioned));

        assertEquals(partitioned, result);
        verify(embeddingClient, never()).embed(anyList());
    }

    private GenerateEmbeddingsHandler handler() {
        return new GenerateEmbeddingsHandler(
                fixture.storage, embeddingClient, fixture.json, fixture.hasher, fixture.appProperties);
    }

    private Pipeline partitioned(String text, ChunkerOptions options) throws IOException {
        return fixture.extractedAndPartitioned(fixture.upload("notes.txt", MimeTypes.PLAIN_TEXT, text), options);
    }
}
