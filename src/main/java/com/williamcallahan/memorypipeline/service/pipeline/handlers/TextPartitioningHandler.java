package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.GeneratedFileDescriptor;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.chunking.Chunker;
import com.williamcallahan.memorypipeline.service.chunking.ChunkerOptions;
import com.williamcallahan.memorypipeline.service.chunking.TextFormat;
import com.williamcallahan.memorypipeline.service.chunking.TextPartition;
import com.williamcallahan.memorypipeline.service.extraction.ContentSection;
import com.williamcallahan.memorypipeline.service.extraction.ExtractedContent;
import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.StorageJson;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits each file's extracted content into {@code {file}.partition.{n}.txt} files.
 *
 * <p>Partition names depend only on the file name and the partition ordinal, so a rerun overwrites the
 * same entries instead of adding new ones. Empty extracted text produces no partitions.
 */
@Component
public class TextPartitioningHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(TextPartitioningHandler.class);

    private final DocumentStorage storage;
    private final Chunker chunker;
    private final ChunkerOptions options;
    private final StorageJson json;
    private final ContentHasher hasher;

    public TextPartitioningHandler(
            DocumentStorage storage, Chunker chunker, ChunkerOptions options, StorageJson json, ContentHasher hasher) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.options = Objects.requireNonNull(options, "options");
        this.json = Objects.requireNonNull(json, "json");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public String stepName() {
        return PipelineSteps.PARTITION;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        Pipeline current = pipeline;
        try {
            for (FileRecord file : pipeline.files()) {
                FileRecord updated = file;
                for (GeneratedFileDescriptor extracted : file.generatedFilesOfType(ArtifactType.EXTRACTED_CONTENT)) {
                    if (extracted.alreadyProcessedBy(stepName())) {
                        continue;
                    }
                    updated = partition(current, updated, extracted);
                }
                current = current.withFile(updated);
            }
            return HandlerResult.success(current);
        } catch (IOException ioException) {
            return HandlerResult.transientFailure(current, FailureClassifier.describe(ioException));
        }
    }

    static String partitionFileName(String fileName, int partitionNumber) {
        return fileName + ".partition." + partitionNumber + ".txt";
    }

    private FileRecord partition(Pipeline pipeline, FileRecord file, GeneratedFileDescriptor extracted)
            throws IOException {
        ExtractedContent content = json.read(
                storage.readText(pipeline.ownerScope(), pipeline.id(), extracted.name()), ExtractedContent.class);
        List<String> pages = content.sections().stream().map(ContentSection::content).toList();
        TextFormat format = TextFormat.forMimeType(content.mimeType());
        List<TextPartition> partitions = chunker.splitPages(pages, options, format, content.pagesEndSentences());

        FileRecord updated = file;
        for (TextPartition partition : partitions) {
            String name = partitionFileName(file.name(), partition.number());
            storage.writeText(pipeline.ownerScope(), pipeline.id(), name, partition.text());
            GeneratedFileDescriptor descriptor = GeneratedFileDescriptor.of(
                            name, file.name(), ArtifactType.TEXT_PARTITION, MimeTypes.PLAIN_TEXT,
                            partition.text().getBytes(StandardCharsets.UTF_8).length, hasher.sha256(partition.text()))
                    .withPartitionPosition(partition.number(), partition.pageNumber())
                    .markProcessedBy(stepName());
            updated = updated.withGeneratedFile(descriptor);
        }
        if (partitions.isEmpty()) {
            log.info("[PIPELINE] {} has no text to partition", file.name());
        } else {
            log.info("[PIPELINE] Split {} into {} partition(s)", file.name(), partitions.size());
        }
        return updated.withGeneratedFile(extracted.markProcessedBy(stepName()));
    }
}
