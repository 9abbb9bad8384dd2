package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.GeneratedFileDescriptor;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.extraction.ContentDecoder;
import com.williamcallahan.memorypipeline.service.extraction.ExtractedContent;
import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import com.williamcallahan.memorypipeline.service.extraction.UnsupportedContentException;
import com.williamcallahan.memorypipeline.service.extraction.WebPageFetcher;
import com.williamcallahan.memorypipeline.service.storage.ContentStore;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.StorageJson;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes every uploaded file into {@code {file}.extract.txt} (plain text) and
 * {@code {file}.extract.json} (sections, used for page-aware partitioning).
 *
 * <p>Files that already have both outputs are skipped. URL uploads are downloaded first and decoded
 * according to the content type the server reports.
 */
@Component
public class TextExtractionHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(TextExtractionHandler.class);

    static final String TEXT_SUFFIX = ".extract.txt";
    static final String CONTENT_SUFFIX = ".extract.json";

    private final DocumentStorage storage;
    private final List<ContentDecoder> decoders;
    private final WebPageFetcher webPageFetcher;
    private final ContentStore contentStore;
    private final StorageJson json;
    private final ContentHasher hasher;

    public TextExtractionHandler(
            DocumentStorage storage,
            List<ContentDecoder> decoders,
            WebPageFetcher webPageFetcher,
            ContentStore contentStore,
            StorageJson json,
            ContentHasher hasher) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.decoders = List.copyOf(decoders);
        this.webPageFetcher = Objects.requireNonNull(webPageFetcher, "webPageFetcher");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
        this.json = Objects.requireNonNull(json, "json");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public String stepName() {
        return PipelineSteps.EXTRACT;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        Pipeline current = pipeline;
        try {
            for (FileRecord file : pipeline.files()) {
                String textName = file.name() + TEXT_SUFFIX;
                String contentName = file.name() + CONTENT_SUFFIX;
                if (file.hasGeneratedFile(textName) && file.hasGeneratedFile(contentName)) {
                    log.debug("[PIPELINE] {} already extracted", file.name());
                    continue;
                }
                current = current.withFile(extract(current, file, textName, contentName));
            }
            contentStore.updateContent(current.id(), joinedText(current), extractionMetadata(current));
            return HandlerResult.success(current);
        } catch (UnsupportedContentException unsupported) {
            log.warn("[PIPELINE] Cannot extract text from document {}: {}", pipeline.id(), unsupported.getMessage());
            return HandlerResult.permanentFailure(current, FailureClassifier.describe(unsupported));
        } catch (IOException ioException) {
            log.warn("[PIPELINE] Extraction I/O failure for document {}: {}", pipeline.id(), ioException.getMessage());
            return HandlerResult.transientFailure(current, FailureClassifier.describe(ioException));
        }
    }

    private FileRecord extract(Pipeline pipeline, FileRecord file, String textName, String contentName)
            throws IOException {
        byte[] upload = storage.readFile(pipeline.ownerScope(), pipeline.id(), file.name());
        ExtractedContent content;
        if (upload.length == 0) {
            content = new ExtractedContent(MimeTypes.PLAIN_TEXT, List.of());
        } else if (MimeTypes.WEB_PAGE_URL.equals(file.mimeType())) {
            WebPageFetcher.FetchedPage page = webPageFetcher.fetch(new String(upload, StandardCharsets.UTF_8));
            content = decode(page.content(), page.mimeType(), file.name());
        } else {
            content = decode(upload, file.mimeType(), file.name());
        }

        String text = content.text();
        String contentJson = json.write(content);
        storage.writeText(pipeline.ownerScope(), pipeline.id(), textName, text);
        storage.writeText(pipeline.ownerScope(), pipeline.id(), contentName, contentJson);

        GeneratedFileDescriptor textFile = GeneratedFileDescriptor.of(
                        textName, file.name(), ArtifactType.EXTRACTED_TEXT, content.mimeType(),
                        text.getBytes(StandardCharsets.UTF_8).length, hasher.sha256(text))
                .markProcessedBy(stepName());
        GeneratedFileDescriptor contentFile = GeneratedFileDescriptor.of(
                        contentName, file.name(), ArtifactType.EXTRACTED_CONTENT, MimeTypes.JSON,
                        contentJson.getBytes(StandardCharsets.UTF_8).length, hasher.sha256(contentJson))
                .markProcessedBy(stepName());
        log.info("[PIPELINE] Extracted {} characters from {} ({} section(s))",
                text.length(), file.name(), content.sections().size());
        return file.withGeneratedFile(textFile).withGeneratedFile(contentFile);
    }

    /**
     * Picks the last registered decoder that supports the type, so later registrations override earlier ones.
     */
    private ExtractedContent decode(byte[] content, String mimeType, String fileName) throws IOException {
        ContentDecoder selected = null;
        for (ContentDecoder decoder : decoders) {
            if (decoder.supports(mimeType)) {
                selected = decoder;
            }
        }
        if (selected == null) {
            throw new UnsupportedContentException(
                    "No decoder supports MIME type '" + mimeType + "' of file " + fileName);
        }
        return selected.decode(content, mimeType);
    }

    private String joinedText(Pipeline pipeline) throws IOException {
        List<String> texts = new ArrayList<>();
        for (FileRecord file : pipeline.files()) {
            for (GeneratedFileDescriptor extracted : file.generatedFilesOfType(ArtifactType.EXTRACTED_TEXT)) {
                String text = storage.readText(pipeline.ownerScope(), pipeline.id(), extracted.name());
                if (!text.isBlank()) {
                    texts.add(text);
                }
            }
        }
        return String.join("\n\n", texts);
    }

    private static Map<String, String> extractionMetadata(Pipeline pipeline) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("execution_id", pipeline.executionId());
        metadata.put("files", String.valueOf(pipeline.files().size()));
        return metadata;
    }
}
