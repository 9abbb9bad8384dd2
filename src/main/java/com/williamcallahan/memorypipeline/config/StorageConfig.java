package com.williamcallahan.memorypipeline.config;

import com.williamcallahan.memorypipeline.service.memory.InMemoryMemoryDb;
import com.williamcallahan.memorypipeline.service.memory.MemoryDb;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.LocalDocumentStorage;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Persistence wiring: the SQLite database holding pipelines, operations and content records, the
 * document file store, and the memory database.
 */
@Configuration
public class StorageConfig {
    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);
    private static final int BUSY_TIMEOUT_MS = 5000;

    /**
     * Opens the pipeline database in WAL mode so workers can read while another one writes.
     */
    @Bean
    public DataSource pipelineDataSource(AppProperties appProperties) {
        Path databasePath = Path.of(appProperties.getStorage().getDatabasePath()).toAbsolutePath().normalize();
        createParentDirectories(databasePath);
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databasePath);
        log.info("[STORAGE] Pipeline database at {}", databasePath);
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource pipelineDataSource) {
        return new JdbcTemplate(pipelineDataSource);
    }

    @Bean
    public DocumentStorage documentStorage(AppProperties appProperties, ContentHasher hasher) throws IOException {
        return new LocalDocumentStorage(Path.of(appProperties.getStorage().getDocumentsDir()), hasher);
    }

    @Bean
    public MemoryDb memoryDb() {
        return new InMemoryMemoryDb();
    }

    private static void createParentDirectories(Path databasePath) {
        Path parent = databasePath.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to create database directory " + parent, exception);
        }
    }
}
