package com.williamcallahan.memorypipeline.service.storage;

import jakarta.annotation.PostConstruct;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

/**
 * Creates the pipeline, operation and content tables if they do not exist yet.
 */
@Component
public class StorageSchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(StorageSchemaInitializer.class);
    static final String SCHEMA_LOCATION = "db/pipeline-schema.sql";

    private final DataSource dataSource;

    public StorageSchemaInitializer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @PostConstruct
    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(dataSource);
        log.info("[STORAGE] Pipeline schema ready");
    }
}
