package com.studyprep.api.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Applies the optional pgvector DDL at startup. Each statement runs on its own,
 * so a database without the extension only loses the vector features.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorSchemaInitializer implements CommandLineRunner {

    static final String VECTOR_SCHEMA = "db/vector-schema.sql";

    private final JdbcTemplate jdbcTemplate;

    @Value("${vector.schema.auto-create:true}")
    private boolean autoCreate;

    @Override
    public void run(String... args) throws IOException {
        if (!autoCreate) {
            log.info("[VECTOR_SCHEMA] Auto-create disabled");
            return;
        }

        int applied = 0;
        List<String> statements = loadStatements();
        for (String statement : statements) {
            try {
                jdbcTemplate.execute(statement);
                applied++;
            } catch (DataAccessException e) {
                log.warn("[VECTOR_SCHEMA] Statement failed, semantic search will be unavailable | statement={} | error={}",
                    statement, e.getMostSpecificCause().getMessage());
            }
        }
        log.info("[VECTOR_SCHEMA] Vector schema applied | statements={}/{}", applied, statements.size());
    }

    static List<String> splitStatements(String script) {
        return Arrays.stream(script.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private List<String> loadStatements() throws IOException {
        try (InputStream in = new ClassPathResource(VECTOR_SCHEMA).getInputStream()) {
            return splitStatements(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
        }
    }
}
