package com.jmapmail.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite store setup
 * - Creates the database file's directory (taken from the JDBC URL) and the blob root
 * - Applies schema.sql; every statement is idempotent, so a failure aborts startup
 */
@Slf4j
@Configuration
@EnableTransactionManagement
public class DatabaseConfig {

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSourceInitializer dataSourceInitializer(DataSource dataSource, ServerProperties properties,
                                                       @Value("${spring.datasource.url}") String url) {
        Path databaseDir = sqliteDirectory(url);
        if (databaseDir != null) {
            createDirectories(databaseDir);
        }
        createDirectories(Path.of(properties.getStorage().getBlobPath()));

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        populator.setContinueOnError(false);

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }

    /**
     * Directory holding the SQLite file of a jdbc:sqlite: URL
     * @return null for in-memory databases or a file in the working directory
     */
    static Path sqliteDirectory(String url) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return null;
        }
        String file = url.substring(SQLITE_PREFIX.length());
        int query = file.indexOf('?');
        if (query >= 0) {
            file = file.substring(0, query);
        }
        if (file.startsWith("file:")) {
            file = file.substring("file:".length());
        }
        if (file.isEmpty() || file.startsWith(":memory:") || file.contains("mode=memory")) {
            return null;
        }
        return Path.of(file).toAbsolutePath().getParent();
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }
}
