package com.raidxp.service.repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads SQL from classpath resources so statements live in {@code .sql} files
 * rather than Java strings.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());
    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Loads every named query of a resource file.
     *
     * @param resourcePath classpath location, e.g. {@code sql/queries.sql}
     * @return query name to single-line SQL, without the trailing semicolon
     * @throws IllegalStateException if the resource is missing, unreadable, or names a query twice
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new LinkedHashMap<>();
        String currentName = null;
        StringBuilder current = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(NAME_MARKER)) {
                store(queries, currentName, current, resourcePath);
                currentName = line.substring(NAME_MARKER.length()).trim();
                current = new StringBuilder();
            } else if (line.startsWith("--") || line.isEmpty()) {
                continue;
            } else if (currentName != null) {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(line);
            }
        }
        store(queries, currentName, current, resourcePath);

        logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);
        return Collections.unmodifiableMap(queries);
    }

    /**
     * Loads a schema file as individual statements, comments removed.
     */
    public static List<String> loadStatements(String resourcePath) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith("--") || line.isEmpty()) {
                continue;
            }
            current.append(line).append('\n');
            if (line.endsWith(";")) {
                statements.add(stripSemicolon(current.toString()));
                current = new StringBuilder();
            }
        }
        if (!current.toString().isBlank()) {
            statements.add(stripSemicolon(current.toString()));
        }
        logger.info("Loaded " + statements.size() + " schema statements from " + resourcePath);
        return statements;
    }

    private static void store(Map<String, String> queries, String name, StringBuilder sql, String resourcePath) {
        if (name == null || sql.length() == 0) {
            return;
        }
        if (queries.put(name, stripSemicolon(sql.toString())) != null) {
            throw new IllegalStateException("Duplicate query '" + name + "' in " + resourcePath);
        }
    }

    private static String stripSemicolon(String sql) {
        String trimmed = sql.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("SQL resource not found: " + resourcePath);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read SQL resource " + resourcePath, e);
            throw new IllegalStateException("Failed to read SQL resource " + resourcePath, e);
        }
    }
}
