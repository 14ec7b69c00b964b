/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.source.postgres;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.errors.SourceReadException;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.model.User;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads Subjects and Aspects from the relational store, and the Users named as sample providers.
 * Features:
 * - HikariCP connection pooling, read-only connections
 * - Case-insensitive natural-name lookups
 * - Soft-deleted rows ({@code "deletedAt" IS NOT NULL}) are invisible
 * - Range columns are numeric arrays {@code [min, max]}; a NULL element is an open bound
 */
public final class JdbcSubjectAspectSource implements SubjectAspectSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcSubjectAspectSource.class);

    private static final String DEFAULT_SUBJECT_TABLE = "Subjects";
    private static final String DEFAULT_ASPECT_TABLE = "Aspects";
    private static final String DEFAULT_USER_TABLE = "Users";
    private static final String DEFAULT_PROFILE_TABLE = "Profiles";
    private static final int DEFAULT_POOL_SIZE = 4;

    private final DataSource dataSource;
    private final String subjectSelect;
    private final String aspectSelect;
    private final String userSelect;
    private final MetricsRuntime metrics;

    public JdbcSubjectAspectSource(DataSource dataSource, String subjectTable, String aspectTable, MetricsRuntime metrics) {
        this(dataSource, subjectTable, aspectTable, DEFAULT_USER_TABLE, DEFAULT_PROFILE_TABLE, metrics);
    }

    public JdbcSubjectAspectSource(DataSource dataSource, String subjectTable, String aspectTable,
                                   String userTable, String profileTable, MetricsRuntime metrics) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.subjectSelect = "SELECT \"id\", \"absolutePath\", \"isPublished\" FROM " + quote(subjectTable)
                + " WHERE \"deletedAt\" IS NULL";
        this.aspectSelect = "SELECT \"id\", \"name\", \"isPublished\", \"criticalRange\", \"warningRange\","
                + " \"infoRange\", \"okRange\" FROM " + quote(aspectTable)
                + " WHERE \"deletedAt\" IS NULL";
        // Provider ids arrive as text; the id column may be a uuid
        this.userSelect = "SELECT u.\"id\", u.\"name\", u.\"email\", p.\"id\" AS \"profileId\","
                + " p.\"name\" AS \"profileName\" FROM " + quote(userTable) + " u"
                + " LEFT JOIN " + quote(profileTable) + " p ON p.\"id\" = u.\"profileId\""
                + " WHERE u.\"deletedAt\" IS NULL AND u.\"id\"::text = ?";
    }

    public static JdbcSubjectAspectSource fromConfig(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getString("postgres.url", "jdbc:postgresql://localhost:5432/focusdb"));
        hikari.setUsername(config.getString("postgres.username", "postgres"));
        hikari.setPassword(config.getString("postgres.password", "password"));
        hikari.setMaximumPoolSize(config.getInt("postgres.pool.size", DEFAULT_POOL_SIZE));
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(config.getLong("postgres.connection.timeout.ms", 5000L));
        hikari.setReadOnly(true);
        hikari.setPoolName("samsto-source");

        final String subjects = config.getString("postgres.table.subjects", DEFAULT_SUBJECT_TABLE);
        final String aspects = config.getString("postgres.table.aspects", DEFAULT_ASPECT_TABLE);
        final String users = config.getString("postgres.table.users", DEFAULT_USER_TABLE);
        final String profiles = config.getString("postgres.table.profiles", DEFAULT_PROFILE_TABLE);

        log.info("Postgres source active. url={} tables={},{},{},{}", hikari.getJdbcUrl(), subjects, aspects, users, profiles);
        return new JdbcSubjectAspectSource(new HikariDataSource(hikari), subjects, aspects, users, profiles, metrics);
    }

    @Override
    public Optional<Subject> findSubjectByAbsolutePath(String absolutePath) {
        List<Subject> rows = query(subjectSelect + " AND lower(\"absolutePath\") = lower(?)", absolutePath,
                JdbcSubjectAspectSource::subjectRow);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<Aspect> findAspectByName(String name) {
        List<Aspect> rows = query(aspectSelect + " AND lower(\"name\") = lower(?)", name,
                JdbcSubjectAspectSource::aspectRow);
        return rows.stream().findFirst();
    }

    @Override
    public List<Subject> findAllSubjects() {
        return query(subjectSelect, null, JdbcSubjectAspectSource::subjectRow);
    }

    @Override
    public List<Aspect> findAllAspects() {
        return query(aspectSelect, null, JdbcSubjectAspectSource::aspectRow);
    }

    @Override
    public Optional<User> findUserById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return query(userSelect, id, JdbcSubjectAspectSource::userRow).stream().findFirst();
    }

    private <T> List<T> query(String sql, String param, RowMapper<T> mapper) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<T> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            metrics.counter("samsto.source.errors");
            throw new SourceReadException("Source query failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            metrics.counter("samsto.source.errors");
            throw new SourceReadException("Source row rejected: " + e.getMessage(), e);
        }
    }

    static Subject subjectRow(ResultSet rs) throws SQLException {
        return new Subject(rs.getString("id"), rs.getString("absolutePath"), rs.getBoolean("isPublished"));
    }

    static User userRow(ResultSet rs) throws SQLException {
        final String profileId = rs.getString("profileId");
        final User.Profile profile = profileId == null ? null : new User.Profile(profileId, rs.getString("profileName"));
        return new User(rs.getString("id"), rs.getString("name"), rs.getString("email"), profile);
    }

    static Aspect aspectRow(ResultSet rs) throws SQLException {
        return Aspect.builder(rs.getString("id"), rs.getString("name"))
                .published(rs.getBoolean("isPublished"))
                .critical(range(rs.getArray("criticalRange")))
                .warning(range(rs.getArray("warningRange")))
                .info(range(rs.getArray("infoRange")))
                .ok(range(rs.getArray("okRange")))
                .build();
    }

    static Range range(Array column) throws SQLException {
        if (column == null) return null;
        try {
            Object[] bounds = (Object[]) column.getArray();
            if (bounds == null || bounds.length == 0) return null;
            if (bounds.length != 2) {
                throw new SQLException("range column must hold exactly two elements, got " + bounds.length);
            }
            return new Range(toDouble(bounds[0]), toDouble(bounds[1]));
        } finally {
            column.free();
        }
    }

    private static Double toDouble(Object bound) throws SQLException {
        if (bound == null) return null;
        if (bound instanceof Number n) return n.doubleValue();
        throw new SQLException("range bound is not numeric: " + bound);
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hds && !hds.isClosed()) {
            hds.close();
            log.info("Postgres source closed.");
        }
    }

    private static String quote(String identifier) {
        if (identifier == null || identifier.isBlank() || identifier.contains("\"")) {
            throw new IllegalArgumentException("Invalid table name: " + identifier);
        }
        return "\"" + identifier + "\"";
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
