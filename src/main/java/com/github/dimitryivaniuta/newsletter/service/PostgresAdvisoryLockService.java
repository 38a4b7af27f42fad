package com.github.dimitryivaniuta.newsletter.service;

import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transaction-scoped Postgres advisory locks keyed by (scope, issue id).
 *
 * <p>Row locks only work once a row exists. Publishing may create the issue row, so two concurrent publishes of
 * the same new issue are serialized on {@code pg_advisory_xact_lock} instead. The lock is released when the
 * transaction ends.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    private static final RowCallbackHandler IGNORE_ROW = rs -> { };

    private final JdbcTemplate jdbcTemplate;

    /**
     * Creates the service.
     *
     * @param jdbcTemplate jdbc template
     */
    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Blocks until the lock for (scope, issueId) is held by the current transaction.
     *
     * @param scope lock scope
     * @param issueId issue id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(String scope, UUID issueId) {
        jdbcTemplate.query("select pg_advisory_xact_lock(hashtextextended(?, 0))", IGNORE_ROW, scope + "|" + issueId);
    }
}
