package com.github.dimitryivaniuta.newsletter.migration;

import java.sql.Connection;
import liquibase.change.custom.CustomTaskChange;
import liquibase.database.Database;
import liquibase.database.DatabaseConnection;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.CustomChangeException;
import liquibase.exception.ValidationErrors;
import liquibase.resource.ResourceAccessor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Liquibase entry point for {@link LegacyIssueStatusBackfill}. Runs on the changeset's own connection, so the
 * back-fill commits or rolls back together with the changeset.
 */
public class LegacyIssueStatusBackfillChange implements CustomTaskChange {

    private BackfillReport report;

    @Override
    public void execute(Database database) throws CustomChangeException {
        DatabaseConnection connection = database.getConnection();
        if (!(connection instanceof JdbcConnection)) {
            throw new CustomChangeException("JDBC connection required, got " + connection.getClass().getName());
        }
        Connection jdbc = ((JdbcConnection) connection).getUnderlyingConnection();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(jdbc, true));
        try {
            report = new LegacyIssueStatusBackfill(jdbcTemplate).reconcile();
        } catch (DataAccessException ex) {
            throw new CustomChangeException("Legacy issue status back-fill failed", ex);
        }
    }

    @Override
    public String getConfirmationMessage() {
        if (report == null) {
            return "Legacy issue status back-fill did not run";
        }
        return "Legacy issue status back-fill updated " + report.total() + " issue rows";
    }

    @Override
    public void setUp() {
    }

    @Override
    public void setFileOpener(ResourceAccessor resourceAccessor) {
    }

    @Override
    public ValidationErrors validate(Database database) {
        return new ValidationErrors();
    }
}
