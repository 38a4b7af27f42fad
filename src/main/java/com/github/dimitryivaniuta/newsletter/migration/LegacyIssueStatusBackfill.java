package com.github.dimitryivaniuta.newsletter.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Brings issues written before the status/counter columns existed in line with the current model.
 *
 * <p>Older rows have either no status at all or one of the legacy values {@code PUBLISHED} and
 * {@code IN PROCESS}. Afterwards every published issue is {@code AVAILABLE} with
 * {@code required_n_tasks} equal to its outstanding queue rows, or {@code COMPLETED} with 0/0.</p>
 *
 * <p>A {@code NULL} status is always legacy data: {@code NewsletterPublisher} inserts an issue and publishes it in
 * the same transaction, so no draft without a status is ever committed.</p>
 *
 * <p>Must run inside the caller's transaction; it does not commit.</p>
 */
public class LegacyIssueStatusBackfill {

    private static final Logger log = LoggerFactory.getLogger(LegacyIssueStatusBackfill.class);

    private static final String MARK_IN_PROCESS = """
            UPDATE newsletter_issues
               SET status = 'IN_PROCESS'
             WHERE (status IS NULL
                    AND id IN (SELECT q.issue_id FROM newsletter_issue_delivery_queue q))
                OR status = 'IN PROCESS'
            """;

    private static final String MARK_COMPLETED = """
            UPDATE newsletter_issues
               SET status = 'COMPLETED', required_n_tasks = 0, finished_n_tasks = 0
             WHERE status IS NULL OR status = 'PUBLISHED'
            """;

    private static final String REOPEN_IN_PROCESS = """
            UPDATE newsletter_issues i
               SET status = 'AVAILABLE', finished_n_tasks = 0, required_n_tasks = q.remaining
              FROM (SELECT issue_id, count(*) AS remaining
                      FROM newsletter_issue_delivery_queue
                     GROUP BY issue_id) q
             WHERE i.id = q.issue_id
               AND i.status = 'IN_PROCESS'
            """;

    private static final String CLOSE_DRAINED = """
            UPDATE newsletter_issues
               SET status = 'COMPLETED', required_n_tasks = 0, finished_n_tasks = 0
             WHERE status = 'IN_PROCESS'
            """;

    private final JdbcTemplate jdbcTemplate;

    public LegacyIssueStatusBackfill(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs all steps in order.
     *
     * @return rows touched per step
     */
    public BackfillReport reconcile() {
        int inProcess = jdbcTemplate.update(MARK_IN_PROCESS);
        int completed = jdbcTemplate.update(MARK_COMPLETED);
        int reopened = jdbcTemplate.update(REOPEN_IN_PROCESS);
        int drained = jdbcTemplate.update(CLOSE_DRAINED);

        BackfillReport report = new BackfillReport(inProcess, completed, reopened, drained);
        log.info("Legacy issue status back-fill done. inProcess={} completed={} reopened={} closedDrained={}",
                inProcess, completed, reopened, drained);
        return report;
    }
}
