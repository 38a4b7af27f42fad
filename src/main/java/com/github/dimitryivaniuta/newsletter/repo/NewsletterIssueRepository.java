package com.github.dimitryivaniuta.newsletter.repo;

import com.github.dimitryivaniuta.newsletter.domain.NewsletterIssue;
import com.github.dimitryivaniuta.newsletter.service.dto.IssueContent;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link NewsletterIssue}.
 */
public interface NewsletterIssueRepository extends JpaRepository<NewsletterIssue, UUID> {

    /**
     * Finds the issue and locks its row until the end of the transaction.
     *
     * <p>Every change to the task counters goes through this lock, which serializes the acknowledge steps of
     * all workers delivering the same issue.</p>
     *
     * @param id issue id
     * @return locked issue
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from NewsletterIssue i where i.id = :id")
    Optional<NewsletterIssue> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Reads the content needed for a send without putting the issue into the persistence context.
     *
     * @param id issue id
     * @return content
     */
    @Query("select new com.github.dimitryivaniuta.newsletter.service.dto.IssueContent(i.title, i.textContent, i.htmlContent) "
            + "from NewsletterIssue i where i.id = :id")
    Optional<IssueContent> findContentById(@Param("id") UUID id);
}
