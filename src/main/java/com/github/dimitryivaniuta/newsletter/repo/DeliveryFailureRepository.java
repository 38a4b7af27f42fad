package com.github.dimitryivaniuta.newsletter.repo;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailure;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeliveryFailureRepository extends JpaRepository<DeliveryFailure, UUID> {

    List<DeliveryFailure> findAllByIssueId(UUID issueId);
}
