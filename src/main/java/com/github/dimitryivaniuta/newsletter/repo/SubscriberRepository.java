package com.github.dimitryivaniuta.newsletter.repo;

import com.github.dimitryivaniuta.newsletter.domain.Subscriber;
import com.github.dimitryivaniuta.newsletter.domain.SubscriptionStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link Subscriber}.
 */
public interface SubscriberRepository extends JpaRepository<Subscriber, UUID> {

    List<Subscriber> findAllByStatus(SubscriptionStatus status);
}
