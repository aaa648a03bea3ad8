package io.insurancepro.site.subscriber;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubscriberRepository extends JpaRepository<Subscriber, UUID> {

  Optional<Subscriber> findByEmail(String email);

  long countByStatus(SubscriberStatus status);

  @Query("SELECT s FROM Subscriber s WHERE s.status IN :statuses ORDER BY s.subscribedAt ASC")
  List<Subscriber> findByStatusIn(@Param("statuses") Collection<SubscriberStatus> statuses);

  Page<Subscriber> findByStatus(SubscriberStatus status, Pageable pageable);

  @Modifying
  @Query("UPDATE Subscriber s SET s.lastCampaignSentAt = :sentAt WHERE s.id IN :ids")
  int stampLastCampaignSent(@Param("ids") Collection<UUID> ids, @Param("sentAt") Instant sentAt);
}
