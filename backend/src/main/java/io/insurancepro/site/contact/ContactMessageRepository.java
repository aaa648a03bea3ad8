package io.insurancepro.site.contact;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ContactMessageRepository extends JpaRepository<ContactMessage, UUID> {

  List<ContactMessage> findAllByOrderByCreatedAtDesc();

  long countByReadFalse();
}
