package io.insurancepro.site.campaign;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

  long countByStatus(CampaignStatus status);

  List<Campaign> findTop5ByOrderByCreatedAtDesc();
}
