package io.insurancepro.site.campaign;

import io.insurancepro.site.api.PageResponse;
import io.insurancepro.site.campaign.dto.CampaignResponse;
import io.insurancepro.site.campaign.dto.CreateCampaignRequest;
import io.insurancepro.site.campaign.dto.SendCampaignResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/campaigns")
@PreAuthorize("hasRole('ADMIN')")
public class CampaignController {

  private final CampaignService campaignService;

  public CampaignController(CampaignService campaignService) {
    this.campaignService = campaignService;
  }

  @GetMapping
  public ResponseEntity<PageResponse<CampaignResponse>> list(
      @RequestParam(defaultValue = "1") int page) {
    return ResponseEntity.ok(campaignService.list(page));
  }

  @PostMapping
  public ResponseEntity<CampaignResponse> create(
      @Valid @RequestBody CreateCampaignRequest request) {
    var response = campaignService.create(request);
    return ResponseEntity.created(URI.create("/admin/campaigns/" + response.id())).body(response);
  }

  @GetMapping("/{id}")
  public ResponseEntity<CampaignResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(campaignService.get(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    campaignService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/send")
  public ResponseEntity<SendCampaignResponse> send(@PathVariable UUID id) {
    var response = campaignService.send(id);
    boolean queued = response.success() && response.status() == CampaignStatus.SENDING;
    return ResponseEntity.status(queued ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);
  }

  @GetMapping("/{id}/preview")
  public ResponseEntity<String> preview(@PathVariable UUID id) {
    return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(campaignService.preview(id));
  }
}
