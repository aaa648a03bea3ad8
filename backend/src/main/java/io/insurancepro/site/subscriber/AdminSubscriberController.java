package io.insurancepro.site.subscriber;

import io.insurancepro.site.api.PageResponse;
import io.insurancepro.site.subscriber.dto.BounceRequest;
import io.insurancepro.site.subscriber.dto.SubscriberResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/subscribers")
@PreAuthorize("hasRole('ADMIN')")
public class AdminSubscriberController {

  private final SubscriberService subscriberService;

  public AdminSubscriberController(SubscriberService subscriberService) {
    this.subscriberService = subscriberService;
  }

  @GetMapping
  public ResponseEntity<PageResponse<SubscriberResponse>> list(
      @RequestParam(defaultValue = "all") String status,
      @RequestParam(defaultValue = "1") int page) {
    return ResponseEntity.ok(subscriberService.list(status, page));
  }

  @PostMapping("/bounce")
  public ResponseEntity<SubscriberResponse> markBounced(@Valid @RequestBody BounceRequest request) {
    return ResponseEntity.ok(subscriberService.markBounced(request.email()));
  }
}
