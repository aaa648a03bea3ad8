package io.insurancepro.site.subscriber;

import io.insurancepro.site.api.ActionResponse;
import io.insurancepro.site.subscriber.dto.SubscriberCountResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SubscriberController {

  private final SubscriberService subscriberService;

  public SubscriberController(SubscriberService subscriberService) {
    this.subscriberService = subscriberService;
  }

  @PostMapping("/subscribe")
  public ResponseEntity<ActionResponse> subscribe(
      @RequestParam(required = false) String email,
      @RequestParam(required = false) String name,
      @RequestParam(name = "insurance_type", required = false) String insuranceType) {
    var outcome = subscriberService.subscribe(email, name, insuranceType);
    return ResponseEntity.ok(new ActionResponse(outcome.isChange(), outcome.message()));
  }

  @GetMapping("/api/subscribers/count")
  public ResponseEntity<SubscriberCountResponse> count() {
    return ResponseEntity.ok(new SubscriberCountResponse(subscriberService.countActive()));
  }
}
