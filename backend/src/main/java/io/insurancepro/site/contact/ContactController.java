package io.insurancepro.site.contact;

import io.insurancepro.site.api.ActionResponse;
import io.insurancepro.site.contact.dto.ContactRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ContactController {

  static final String THANK_YOU_MESSAGE =
      "Thank you for your message! We will get back to you soon.";

  private final ContactMessageService contactMessageService;

  public ContactController(ContactMessageService contactMessageService) {
    this.contactMessageService = contactMessageService;
  }

  @PostMapping("/contact")
  public ResponseEntity<ActionResponse> submit(@Valid @RequestBody ContactRequest request) {
    contactMessageService.submit(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(ActionResponse.ok(THANK_YOU_MESSAGE));
  }
}
