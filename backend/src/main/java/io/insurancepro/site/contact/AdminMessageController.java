package io.insurancepro.site.contact;

import io.insurancepro.site.contact.dto.ContactMessageResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/messages")
@PreAuthorize("hasRole('ADMIN')")
public class AdminMessageController {

  private final ContactMessageService contactMessageService;

  public AdminMessageController(ContactMessageService contactMessageService) {
    this.contactMessageService = contactMessageService;
  }

  @GetMapping
  public ResponseEntity<List<ContactMessageResponse>> list() {
    return ResponseEntity.ok(contactMessageService.listNewestFirst());
  }

  @PostMapping("/{id}/read")
  public ResponseEntity<Map<String, Boolean>> markRead(@PathVariable UUID id) {
    contactMessageService.markRead(id);
    return ResponseEntity.ok(Map.of("success", true));
  }
}
