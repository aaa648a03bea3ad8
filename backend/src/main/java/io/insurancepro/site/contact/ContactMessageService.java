package io.insurancepro.site.contact;

import io.insurancepro.site.contact.dto.ContactMessageResponse;
import io.insurancepro.site.contact.dto.ContactRequest;
import io.insurancepro.site.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ContactMessageService {

  private static final Logger log = LoggerFactory.getLogger(ContactMessageService.class);

  private final ContactMessageRepository repository;
  private final Clock clock;

  public ContactMessageService(ContactMessageRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional
  public ContactMessageResponse submit(ContactRequest request) {
    var message =
        repository.save(
            new ContactMessage(
                request.name().trim(),
                request.email().trim(),
                blankToNull(request.phone()),
                request.subject().trim(),
                request.message(),
                clock.instant()));
    log.info("Received contact message: id={}", message.getId());
    return ContactMessageResponse.from(message);
  }

  @Transactional(readOnly = true)
  public List<ContactMessageResponse> listNewestFirst() {
    return repository.findAllByOrderByCreatedAtDesc().stream()
        .map(ContactMessageResponse::from)
        .toList();
  }

  @Transactional
  public void markRead(UUID id) {
    var message =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Message", id));
    message.markRead();
  }

  @Transactional(readOnly = true)
  public long countUnread() {
    return repository.countByReadFalse();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
