package io.insurancepro.site.subscriber;

import io.insurancepro.site.email.UnsubscribeTokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * Public target of campaign unsubscribe links. GET serves the link clicked in the email; POST
 * serves RFC 8058 one-click requests sent by mail clients.
 */
@RestController
@RequestMapping("/unsubscribe")
public class UnsubscribeController {

  private static final Logger log = LoggerFactory.getLogger(UnsubscribeController.class);

  static final String UNSUBSCRIBED_MESSAGE = "You have been successfully unsubscribed.";
  static final String NOT_FOUND_MESSAGE = "Subscriber not found.";
  static final String INVALID_LINK_MESSAGE = "Invalid or expired unsubscribe link.";

  private final SubscriberService subscriberService;

  public UnsubscribeController(SubscriberService subscriberService) {
    this.subscriberService = subscriberService;
  }

  @GetMapping("/{token}")
  public ResponseEntity<String> unsubscribe(@PathVariable String token) {
    return process(token);
  }

  @PostMapping("/{token}")
  public ResponseEntity<String> oneClickUnsubscribe(@PathVariable String token) {
    return process(token);
  }

  private ResponseEntity<String> process(String token) {
    try {
      var outcome = subscriberService.unsubscribeByToken(token);
      if (outcome == UnsubscribeOutcome.NOT_FOUND) {
        return page(HttpStatus.NOT_FOUND, "Unsubscribe", NOT_FOUND_MESSAGE);
      }
      return page(HttpStatus.OK, "Unsubscribed", UNSUBSCRIBED_MESSAGE);
    } catch (UnsubscribeTokenException e) {
      log.warn("Rejected unsubscribe token: {}", e.getMessage());
      return page(HttpStatus.BAD_REQUEST, "Unsubscribe", INVALID_LINK_MESSAGE);
    }
  }

  private static ResponseEntity<String> page(HttpStatus status, String title, String message) {
    String html =
        """
        <!DOCTYPE html>
        <html>
        <head>
          <meta charset="UTF-8">
          <title>%s</title>
          <style>
            body {
              font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif;
              max-width: 600px; margin: 80px auto; text-align: center; color: #333;
            }
            h1 { font-size: 1.5rem; margin-bottom: 1rem; color: #1e3c72; }
            p  { color: #666; }
          </style>
        </head>
        <body>
          <h1>%s</h1>
          <p>%s</p>
        </body>
        </html>
        """
            .formatted(
                HtmlUtils.htmlEscape(title),
                HtmlUtils.htmlEscape(title),
                HtmlUtils.htmlEscape(message));
    return ResponseEntity.status(status).contentType(MediaType.TEXT_HTML).body(html);
  }
}
