package io.insurancepro.site.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.insurancepro.site.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ContactIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ContactMessageRepository repository;

  @BeforeEach
  void cleanUp() {
    repository.deleteAll();
  }

  private void submit(String name, String subject) throws Exception {
    mockMvc
        .perform(
            post("/contact")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "%s", "email": "visitor@example.com", "phone": "555-0100",
                     "subject": "%s", "message": "Please call me about a home policy."}
                    """
                        .formatted(name, subject)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(
            jsonPath("$.message")
                .value("Thank you for your message! We will get back to you soon."));
  }

  @Test
  void submit_stores_unread_message() throws Exception {
    submit("Visitor", "Home insurance");

    assertThat(repository.findAll())
        .singleElement()
        .satisfies(
            m -> {
              assertThat(m.getSubject()).isEqualTo("Home insurance");
              assertThat(m.isRead()).isFalse();
            });
  }

  @Test
  void submit_validates_field_lengths() throws Exception {
    mockMvc
        .perform(
            post("/contact")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "V", "email": "visitor@example.com", "subject": "Quote",
                     "message": "Hi"}
                    """))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            post("/contact")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Visitor", "email": "not-an-email", "subject": "Quote",
                     "message": "Hi"}
                    """))
        .andExpect(status().isBadRequest());

    assertThat(repository.count()).isZero();
  }

  @Test
  void submit_requires_subject() throws Exception {
    mockMvc
        .perform(
            post("/contact")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Visitor", "email": "visitor@example.com", "subject": "  ",
                     "message": "Please call me."}
                    """))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            post("/contact")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Visitor", "email": "visitor@example.com", "message": "Hi"}
                    """))
        .andExpect(status().isBadRequest());

    assertThat(repository.count()).isZero();
  }

  @Test
  void admin_lists_newest_first_and_marks_read() throws Exception {
    submit("First Visitor", "first");
    Thread.sleep(5);
    submit("Second Visitor", "second");

    mockMvc
        .perform(get("/admin/messages").with(user("admin").roles("ADMIN")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].subject").value("second"));

    var first =
        repository.findAll().stream()
            .filter(m -> m.getSubject().equals("first"))
            .findFirst()
            .orElseThrow();

    mockMvc
        .perform(
            post("/admin/messages/" + first.getId() + "/read")
                .with(user("admin").roles("ADMIN"))
                .with(csrf()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    assertThat(repository.findById(first.getId()).orElseThrow().isRead()).isTrue();
    assertThat(repository.countByReadFalse()).isEqualTo(1);
  }

  @Test
  void mark_read_of_unknown_message_is_not_found() throws Exception {
    mockMvc
        .perform(
            post("/admin/messages/" + UUID.randomUUID() + "/read")
                .with(user("admin").roles("ADMIN"))
                .with(csrf()))
        .andExpect(status().isNotFound());
  }
}
