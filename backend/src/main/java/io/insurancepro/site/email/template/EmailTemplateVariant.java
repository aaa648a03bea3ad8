package io.insurancepro.site.email.template;

import java.util.Locale;

/** Visual layouts a campaign can be rendered with. Each maps to one classpath template. */
public enum EmailTemplateVariant {
  DEFAULT("campaign-default"),
  PROMOTIONAL("campaign-promotional"),
  NEWSLETTER("campaign-newsletter");

  private final String templateName;

  EmailTemplateVariant(String templateName) {
    this.templateName = templateName;
  }

  public String templateName() {
    return templateName;
  }

  /** Case-insensitive lookup; anything unrecognised renders with {@link #DEFAULT}. */
  public static EmailTemplateVariant fromValue(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return DEFAULT;
    }
  }
}
