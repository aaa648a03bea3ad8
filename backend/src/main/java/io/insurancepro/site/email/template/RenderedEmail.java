package io.insurancepro.site.email.template;

/** Output of template rendering, ready to be wrapped in an EmailMessage. */
public record RenderedEmail(String htmlBody, String plainTextBody) {}
