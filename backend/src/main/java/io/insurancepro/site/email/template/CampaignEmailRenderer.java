package io.insurancepro.site.email.template;

import io.insurancepro.site.config.EmailProperties;
import java.time.Clock;
import java.time.Year;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders campaign emails from the Thymeleaf templates under {@code templates/email/}.
 *
 * <p>The campaign body is admin-authored HTML and is injected unescaped into the content slot. The
 * unsubscribe link is written as-is into the footer anchor.
 */
@Service
public class CampaignEmailRenderer {

  private static final Logger log = LoggerFactory.getLogger(CampaignEmailRenderer.class);

  private final TemplateEngine templateEngine;
  private final String brandName;
  private final Clock clock;

  public CampaignEmailRenderer(EmailProperties emailProperties, Clock clock) {
    this.templateEngine = createEmailTemplateEngine();
    this.brandName = emailProperties.brandName();
    this.clock = clock;
  }

  public RenderedEmail render(
      EmailTemplateVariant variant, String bodyContent, String unsubscribeLink) {
    var effective = variant != null ? variant : EmailTemplateVariant.DEFAULT;

    var ctx = new Context();
    ctx.setVariable("brandName", brandName);
    ctx.setVariable("year", Year.now(clock).getValue());
    ctx.setVariable("contentHtml", bodyContent != null ? bodyContent : "");
    ctx.setVariable("unsubscribeUrl", unsubscribeLink);

    String html = templateEngine.process(effective.templateName(), ctx);
    log.debug(
        "Rendered campaign template '{}', HTML size={}", effective.templateName(), html.length());
    return new RenderedEmail(html, toPlainText(html));
  }

  /**
   * Strips markup to produce the text/plain alternative. Link text keeps its URL in parentheses;
   * runs of blank lines collapse.
   */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;
    text = text.replaceAll("(?is)<head.*?</head>", "");
    text = text.replaceAll("(?is)<a[^>]*href=\"([^\"]*)\"[^>]*>(.*?)</a>", "$2 ($1)");
    text = text.replaceAll("(?i)<br\\s*/?>", "\n");
    text = text.replaceAll("(?i)</(p|h[1-6]|li)>", "\n\n");
    text = text.replaceAll("(?i)</(div|tr)>", "\n");
    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");
    text = text.replace("&copy;", "(c)");
    text = text.replace("&amp;", "&");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("(?m)^ +| +$", "");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    var engine = new SpringTemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
