package io.b2mash.sitediary.report;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

/**
 * Renders a {@link SiteReport} to HTML with a dedicated Thymeleaf engine. The report template is
 * system-provided and loaded once from the classpath; its stylesheet is injected into the head.
 */
@Component
public class ReportHtmlRenderer {

  private static final String TEMPLATE_PATH = "reports/site-report.html";
  private static final String CSS_PATH = "reports/site-report.css";

  private final TemplateEngine templateEngine;
  private final String template;
  private final String css;

  public ReportHtmlRenderer() {
    this.templateEngine = createReportTemplateEngine();
    this.template = loadResource(TEMPLATE_PATH);
    this.css = loadResource(CSS_PATH);
  }

  public String render(SiteReport report) {
    var ctx = new Context();
    ctx.setVariable("report", report);
    return injectCss(templateEngine.process(template, ctx));
  }

  String injectCss(String renderedHtml) {
    String styleBlock = "<style>\n" + css + "\n</style>\n";
    int headClose = renderedHtml.indexOf("</head>");
    if (headClose < 0) {
      throw new IllegalStateException("Report template has no <head> element");
    }
    return renderedHtml.substring(0, headClose) + styleBlock + renderedHtml.substring(headClose);
  }

  private static TemplateEngine createReportTemplateEngine() {
    var engine = new TemplateEngine();
    var resolver = new StringTemplateResolver();
    resolver.setTemplateMode(TemplateMode.HTML);
    engine.setTemplateResolver(resolver);
    return engine;
  }

  private static String loadResource(String path) {
    try (InputStream is = new ClassPathResource(path).getInputStream()) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not load report resource " + path, e);
    }
  }
}
