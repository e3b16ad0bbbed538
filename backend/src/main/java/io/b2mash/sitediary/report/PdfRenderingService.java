package io.b2mash.sitediary.report;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.springframework.stereotype.Service;

/**
 * Converts rendered HTML to PDF via OpenHTMLToPDF. The HTML is parsed with jsoup first, so the
 * converter always receives a well-formed DOM.
 */
@Service
public class PdfRenderingService {

  public byte[] htmlToPdf(String html) {
    var document = new W3CDom().fromJsoup(Jsoup.parse(html));
    try (var outputStream = new ByteArrayOutputStream()) {
      var builder = new PdfRendererBuilder();
      builder.useFastMode();
      builder.withW3cDocument(document, null);
      builder.toStream(outputStream);
      builder.run();
      return outputStream.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new PdfGenerationException("Failed to generate PDF from rendered HTML", e);
    }
  }
}
