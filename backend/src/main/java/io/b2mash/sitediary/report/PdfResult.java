package io.b2mash.sitediary.report;

/** Result of PDF rendering containing the PDF bytes, a suggested filename, and the source HTML. */
public record PdfResult(byte[] pdfBytes, String fileName, String html) {}
