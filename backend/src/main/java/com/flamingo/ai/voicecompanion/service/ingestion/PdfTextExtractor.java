package com.flamingo.ai.voicecompanion.service.ingestion;

import com.flamingo.ai.voicecompanion.exception.IngestionFailedException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts raw text from PDF documents with Apache PDFBox 3, one entry per page. */
@Component
@Slf4j
public class PdfTextExtractor {

  /**
   * Extracts the text of every page.
   *
   * @param bytes raw PDF bytes
   * @return page texts in page order, possibly blank for image-only pages
   * @throws IngestionFailedException if the document is corrupt or encrypted
   */
  public List<String> extractPages(byte[] bytes) {
    try (PDDocument pdf = Loader.loadPDF(bytes)) {
      if (pdf.isEncrypted() && !pdf.getCurrentAccessPermission().canExtractContent()) {
        throw new IngestionFailedException(
            "PDF forbids text extraction", "The document is protected and cannot be read");
      }

      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      int pageCount = pdf.getNumberOfPages();
      List<String> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(pdf));
      }
      log.debug("Extracted text from {} PDF pages", pageCount);
      return pages;
    } catch (InvalidPasswordException e) {
      throw new IngestionFailedException(
          "PDF is password protected", "The document is password protected", e);
    } catch (IOException e) {
      log.error("PDFBox parsing failed: {}", e.getMessage());
      throw new IngestionFailedException(
          "Failed to parse PDF: " + e.getMessage(), "The document is corrupt or unreadable", e);
    }
  }
}
