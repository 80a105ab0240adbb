package com.flamingo.ai.voicecompanion.service.ingestion;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes extracted page text into the form the chunker consumes.
 *
 * <p>Paragraph breaks survive as {@code \n\n}; page boundaries are joined with a form feed {@code
 * \f}. Words hyphenated across a line end are rejoined.
 */
@Component
public class TextNormalizer {

  /** Soft marker between pages. */
  public static final String PAGE_BREAK = "\f";

  private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");
  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\u00A0]+");
  private static final Pattern TRAILING_SPACES = Pattern.compile(" +\\n");
  private static final Pattern LEADING_SPACES = Pattern.compile("\\n +");
  private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-\\n(\\p{Ll})");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

  /** Normalizes each page and joins the non-blank ones with {@link #PAGE_BREAK}. */
  public String normalizePages(List<String> pages) {
    StringBuilder joined = new StringBuilder();
    for (String page : pages) {
      String normalized = normalize(page);
      if (normalized.isEmpty()) {
        continue;
      }
      if (joined.length() > 0) {
        joined.append(PAGE_BREAK);
      }
      joined.append(normalized);
    }
    return joined.toString();
  }

  /** Normalizes a single block of text. Never returns {@code null}. */
  public String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
    result = LINE_ENDINGS.matcher(result).replaceAll("\n");
    result = result.replace(PAGE_BREAK, "\n\n");
    result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
    result = TRAILING_SPACES.matcher(result).replaceAll("\n");
    result = LEADING_SPACES.matcher(result).replaceAll("\n");
    result = HYPHENATED_BREAK.matcher(result).replaceAll("$1$2");
    result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
    return result.strip();
  }
}
