package com.flamingo.ai.voicecompanion.service.retrieval;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Triggers when the utterance contains a vocabulary term as a whole word, ignoring case. Letters
 * and digits of any script count as word characters, so "cooking" does not match "cook" and
 * "über" is matched case-insensitively.
 */
@Component
@Slf4j
public class KeywordRetrievalGate implements RetrievalGate {

  private final Pattern pattern;
  private final int minUtteranceLength;

  @Autowired
  public KeywordRetrievalGate(CompanionConfig config) {
    this(
        config.getRetrieval().getVocabulary(), config.getRetrieval().getMinUtteranceLength());
  }

  public KeywordRetrievalGate(Collection<String> vocabulary, int minUtteranceLength) {
    this.pattern = compile(vocabulary);
    this.minUtteranceLength = minUtteranceLength;
    log.debug("Keyword gate with {} terms, min length {}", vocabulary.size(), minUtteranceLength);
  }

  @Override
  public boolean shouldRetrieve(String utteranceText) {
    if (pattern == null || utteranceText == null) {
      return false;
    }
    String text = utteranceText.strip();
    if (text.length() <= minUtteranceLength) {
      return false;
    }
    return pattern.matcher(text).find();
  }

  private static Pattern compile(Collection<String> vocabulary) {
    List<String> terms =
        vocabulary.stream()
            .filter(term -> term != null && !term.isBlank())
            .map(String::strip)
            .distinct()
            .map(Pattern::quote)
            .collect(Collectors.toList());
    if (terms.isEmpty()) {
      return null;
    }
    String alternation = String.join("|", terms);
    return Pattern.compile(
        "(?<![\\p{L}\\p{N}_])(?:" + alternation + ")(?![\\p{L}\\p{N}_])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
