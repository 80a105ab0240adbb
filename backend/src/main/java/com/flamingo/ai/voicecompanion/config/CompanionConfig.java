package com.flamingo.ai.voicecompanion.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, knowledge store, retrieval and transcript. */
@Configuration
@ConfigurationProperties(prefix = "companion")
@Getter
@Setter
public class CompanionConfig {

  private Storage storage = new Storage();
  private Ingestion ingestion = new Ingestion();
  private Chunking chunking = new Chunking();
  private Knowledge knowledge = new Knowledge();
  private Retrieval retrieval = new Retrieval();
  private Transcript transcript = new Transcript();

  @Getter
  @Setter
  public static class Storage {
    /** Root directory; raw uploads and the vector store snapshot live beneath it. */
    private String basePath = "data";
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Maximum accepted upload size in bytes. */
    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Window size W in characters. */
    private int size = 1000;

    /** Overlap O in characters; must be smaller than {@code size}. */
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Knowledge {
    /** Milliseconds between freshness checks of the persisted store. */
    private long pollIntervalMs = 5000;

    /** Whether the scheduled freshness poller runs at all. */
    private boolean pollingEnabled = true;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private boolean enabled = true;
    private int topK = 3;

    /** Upper bound for the injected side-context block. */
    private int maxContextChars = 2000;

    /** Utterances of at most this many characters never trigger retrieval. */
    private int minUtteranceLength = 10;

    private String contextHeader = "Reference notes (from uploaded documents):";

    /**
     * Topical vocabulary for the keyword gate. Treated as configuration; any term may be replaced
     * without touching the injector.
     */
    private List<String> vocabulary = new ArrayList<>(defaultVocabulary());

    /** Sources whose finalized utterances may trigger retrieval. */
    private List<String> triggerSources = new ArrayList<>(List.of("LOCAL"));

    private static List<String> defaultVocabulary() {
      return List.of(
          "cook", "cooking", "recipe", "recipes", "ingredient", "ingredients", "salt", "fat",
          "acid", "heat", "temperature", "bake", "boil", "fry", "roast", "season", "technique",
          "flavor", "texture", "prepare", "dish", "meal", "food", "taste", "spice", "herb",
          "sauce", "vegetable", "meat", "fish", "pasta", "rice", "bread", "knife", "cut", "chop",
          "blend", "mix", "stir");
    }
  }

  @Getter
  @Setter
  public static class Transcript {
    private String localLabel = "You";
    private String remoteLabel = "Agent";
  }
}
