package com.flamingo.ai.voicecompanion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Voice companion backend: live document knowledge store and two-source transcript. */
@SpringBootApplication
@EnableScheduling
public class VoiceCompanionApplication {

  public static void main(String[] args) {
    SpringApplication.run(VoiceCompanionApplication.class, args);
  }
}
