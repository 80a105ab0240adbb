package com.flamingo.ai.voicecompanion.exception;

/** Exception thrown when an uploaded document is not a supported media type. */
public class UnsupportedFormatException extends RuntimeException {

  private final String mediaType;

  public UnsupportedFormatException(String mediaType, String fileName) {
    super(String.format("Unsupported document format: type=%s, file=%s", mediaType, fileName));
    this.mediaType = mediaType;
  }

  public String getMediaType() {
    return mediaType;
  }

  public String getUserMessage() {
    return "Only PDF documents are supported";
  }
}
