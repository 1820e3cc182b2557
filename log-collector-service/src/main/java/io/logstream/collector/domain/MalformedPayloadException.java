package io.logstream.collector.domain;

/**
 * Raised when an ingest payload is neither a log entry object nor an array of them.
 */
public class MalformedPayloadException extends RuntimeException {

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
