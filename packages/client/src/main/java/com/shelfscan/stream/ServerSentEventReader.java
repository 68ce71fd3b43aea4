package com.shelfscan.stream;

import java.io.IOException;
import okio.BufferedSource;

/**
 * Splits a {@code text/event-stream} body into records. Handles {@code event:}, multi-line {@code
 * data:}, {@code id:} and comment lines; a blank line dispatches the pending record.
 */
final class ServerSentEventReader {

  /** One dispatched record. {@code event} is null when the record carried no event name. */
  record RawEvent(String event, String data, String id) {}

  private final BufferedSource source;

  ServerSentEventReader(BufferedSource source) {
    this.source = source;
  }

  /**
   * Read the next complete record.
   *
   * @return the record, or null when the body ended before another record was dispatched
   */
  RawEvent next() throws IOException {
    String event = null;
    String id = null;
    StringBuilder data = null;
    while (true) {
      String line = source.readUtf8Line();
      if (line == null) {
        return null;
      }
      if (line.isEmpty()) {
        if (event == null && data == null) {
          continue;
        }
        return new RawEvent(event, data == null ? "" : data.toString(), id);
      }
      if (line.startsWith(":")) {
        continue;
      }
      int colon = line.indexOf(':');
      String field = colon < 0 ? line : line.substring(0, colon);
      String value = colon < 0 ? "" : line.substring(colon + 1);
      if (value.startsWith(" ")) {
        value = value.substring(1);
      }
      switch (field) {
        case "event" -> event = value.trim();
        case "data" -> {
          if (data == null) {
            data = new StringBuilder(value);
          } else {
            data.append('\n').append(value);
          }
        }
        case "id" -> id = value;
        default -> {
          // retry: and unknown fields are not used by this client
        }
      }
    }
  }
}
