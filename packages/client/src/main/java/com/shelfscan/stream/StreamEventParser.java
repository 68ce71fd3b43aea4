package com.shelfscan.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfscan.exception.MalformedEventException;
import com.shelfscan.model.BookMetadata;
import com.shelfscan.model.StreamEvent;
import com.shelfscan.utility.JacksonUtility;
import java.util.Base64;
import java.util.List;

/**
 * Stateless translation of a named server-sent event and its JSON data into a {@link StreamEvent}.
 * Unknown event names map to {@link StreamEvent.Unknown}; payloads missing required fields raise
 * {@link MalformedEventException}.
 */
public class StreamEventParser {
  private static final TypeReference<List<BookMetadata>> BOOK_LIST = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public StreamEventParser() {
    this(JacksonUtility.getJsonMapper());
  }

  public StreamEventParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public StreamEvent parse(String event, String data) {
    String name = event == null || event.isBlank() ? "message" : event.trim();
    return switch (name) {
      case "progress" -> new StreamEvent.Progress(requiredText(name, json(name, data), "message"));
      case "result" -> new StreamEvent.BookResult(book(name, data));
      case "complete", "completed" -> completed(name, data);
      case "error" -> failed(data);
      case "canceled", "cancelled" -> new StreamEvent.Canceled();
      case "segmented" -> segmented(name, data);
      case "book_progress" -> bookProgress(name, data);
      case "enrichment_degraded" -> degraded(name, data);
      case "ping" -> new StreamEvent.Ping();
      default -> new StreamEvent.Unknown(name);
    };
  }

  private StreamEvent completed(String name, String data) {
    if (data == null || data.isBlank()) {
      return new StreamEvent.Completed(null, null);
    }
    JsonNode root;
    try {
      root = mapper.readTree(data);
    } catch (JsonProcessingException e) {
      // a completion with an unreadable body is still a completion
      return new StreamEvent.Completed(null, null);
    }
    String resultsUrl = optionalText(root, "resultsUrl");
    List<BookMetadata> books = null;
    JsonNode booksNode = root.get("books");
    if (booksNode != null && booksNode.isArray()) {
      try {
        books = mapper.convertValue(booksNode, BOOK_LIST);
      } catch (IllegalArgumentException e) {
        throw new MalformedEventException(name, "books array could not be decoded", e);
      }
    }
    return new StreamEvent.Completed(resultsUrl, books);
  }

  private StreamEvent failed(String data) {
    JsonNode root = null;
    if (data != null && !data.isBlank()) {
      try {
        root = mapper.readTree(data);
      } catch (JsonProcessingException e) {
        root = null;
      }
    }
    if (root == null || !root.isObject()) {
      return new StreamEvent.Failed("Unknown error", null, false);
    }
    String message = optionalText(root, "message");
    JsonNode retryable = root.get("retryable");
    return new StreamEvent.Failed(
        message == null ? "Unknown error" : message,
        optionalText(root, "code"),
        retryable != null && retryable.asBoolean(false));
  }

  private StreamEvent segmented(String name, String data) {
    JsonNode root = json(name, data);
    String image = requiredText(name, root, "image");
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(image);
    } catch (IllegalArgumentException e) {
      throw new MalformedEventException(name, "image is not valid base64", e);
    }
    return new StreamEvent.SegmentedPreview(bytes, requiredInt(name, root, "totalBooks"));
  }

  private StreamEvent bookProgress(String name, String data) {
    JsonNode root = json(name, data);
    return new StreamEvent.BookProgress(
        requiredInt(name, root, "current"),
        requiredInt(name, root, "total"),
        optionalText(root, "stage"));
  }

  private StreamEvent degraded(String name, String data) {
    JsonNode root = json(name, data);
    return new StreamEvent.EnrichmentDegraded(
        optionalText(root, "reason"),
        optionalText(root, "isbn"),
        optionalText(root, "title"),
        optionalText(root, "fallbackSource"));
  }

  private BookMetadata book(String name, String data) {
    JsonNode root = json(name, data);
    BookMetadata metadata;
    try {
      metadata = mapper.treeToValue(root, BookMetadata.class);
    } catch (JsonProcessingException e) {
      throw new MalformedEventException(name, e.getOriginalMessage(), e);
    }
    if (metadata.title() == null) {
      throw new MalformedEventException(name, "missing 'title'");
    }
    return metadata;
  }

  private JsonNode json(String name, String data) {
    if (data == null || data.isBlank()) {
      throw new MalformedEventException(name, "empty data");
    }
    try {
      JsonNode node = mapper.readTree(data);
      if (node == null || !node.isObject()) {
        throw new MalformedEventException(name, "data is not a JSON object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new MalformedEventException(name, e.getOriginalMessage(), e);
    }
  }

  private static String requiredText(String name, JsonNode root, String field) {
    String value = optionalText(root, field);
    if (value == null) {
      throw new MalformedEventException(name, "missing '" + field + "'");
    }
    return value;
  }

  private static int requiredInt(String name, JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.canConvertToInt()) {
      throw new MalformedEventException(name, "missing integer '" + field + "'");
    }
    return node.asInt();
  }

  private static String optionalText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }
}
