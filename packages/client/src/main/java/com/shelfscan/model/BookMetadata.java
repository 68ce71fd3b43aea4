package com.shelfscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Book metadata produced by the recognition service for one detected spine. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BookMetadata(
    String title,
    String author,
    String isbn,
    String coverUrl,
    String publisher,
    String publishedDate,
    Integer pageCount,
    String format,
    Double confidence) {

  public static BookMetadata of(String title, String author) {
    return new BookMetadata(title, author, null, null, null, null, null, null, null);
  }
}
