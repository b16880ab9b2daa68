package com.example.s3verify.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One object, either created as a fixture or listed back in a {@code Contents} element.
 * Fixture ETags are unquoted; listed ones arrive quote-wrapped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectInfo implements Comparable<ObjectInfo> {
  @JacksonXmlProperty(localName = "Key")
  private String key;
  @JacksonXmlProperty(localName = "LastModified")
  private Instant lastModified;
  @JacksonXmlProperty(localName = "ETag")
  private String etag;
  @JacksonXmlProperty(localName = "Size")
  private long size;
  @JacksonXmlProperty(localName = "StorageClass")
  private String storageClass;

  @Override
  public int compareTo(ObjectInfo other) {
    return key.compareTo(other.key);
  }
}
