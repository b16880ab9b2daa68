package com.example.s3verify.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An in-flight multipart upload. {@code size} is only known on the fixture side,
 * the {@code Upload} element of a listing does not carry it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ObjectMultipartInfo {
  @JacksonXmlProperty(localName = "Key")
  private String key;
  @JacksonXmlProperty(localName = "UploadId")
  private String uploadId;
  @JacksonXmlProperty(localName = "Size")
  private long size;
  @JacksonXmlProperty(localName = "StorageClass")
  private String storageClass;
  @JacksonXmlProperty(localName = "Initiated")
  private Instant initiated;
}
