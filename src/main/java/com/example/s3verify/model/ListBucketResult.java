package com.example.s3verify.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a ListObjects (V1) response. A {@code maxKeys} of 0 on an expected result means no limit was requested.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JacksonXmlRootElement(localName = "ListBucketResult")
public class ListBucketResult {
  @JacksonXmlProperty(localName = "Name")
  private String name;
  @JacksonXmlProperty(localName = "Prefix")
  private String prefix;
  @JacksonXmlProperty(localName = "Marker")
  private String marker;
  @JacksonXmlProperty(localName = "NextMarker")
  private String nextMarker;
  @JacksonXmlProperty(localName = "MaxKeys")
  private long maxKeys;
  @JacksonXmlProperty(localName = "Delimiter")
  private String delimiter;
  @JacksonXmlProperty(localName = "IsTruncated")
  private boolean truncated;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Contents")
  private List<ObjectInfo> contents;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "CommonPrefixes")
  private List<CommonPrefix> commonPrefixes;

  public List<ObjectInfo> getContents() {
    return contents == null ? new ArrayList<>() : contents;
  }

  public List<CommonPrefix> getCommonPrefixes() {
    return commonPrefixes == null ? new ArrayList<>() : commonPrefixes;
  }

  /**
   * Entries that count against max-keys: objects plus rolled-up prefixes.
   */
  public int entryCount() {
    return getContents().size() + getCommonPrefixes().size();
  }
}
