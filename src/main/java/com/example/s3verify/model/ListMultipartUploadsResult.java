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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JacksonXmlRootElement(localName = "ListMultipartUploadsResult")
public class ListMultipartUploadsResult {
  @JacksonXmlProperty(localName = "Bucket")
  private String bucket;
  @JacksonXmlProperty(localName = "KeyMarker")
  private String keyMarker;
  @JacksonXmlProperty(localName = "UploadIdMarker")
  private String uploadIdMarker;
  @JacksonXmlProperty(localName = "NextKeyMarker")
  private String nextKeyMarker;
  @JacksonXmlProperty(localName = "NextUploadIdMarker")
  private String nextUploadIdMarker;
  @JacksonXmlProperty(localName = "Prefix")
  private String prefix;
  @JacksonXmlProperty(localName = "Delimiter")
  private String delimiter;
  @JacksonXmlProperty(localName = "MaxUploads")
  private int maxUploads;
  @JacksonXmlProperty(localName = "IsTruncated")
  private boolean truncated;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Upload")
  private List<ObjectMultipartInfo> uploads;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "CommonPrefixes")
  private List<CommonPrefix> commonPrefixes;

  public List<ObjectMultipartInfo> getUploads() {
    return uploads == null ? new ArrayList<>() : uploads;
  }

  public List<CommonPrefix> getCommonPrefixes() {
    return commonPrefixes == null ? new ArrayList<>() : commonPrefixes;
  }
}
