package com.example.s3verify.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "CreateBucketConfiguration")
public class CreateBucketConfiguration {
  @JacksonXmlProperty(localName = "LocationConstraint")
  private String locationConstraint;
}
