package com.example.s3verify.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * S3 {@code <Error>} document, decoded only to explain failed fixture calls.
 */
@Data
@NoArgsConstructor
@JacksonXmlRootElement(localName = "Error")
public class ErrorResponse {
  @JacksonXmlProperty(localName = "Code")
  private String code;
  @JacksonXmlProperty(localName = "Message")
  private String message;
  @JacksonXmlProperty(localName = "Resource")
  private String resource;
  @JacksonXmlProperty(localName = "RequestId")
  private String requestId;
}
