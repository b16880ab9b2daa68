package com.example.s3verify.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Shared Jackson mapper for S3 XML documents. Unknown elements are ignored so servers may add fields.
 */
public class XmlCodec {
  private static final XmlMapper xmlMapper = createMapper();

  private XmlCodec() {
  }

  private static XmlMapper createMapper() {
    XmlMapper mapper = new XmlMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    mapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
    return mapper;
  }

  public static <T> T decode(byte[] body, Class<T> type) throws IOException {
    return xmlMapper.readValue(body, type);
  }

  public static String encode(Object value) throws JsonProcessingException {
    return xmlMapper.writeValueAsString(value);
  }
}
