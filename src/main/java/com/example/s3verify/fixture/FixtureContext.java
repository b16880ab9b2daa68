package com.example.s3verify.fixture;

import com.example.s3verify.model.ObjectInfo;
import com.example.s3verify.model.ObjectMultipartInfo;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State created before the list tests run, passed explicitly to every test. Only read by the tests.
 */
@Value
@Builder(toBuilder = true)
public class FixtureContext {
  String bucketName;
  @Singular
  List<ObjectInfo> objects;
  @Singular
  List<ObjectMultipartInfo> uploads;

  /**
   * Objects ordered by key, the order a listing returns them in.
   */
  public List<ObjectInfo> sortedObjects() {
    List<ObjectInfo> sorted = new ArrayList<>(objects);
    Collections.sort(sorted);
    return sorted;
  }
}
