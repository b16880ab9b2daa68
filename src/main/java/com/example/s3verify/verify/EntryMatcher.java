package com.example.s3verify.verify;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Order-independent pairing of expected and received list entries.
 */
public class EntryMatcher {
  private EntryMatcher() {
  }

  /**
   * Counts expected entries that find a matching received entry. A received entry is consumed by its
   * first match, so duplicates on one side never inflate the count.
   */
  public static <E> int countMatches(List<E> expected, List<E> received, BiPredicate<E, E> matches) {
    List<E> remaining = new ArrayList<>(received);
    int matched = 0;
    for (E expectedEntry : expected) {
      Iterator<E> it = remaining.iterator();
      while (it.hasNext()) {
        if (matches.test(expectedEntry, it.next())) {
          it.remove();
          matched++;
          break;
        }
      }
    }
    return matched;
  }
}
