/*
 * Copyright 2025 The Bartiq Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.bartiq.util;

import org.jspecify.annotations.Nullable;

/**
 * A static-only class for measuring how alike two strings are, used to suggest a likely intended
 * name when an unknown one is used.
 */
public class Similarity {
  /** Candidates less similar than this are not suggested. */
  public static final double DEFAULT_CUTOFF = 0.6;

  /**
   * Returns a measure of the similarity of two strings between 0 (nothing in common) and 1
   * (equal): twice the number of matching characters divided by the total number of characters.
   *
   * <p>Matching characters are found by taking the longest common substring, and then recursively
   * doing the same to the pieces to its left and to its right.
   */
  public static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1;
    }
    return 2.0 * matches(a, 0, a.length(), b, 0, b.length()) / total;
  }

  private static int matches(String a, int aStart, int aEnd, String b, int bStart, int bEnd) {
    // Find the longest common substring, preferring the earliest in a and then in b.
    int bestLength = 0;
    int bestA = aStart;
    int bestB = bStart;
    for (int i = aStart; i < aEnd; i++) {
      for (int j = bStart; j < bEnd; j++) {
        int k = 0;
        while (i + k < aEnd && j + k < bEnd && a.charAt(i + k) == b.charAt(j + k)) {
          k++;
        }
        if (k > bestLength) {
          bestLength = k;
          bestA = i;
          bestB = j;
        }
      }
    }
    if (bestLength == 0) {
      return 0;
    }
    return bestLength
        + matches(a, aStart, bestA, b, bStart, bestB)
        + matches(a, bestA + bestLength, aEnd, b, bestB + bestLength, bEnd);
  }

  /**
   * Returns the element of {@code candidates} most similar to {@code name}, or null if none has a
   * {@link #ratio} of at least {@code cutoff}. Ties go to the earliest candidate.
   */
  public static @Nullable String closestMatch(
      String name, Iterable<String> candidates, double cutoff) {
    String best = null;
    double bestRatio = cutoff;
    for (String candidate : candidates) {
      double r = ratio(name, candidate);
      if (r > bestRatio || (best == null && r == bestRatio)) {
        best = candidate;
        bestRatio = r;
      }
    }
    return best;
  }

  private Similarity() {}
}
