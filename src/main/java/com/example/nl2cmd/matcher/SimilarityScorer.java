package com.example.nl2cmd.matcher;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-weighted string similarity on a 0-100 scale.
 *
 * <p>The weighted ratio combines an indel (insertion/deletion) ratio, token-sort and token-set
 * ratios for strings of similar length and scaled partial ratios when one string is much longer
 * than the other. Typos that transpose, insert or delete characters keep a high score.
 */
public final class SimilarityScorer {

  private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{Alnum}]+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final double UNBASE_SCALE = 0.95;

  private SimilarityScorer() {}

  public static int weightedRatio(String left, String right) {
    String a = preprocess(left);
    String b = preprocess(right);
    if (a.isEmpty() || b.isEmpty()) {
      return 0;
    }

    double lenRatio = (double) Math.max(a.length(), b.length()) / Math.min(a.length(), b.length());
    double best = ratio(a, b);

    if (lenRatio < 1.5) {
      best = Math.max(best, tokenSortRatio(a, b) * UNBASE_SCALE);
      best = Math.max(best, tokenSetRatio(a, b) * UNBASE_SCALE);
      return (int) Math.round(best);
    }

    double partialScale = lenRatio < 8 ? 0.9 : 0.6;
    best = Math.max(best, partialRatio(a, b) * partialScale);
    best = Math.max(best, partialRatio(sortTokens(a), sortTokens(b)) * UNBASE_SCALE * partialScale);
    return (int) Math.round(best);
  }

  /** Indel similarity: {@code 200 * lcs / (|a| + |b|)}. */
  static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 100.0;
    }
    return 200.0 * lcsLength(a, b) / total;
  }

  /** Best ratio of the shorter string against every equally long window of the longer one. */
  static double partialRatio(String a, String b) {
    String shorter = a.length() <= b.length() ? a : b;
    String longer = a.length() <= b.length() ? b : a;
    if (shorter.isEmpty()) {
      return 0.0;
    }
    double best = 0.0;
    for (int i = 0; i + shorter.length() <= longer.length(); i++) {
      best = Math.max(best, ratio(shorter, longer.substring(i, i + shorter.length())));
      if (best >= 100.0) {
        break;
      }
    }
    return best;
  }

  static double tokenSortRatio(String a, String b) {
    return ratio(sortTokens(a), sortTokens(b));
  }

  static double tokenSetRatio(String a, String b) {
    Set<String> ta = new TreeSet<>(Arrays.asList(a.split(" ")));
    Set<String> tb = new TreeSet<>(Arrays.asList(b.split(" ")));

    Set<String> common = new TreeSet<>(ta);
    common.retainAll(tb);
    Set<String> onlyA = new TreeSet<>(ta);
    onlyA.removeAll(tb);
    Set<String> onlyB = new TreeSet<>(tb);
    onlyB.removeAll(ta);

    String intersection = String.join(" ", common);
    String combinedA = (intersection + " " + String.join(" ", onlyA)).trim();
    String combinedB = (intersection + " " + String.join(" ", onlyB)).trim();

    double best = ratio(combinedA, combinedB);
    if (!intersection.isEmpty()) {
      best = Math.max(best, ratio(intersection, combinedA));
      best = Math.max(best, ratio(intersection, combinedB));
    }
    return best;
  }

  static String preprocess(String s) {
    if (s == null) {
      return "";
    }
    return NON_ALNUM.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  private static String sortTokens(String s) {
    String[] tokens = s.split(" ");
    Arrays.sort(tokens);
    return String.join(" ", tokens);
  }

  private static int lcsLength(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] curr = new int[b.length() + 1];
    for (int i = 1; i <= a.length(); i++) {
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        if (ca == b.charAt(j - 1)) {
          curr[j] = prev[j - 1] + 1;
        } else {
          curr[j] = Math.max(prev[j], curr[j - 1]);
        }
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[b.length()];
  }
}
