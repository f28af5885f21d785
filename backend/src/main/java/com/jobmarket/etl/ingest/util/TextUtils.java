package com.jobmarket.etl.ingest.util;

import org.jsoup.Jsoup;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextUtils() {}

  public static String normalizeText(String value) {
    if (value == null) {
      return null;
    }
    String collapsed = WHITESPACE.matcher(value).replaceAll(" ").trim();
    return collapsed.isEmpty() ? null : collapsed;
  }

  /** Visible text of a description that may carry HTML markup. */
  public static String plainText(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    if (value.indexOf('<') < 0) {
      return value.trim();
    }
    return normalizeText(Jsoup.parse(value).text());
  }

  public static boolean isSecureUrl(String url) {
    if (url == null) {
      return false;
    }
    return url.trim().toLowerCase(Locale.ROOT).startsWith("https://");
  }
}
