package io.b2mash.imagehost.image;

import io.b2mash.imagehost.exception.InvalidStateException;
import java.util.Locale;

/** Normalization and derivation of image codes. Pure functions, no database access. */
public final class ImageCodes {

  public static final int MAX_LENGTH = 200;

  /** Derived codes are cut here so that a numbered suffix still fits. */
  static final int DERIVED_BASE_LENGTH = 180;

  private ImageCodes() {}

  /**
   * Lower-cases the input, turns whitespace runs into underscores, removes anything outside
   * {@code [a-z0-9_]}, collapses repeated underscores and strips them from both ends.
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    return raw.trim()
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\s+", "_")
        .replaceAll("[^a-z0-9_]", "")
        .replaceAll("_+", "_")
        .replaceAll("^_|_$", "");
  }

  /** Normalizes a code supplied by a caller and rejects it when nothing usable is left. */
  public static String requireValid(String raw) {
    String code = normalize(raw);
    if (code.isEmpty()) {
      throw new InvalidStateException(
          "Invalid image code", "Image code must contain at least one letter, digit or '_'");
    }
    if (code.length() > MAX_LENGTH) {
      throw new InvalidStateException(
          "Invalid image code", "Image code must be at most " + MAX_LENGTH + " characters");
    }
    return code;
  }

  /**
   * Derives a base code from the file name without its extension, else the last path segment of
   * the URL, else the image name. Falls back to {@code "image"} when none of them yields a code.
   */
  public static String derive(String filePath, String url, String name) {
    String code = normalize(stripExtension(lastSegment(filePath)));
    if (code.isEmpty()) {
      code = normalize(stripExtension(lastSegment(stripQuery(url))));
    }
    if (code.isEmpty()) {
      code = normalize(name);
    }
    if (code.isEmpty()) {
      code = "image";
    }
    if (code.length() > DERIVED_BASE_LENGTH) {
      code = normalize(code.substring(0, DERIVED_BASE_LENGTH));
    }
    return code;
  }

  public static String withSuffix(String base, int suffix) {
    return base + "_" + suffix;
  }

  private static String lastSegment(String path) {
    if (path == null) {
      return null;
    }
    String trimmed = path.trim();
    while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
    return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
  }

  private static String stripQuery(String url) {
    if (url == null) {
      return null;
    }
    int end = url.length();
    int query = url.indexOf('?');
    if (query >= 0) {
      end = query;
    }
    int fragment = url.indexOf('#');
    if (fragment >= 0 && fragment < end) {
      end = fragment;
    }
    return url.substring(0, end);
  }

  private static String stripExtension(String fileName) {
    if (fileName == null) {
      return null;
    }
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
