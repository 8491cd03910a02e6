package com.scholary.podfeed.source;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Normalizes locator strings into canonical source ids.
 *
 * <p>Recognised shapes, all reducing to the same id when they point at the same resource:
 *
 * <ul>
 *   <li>{@code https://host/watch?v=ID} (any extra query parameters are ignored)
 *   <li>{@code https://short-host/ID}
 *   <li>{@code https://host/live/ID}, {@code /shorts/ID}, {@code /embed/ID}, {@code /v/ID}
 * </ul>
 *
 * <p>Pure: no I/O, no state beyond the configured host lists.
 */
@Component
public class SourceResolver {

  private static final List<String> PATH_PREFIXES = List.of("/live/", "/shorts/", "/embed/", "/v/");

  private final Set<String> hosts;
  private final Set<String> shortHosts;
  private final Pattern idPattern;
  private final String canonicalUrlTemplate;

  public SourceResolver(SourceProperties properties) {
    this.hosts = lowerCase(properties.hosts());
    this.shortHosts = lowerCase(properties.shortHosts());
    this.idPattern = Pattern.compile(properties.idPattern());
    this.canonicalUrlTemplate = properties.canonicalUrlTemplate();
  }

  /**
   * Resolve a locator to its canonical source id.
   *
   * @param input arbitrary caller-supplied string
   * @return the canonical id
   * @throws InvalidSourceException if the string is not a recognised locator
   */
  public String resolve(String input) {
    if (input == null || input.isBlank()) {
      throw new InvalidSourceException("Source URL is required");
    }
    String trimmed = input.trim();
    if (!trimmed.contains("://")) {
      trimmed = "https://" + trimmed;
    }

    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      throw new InvalidSourceException("Malformed source URL: " + input);
    }

    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new InvalidSourceException("Unsupported URL scheme: " + uri.getScheme());
    }

    String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();

    String id;
    if (shortHosts.contains(host)) {
      id = firstSegment(path.startsWith("/") ? path.substring(1) : path);
    } else if (hosts.contains(host)) {
      id = idFromPath(path, uri.getRawQuery());
    } else {
      throw new InvalidSourceException("Unsupported host: " + host);
    }

    if (id == null || id.isEmpty()) {
      throw new InvalidSourceException("Could not extract a source id from: " + input);
    }
    if (!idPattern.matcher(id).matches()) {
      throw new InvalidSourceException("Invalid source id format: " + id);
    }
    return id;
  }

  /** Build the canonical locator for an id, as handed to the extraction tool. */
  public String canonicalLocator(String canonicalId) {
    return String.format(canonicalUrlTemplate, canonicalId);
  }

  private String idFromPath(String path, String rawQuery) {
    if (path.equals("/watch") || path.startsWith("/watch/")) {
      return queryParameter(rawQuery, "v");
    }
    for (String prefix : PATH_PREFIXES) {
      if (path.startsWith(prefix)) {
        return firstSegment(path.substring(prefix.length()));
      }
    }
    return null;
  }

  private static String queryParameter(String rawQuery, String name) {
    if (rawQuery == null) {
      return null;
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).equals(name)) {
        return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  private static String firstSegment(String path) {
    int slash = path.indexOf('/');
    return slash >= 0 ? path.substring(0, slash) : path;
  }

  private static Set<String> lowerCase(List<String> values) {
    return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }
}
