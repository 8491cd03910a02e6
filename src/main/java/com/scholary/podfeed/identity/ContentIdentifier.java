package com.scholary.podfeed.identity;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Derives entry ids.
 *
 * <p>An entry id is the first {@value #TOKEN_LENGTH} hex characters of a SHA-256 digest:
 *
 * <ul>
 *   <li>remote sources: digest of the canonical source id, so every locator shape for the same
 *       resource yields the same id;
 *   <li>uploads: digest of the uploaded bytes, so byte-identical uploads collide regardless of file
 *       name.
 * </ul>
 *
 * <p>The id doubles as the artifact's base file name.
 */
@Component
public class ContentIdentifier {

  public static final int TOKEN_LENGTH = 16;

  private static final String REMOTE_PREFIX = "remote:";

  public String forRemote(String canonicalId) {
    MessageDigest digest = sha256();
    digest.update((REMOTE_PREFIX + canonicalId).getBytes(StandardCharsets.UTF_8));
    return token(digest);
  }

  /**
   * Digest a file's content.
   *
   * @throws UncheckedIOException if the file cannot be read
   */
  public String forUpload(Path file) {
    MessageDigest digest = sha256();
    byte[] buffer = new byte[64 * 1024];
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to hash " + file.getFileName(), e);
    }
    return token(digest);
  }

  private static String token(MessageDigest digest) {
    return HexFormat.of().formatHex(digest.digest()).substring(0, TOKEN_LENGTH);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is unavailable", e);
    }
  }
}
