package com.scholary.spatialaudio.separation;

import com.scholary.spatialaudio.stage.MalformedResponseException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads stems out of a separation archive.
 *
 * <p>Members are matched by base name without extension, so {@code htdemucs/song/vocals.wav}
 * matches the stem {@code vocals}. Directory entries are skipped.
 */
public final class StemExtractor {

  private StemExtractor() {}

  /**
   * Extract one stem.
   *
   * @param archive the ZIP archive
   * @param stem stem name, e.g. {@code vocals}
   * @return the member's bytes
   * @throws MalformedResponseException if the archive is unreadable or has no such member
   */
  public static byte[] extract(byte[] archive, String stem) {
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory() && stem.equalsIgnoreCase(stemName(entry.getName()))) {
          return zip.readAllBytes();
        }
      }
    } catch (IOException e) {
      throw new MalformedResponseException("Separation archive is not a valid ZIP", e);
    }
    throw new MalformedResponseException("Separation archive has no member for stem: " + stem);
  }

  /**
   * List the stems in an archive.
   *
   * @throws MalformedResponseException if the archive is unreadable
   */
  public static List<String> stemNames(byte[] archive) {
    List<String> names = new ArrayList<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory()) {
          names.add(stemName(entry.getName()));
        }
      }
    } catch (IOException e) {
      throw new MalformedResponseException("Separation archive is not a valid ZIP", e);
    }
    return names;
  }

  static String stemName(String memberName) {
    String base = memberName.substring(memberName.lastIndexOf('/') + 1);
    int dot = base.lastIndexOf('.');
    return (dot > 0 ? base.substring(0, dot) : base).toLowerCase(Locale.ROOT);
  }
}
