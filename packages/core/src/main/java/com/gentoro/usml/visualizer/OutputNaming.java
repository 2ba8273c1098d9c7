package com.gentoro.usml.visualizer;

import com.gentoro.usml.ast.UsmlDocument;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;

/**
 * Chooses where a rendered graph goes: an explicit override wins, then the document's {@code
 * output} name inside the output directory, then {@code <usecase>.html} there.
 */
public final class OutputNaming {
  private OutputNaming() {}

  public static Path resolve(Path override, UsmlDocument document, Path outputDirectory) {
    if (override != null) {
      return override;
    }
    if (StringUtils.isNotBlank(document.outputName())) {
      return outputDirectory.resolve(document.outputName());
    }
    return outputDirectory.resolve(sanitize(document.usecaseName()) + ".html");
  }

  /** Replace everything but letters, digits, {@code -} and {@code _} with {@code -}. */
  public static String sanitize(String name) {
    if (StringUtils.isBlank(name)) {
      return "usecase";
    }
    StringBuilder sb = new StringBuilder(name.length());
    for (char c : name.toCharArray()) {
      sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '-');
    }
    return sb.toString();
  }
}
