package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.usml.exception.UsmlErrorCode;
import com.gentoro.usml.exception.UsmlException;
import com.gentoro.usml.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** JSON form of a {@link GraphModel}, for renderers running outside this process. */
public class GraphModelWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(GraphModelWriter.class);

  public String toJson(GraphModel model) {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(model);
    } catch (JsonProcessingException e) {
      throw new UsmlException(
          UsmlErrorCode.IO_ERROR, "Failed to serialise graph of usecase " + model.usecase(), e);
    }
  }

  /** Write the JSON to {@code target}, creating missing parent directories. */
  public Path write(GraphModel model, Path target) {
    String json = toJson(model);
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(target, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UsmlException(UsmlErrorCode.IO_ERROR, "Failed to write graph model to " + target, e)
          .withContext("file", target.toString());
    }
    log.debug("Wrote graph model of '{}' to {}", model.usecase(), target);
    return target;
  }
}
