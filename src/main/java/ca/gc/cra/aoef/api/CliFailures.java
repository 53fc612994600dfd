package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.error.AoefException;
import ca.gc.cra.aoef.error.MissingReferenceException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import org.slf4j.Logger;

/** Maps command failures to exit codes and logs them once. */
final class CliFailures {
  private CliFailures() {}

  static ExitCode handle(String command, Exception ex, Logger log) {
    if (ex instanceof ConfigCliUtils.ConfigFileException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (ex instanceof NoSuchFileException missing) {
      log.error("{}: file not found: {}", command, missing.getFile());
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof IOException) {
      log.error("{}: I/O failure", command, ex);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof MissingReferenceException missing) {
      log.error("{}: dangling {} reference {} in {}", command, missing.entity(), missing.missingId(),
          missing.referencedBy());
      return ExitCode.INVALID_DOCUMENT;
    }
    if (ex instanceof AoefException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.INVALID_DOCUMENT;
    }
    log.error("Unexpected failure in {}", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }
}
