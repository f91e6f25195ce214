package com.scholary.voicenote.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is redirected to a temporary file rather than read from the pipe, so a tool that hangs
 * without closing its streams cannot block us past the timeout.
 */
@Component
public class DefaultProcessRunner implements ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessRunner.class);

  @Override
  public ProcessResult run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path outputFile = Files.createTempFile("voicenote-proc-", ".log");
    try {
      Process process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(outputFile.toFile())
              .start();

      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while waiting for " + command.get(0), e);
      }

      if (!finished) {
        process.destroyForcibly();
        LOGGER.warn("{} did not finish within {}ms, killed", command.get(0), timeout.toMillis());
        return ProcessResult.timeout(readOutput(outputFile));
      }

      return ProcessResult.completed(process.exitValue(), readOutput(outputFile));

    } finally {
      try {
        Files.deleteIfExists(outputFile);
      } catch (IOException e) {
        LOGGER.warn("Could not remove process output file {}", outputFile, e);
      }
    }
  }

  private String readOutput(Path outputFile) throws IOException {
    return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8).trim();
  }
}
