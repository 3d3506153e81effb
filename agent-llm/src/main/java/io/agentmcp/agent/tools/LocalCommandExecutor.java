package io.agentmcp.agent.tools;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands with {@code bash -c} in a child process. Output is captured up to {@value
 * #MAX_OUTPUT_BYTES} bytes. On timeout the process gets SIGTERM, then SIGKILL after a grace period.
 */
public final class LocalCommandExecutor implements CommandExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(LocalCommandExecutor.class);

  static final int MAX_OUTPUT_BYTES = 64 * 1024;
  private static final Duration KILL_GRACE = Duration.ofSeconds(5);

  @Override
  public CommandResult exec(String command, Path cwd, Duration timeout)
      throws IOException, InterruptedException {
    Process process =
        new ProcessBuilder("bash", "-c", command)
            .directory(cwd.toFile())
            .redirectErrorStream(true)
            .start();
    process.getOutputStream().close();

    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    AtomicBoolean truncated = new AtomicBoolean();
    Thread reader =
        new Thread(
            () -> drain(process.getInputStream(), captured, truncated), "bash-tool-output");
    reader.setDaemon(true);
    reader.start();

    boolean timedOut = false;
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        timedOut = true;
        LOG.warn("Command timed out after {}: {}", timeout, command);
        process.destroy();
        if (!process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          process.destroyForcibly().waitFor();
        }
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
    reader.join(KILL_GRACE.toMillis());

    String output;
    synchronized (captured) {
      output = captured.toString(StandardCharsets.UTF_8);
    }
    int exitCode = timedOut ? -1 : process.exitValue();
    return new CommandResult(exitCode, output, timedOut, truncated.get());
  }

  private static void drain(InputStream in, ByteArrayOutputStream out, AtomicBoolean truncated) {
    byte[] buffer = new byte[8192];
    try (in) {
      int n;
      while ((n = in.read(buffer)) != -1) {
        synchronized (out) {
          int room = MAX_OUTPUT_BYTES - out.size();
          if (room > 0) {
            out.write(buffer, 0, Math.min(n, room));
          }
          if (n > room) {
            truncated.set(true);
          }
        }
      }
    } catch (IOException e) {
      // stream closes when the process is killed
      LOG.debug("Command output stream closed: {}", e.getMessage());
    }
  }
}
