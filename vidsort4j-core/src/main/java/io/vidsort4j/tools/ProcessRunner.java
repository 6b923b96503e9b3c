package io.vidsort4j.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs external command-line tools with a wall-clock limit.
 *
 * <p>stdout and stderr go to temporary files so a chatty tool cannot block on a full pipe.
 */
public class ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public record Result(int exitCode, String stdout, String stderr) {
        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * @throws ToolException when the tool cannot be started or exceeds {@code timeout}
     */
    public Result run(List<String> command, Duration timeout) throws IOException {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        String tool = command.get(0);

        Path out = Files.createTempFile("vidsort-", ".out");
        Path err = Files.createTempFile("vidsort-", ".err");
        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectOutput(out.toFile())
                        .redirectError(err.toFile())
                        .start();
            } catch (IOException e) {
                throw new ToolException(tool, -1, "cannot start: " + e.getMessage(), false, e);
            }
            log.debug("tool started command={}", command);

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                InterruptedIOException ie = new InterruptedIOException("interrupted while waiting for " + tool);
                ie.initCause(e);
                throw ie;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new ToolException(tool, -1, "timed out after " + timeout, true, null);
            }

            Result result = new Result(process.exitValue(), read(out), read(err));
            log.debug("tool finished tool={} exitCode={}", tool, result.exitCode());
            return result;
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(err);
        }
    }

    /**
     * Like {@link #run} but a non-zero exit code is a {@link ToolException} carrying stderr.
     */
    public Result runChecked(List<String> command, Duration timeout) throws IOException {
        Result result = run(command, timeout);
        if (!result.isSuccess()) {
            throw new ToolException(command.get(0), result.exitCode(), tail(result.stderr()), false, null);
        }
        return result;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static String tail(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();
        return s.length() <= 2000 ? s : s.substring(s.length() - 2000);
    }
}
