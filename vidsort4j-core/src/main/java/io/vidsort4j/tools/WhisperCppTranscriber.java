package io.vidsort4j.tools;

import io.vidsort4j.Transcriber;
import io.vidsort4j.core.error.ExtractionException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * whisper.cpp command-line transcriber. Prints the transcript without timestamps on stdout.
 */
public class WhisperCppTranscriber implements Transcriber {

    private final ProcessRunner runner;
    private final String executable;
    private final String modelPath;
    private final Duration timeout;

    public WhisperCppTranscriber(ProcessRunner runner, String executable, String modelPath, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String transcribe(Path audioPath, String languageHint) throws ExtractionException {
        String language = languageHint == null || languageHint.isBlank() ? AUTO_LANGUAGE : languageHint;
        try {
            ProcessRunner.Result r = runner.runChecked(List.of(
                    executable,
                    "-m", modelPath,
                    "-f", audioPath.toString(),
                    "-l", language,
                    "--no-timestamps",
                    "--no-prints"
            ), timeout);
            return r.stdout().strip();
        } catch (IOException e) {
            throw ExtractionException.transientFailure("transcription failed: " + e.getMessage(), e);
        }
    }
}
