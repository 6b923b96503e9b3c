package io.vidsort4j.tools;

import io.vidsort4j.TextRecognizer;
import io.vidsort4j.core.error.ExtractionException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tesseract OCR. Languages are passed primary first ({@code -l ara+eng}).
 */
public class TesseractTextRecognizer implements TextRecognizer {

    private final ProcessRunner runner;
    private final String executable;
    private final Duration timeout;

    public TesseractTextRecognizer(ProcessRunner runner, String executable, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String recognize(List<Path> framePaths, List<String> languageOrder) throws ExtractionException {
        String languages = languageOrder == null || languageOrder.isEmpty() ? "eng" : String.join("+", languageOrder);
        List<String> texts = new ArrayList<>(framePaths.size());
        for (Path frame : framePaths) {
            try {
                ProcessRunner.Result r = runner.runChecked(List.of(
                        executable,
                        frame.toString(),
                        "stdout",
                        "-l", languages
                ), timeout);
                String text = r.stdout().strip();
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            } catch (IOException e) {
                throw ExtractionException.transientFailure("ocr failed on " + frame.getFileName() + ": " + e.getMessage(), e);
            }
        }
        return String.join("\n", texts);
    }
}
