package io.vidsort4j.extract;

import io.vidsort4j.Transcriber;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.media.AudioTrackExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Speech to text over the audio track.
 *
 * <p>The first pass uses the configured language hint (auto-detect by default). When its output is
 * shorter than {@code minCharacters}, a second pass forces the fallback language and the longer
 * transcript wins; auto-detection often misses short Arabic clips.
 */
public class TranscriptExtractor implements SignalExtractor {
    private static final Logger log = LoggerFactory.getLogger(TranscriptExtractor.class);

    private final AudioTrackExtractor audioExtractor;
    private final Transcriber transcriber;
    private final EvidenceLabeler labeler;
    private final TranscriptSettings settings;
    private final Path workDir;

    public TranscriptExtractor(AudioTrackExtractor audioExtractor, Transcriber transcriber, EvidenceLabeler labeler,
                               TranscriptSettings settings, Path workDir) {
        this.audioExtractor = Objects.requireNonNull(audioExtractor, "audioExtractor must not be null");
        this.transcriber = Objects.requireNonNull(transcriber, "transcriber must not be null");
        this.labeler = Objects.requireNonNull(labeler, "labeler must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
    }

    @Override
    public EvidenceSource source() {
        return EvidenceSource.AUDIO;
    }

    @Override
    public List<EvidenceFragment> extract(MediaAsset asset) throws ExtractionException {
        if (!asset.hasAudio()) {
            throw ExtractionException.permanent("no audio track in " + asset.path());
        }

        Path wav = null;
        try {
            Files.createDirectories(workDir);
            wav = Files.createTempFile(workDir, "audio-", ".wav");
            audioExtractor.extractAudio(Path.of(asset.path()), wav);

            String text = normalize(transcriber.transcribe(wav, settings.language()));
            if (needsFallback(text)) {
                String second = normalize(transcriber.transcribe(wav, settings.fallbackLanguage()));
                log.debug("transcript fallback media={} firstChars={} fallbackChars={} language={}",
                        asset.path(), text.length(), second.length(), settings.fallbackLanguage());
                if (second.length() > text.length()) {
                    text = second;
                }
            }
            if (text.isEmpty()) {
                return List.of();
            }

            List<EvidenceFragment> out = new ArrayList<>();
            out.add(EvidenceFragment.text(text, EvidenceSource.AUDIO, List.of()));
            out.addAll(labeler.label(EvidenceSource.AUDIO, List.of(new TextSegment(text, List.of()))));
            return out;
        } catch (IOException e) {
            throw ExtractionException.transientFailure("audio extraction failed for " + asset.path() + ": " + e.getMessage(), e);
        } finally {
            if (wav != null) {
                try {
                    Files.deleteIfExists(wav);
                } catch (IOException e) {
                    log.warn("could not delete temp audio path={} msg={}", wav, e.getMessage());
                }
            }
        }
    }

    private boolean needsFallback(String text) {
        String fallback = settings.fallbackLanguage();
        return fallback != null
                && !fallback.isBlank()
                && !fallback.equalsIgnoreCase(settings.language())
                && text.length() < settings.minCharacters();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.strip();
    }
}
