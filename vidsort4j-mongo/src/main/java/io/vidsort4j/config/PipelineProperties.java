package io.vidsort4j.config;

import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.extract.TranscriptSettings;
import io.vidsort4j.extract.VisionMode;
import io.vidsort4j.extract.VisionPolicy;
import io.vidsort4j.fusion.FusionSettings;
import io.vidsort4j.internal.llm.LlmLabelerSettings;
import io.vidsort4j.retry.RetryPolicy;
import io.vidsort4j.store.DedupSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the ingestion pipeline.
 */
@ConfigurationProperties(prefix = "vidsort")
public class PipelineProperties {
    private boolean enabled = true;
    private boolean autoStart = true;
    private String workerId;
    private int maxConcurrency = 4; // worker threads; transcription and OCR are CPU heavy
    private int batchSize = 4;
    private Duration processEvery = Duration.ofSeconds(2);
    private Duration claimLifetime = Duration.ofMinutes(30);
    private String mediaDir = "media";
    private String tagRelationshipsLocation;
    private boolean ensureIndexesOnStartup = false;

    private final Retry retry = new Retry();
    private final Dedup dedup = new Dedup();
    private final Extract extract = new Extract();
    private final Fusion fusion = new Fusion();
    private final Tools tools = new Tools();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getClaimLifetime() {
        return claimLifetime;
    }

    public void setClaimLifetime(Duration claimLifetime) {
        this.claimLifetime = claimLifetime;
    }

    public String getMediaDir() {
        return mediaDir;
    }

    public void setMediaDir(String mediaDir) {
        this.mediaDir = mediaDir;
    }

    public String getTagRelationshipsLocation() {
        return tagRelationshipsLocation;
    }

    public void setTagRelationshipsLocation(String tagRelationshipsLocation) {
        this.tagRelationshipsLocation = tagRelationshipsLocation;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Retry getRetry() {
        return retry;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public Extract getExtract() {
        return extract;
    }

    public Fusion getFusion() {
        return fusion;
    }

    public Tools getTools() {
        return tools;
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(10);
        private Duration maxDelay = Duration.ofMinutes(10);
        private int maxAttempts = 5;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(baseDelay, maxDelay, maxAttempts);
        }
    }

    public static class Dedup {
        private int maxHammingDistance = 10;
        private double durationTolerance = 1.0;

        public int getMaxHammingDistance() {
            return maxHammingDistance;
        }

        public void setMaxHammingDistance(int maxHammingDistance) {
            this.maxHammingDistance = maxHammingDistance;
        }

        public double getDurationTolerance() {
            return durationTolerance;
        }

        public void setDurationTolerance(double durationTolerance) {
            this.durationTolerance = durationTolerance;
        }

        public DedupSettings toSettings() {
            return new DedupSettings(maxHammingDistance, durationTolerance);
        }
    }

    public static class Extract {
        private Duration timeout = Duration.ofMinutes(10);
        private int frameSamples = 6;
        private final Transcript transcript = new Transcript();
        private final Ocr ocr = new Ocr();
        private final Vision vision = new Vision();
        private final Labeler labeler = new Labeler();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getFrameSamples() {
            return frameSamples;
        }

        public void setFrameSamples(int frameSamples) {
            this.frameSamples = frameSamples;
        }

        public Transcript getTranscript() {
            return transcript;
        }

        public Ocr getOcr() {
            return ocr;
        }

        public Vision getVision() {
            return vision;
        }

        public Labeler getLabeler() {
            return labeler;
        }
    }

    public static class Transcript {
        private String language = "auto";
        private String fallbackLanguage = "ar";
        private int minCharacters = 40;

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getFallbackLanguage() {
            return fallbackLanguage;
        }

        public void setFallbackLanguage(String fallbackLanguage) {
            this.fallbackLanguage = fallbackLanguage;
        }

        public int getMinCharacters() {
            return minCharacters;
        }

        public void setMinCharacters(int minCharacters) {
            this.minCharacters = minCharacters;
        }

        public TranscriptSettings toSettings() {
            return new TranscriptSettings(language, fallbackLanguage, minCharacters);
        }
    }

    public static class Ocr {
        private String languages = "ara+eng";

        public String getLanguages() {
            return languages;
        }

        public void setLanguages(String languages) {
            this.languages = languages;
        }

        public List<String> languageOrder() {
            return Arrays.stream(languages.split("\\+"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }

    public static class Vision {
        private VisionMode mode = VisionMode.OFF;

        public VisionMode getMode() {
            return mode;
        }

        public void setMode(VisionMode mode) {
            this.mode = mode;
        }
    }

    /**
     * How extracted text becomes category and tag hints.
     */
    public enum LabelerMode {
        /** Bundled keyword lexicon. */
        KEYWORD,
        /** Local LLM through Ollama, falling back to keywords when the model is unavailable. */
        LLM
    }

    public static class Labeler {
        private LabelerMode mode = LabelerMode.KEYWORD;
        private String url = LlmLabelerSettings.DEFAULTS.url();
        private String model = LlmLabelerSettings.DEFAULTS.model();
        private Duration timeout = LlmLabelerSettings.DEFAULTS.timeout();
        private int maxCharacters = LlmLabelerSettings.DEFAULTS.maxCharacters();

        public LabelerMode getMode() {
            return mode;
        }

        public void setMode(LabelerMode mode) {
            this.mode = mode;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxCharacters() {
            return maxCharacters;
        }

        public void setMaxCharacters(int maxCharacters) {
            this.maxCharacters = maxCharacters;
        }

        public LlmLabelerSettings toSettings() {
            return new LlmLabelerSettings(url, model, timeout, maxCharacters);
        }
    }

    public static class Fusion {
        private Map<EvidenceSource, Double> weights = new EnumMap<>(Map.of(
                EvidenceSource.AUDIO, 1.0,
                EvidenceSource.OCR, 1.0,
                EvidenceSource.VISION, 0.85));
        private double tagThreshold = 0.3;
        private double implicationDiscount = 0.6;
        private double reviewThreshold = 0.5;
        private double coverageFloor = 0.7;

        public Map<EvidenceSource, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<EvidenceSource, Double> weights) {
            this.weights = weights;
        }

        public double getTagThreshold() {
            return tagThreshold;
        }

        public void setTagThreshold(double tagThreshold) {
            this.tagThreshold = tagThreshold;
        }

        public double getImplicationDiscount() {
            return implicationDiscount;
        }

        public void setImplicationDiscount(double implicationDiscount) {
            this.implicationDiscount = implicationDiscount;
        }

        public double getReviewThreshold() {
            return reviewThreshold;
        }

        public void setReviewThreshold(double reviewThreshold) {
            this.reviewThreshold = reviewThreshold;
        }

        public double getCoverageFloor() {
            return coverageFloor;
        }

        public void setCoverageFloor(double coverageFloor) {
            this.coverageFloor = coverageFloor;
        }

        public FusionSettings toSettings() {
            return new FusionSettings(weights, tagThreshold, implicationDiscount, reviewThreshold, coverageFloor);
        }
    }

    public static class Tools {
        private String ffmpeg = "ffmpeg";
        private String ffprobe = "ffprobe";
        private String ytDlp = "yt-dlp";
        private String whisper = "whisper-cli";
        private String whisperModel = "models/ggml-base.bin";
        private String tesseract = "tesseract";
        private Duration downloadTimeout = Duration.ofMinutes(15);

        public String getFfmpeg() {
            return ffmpeg;
        }

        public void setFfmpeg(String ffmpeg) {
            this.ffmpeg = ffmpeg;
        }

        public String getFfprobe() {
            return ffprobe;
        }

        public void setFfprobe(String ffprobe) {
            this.ffprobe = ffprobe;
        }

        public String getYtDlp() {
            return ytDlp;
        }

        public void setYtDlp(String ytDlp) {
            this.ytDlp = ytDlp;
        }

        public String getWhisper() {
            return whisper;
        }

        public void setWhisper(String whisper) {
            this.whisper = whisper;
        }

        public String getWhisperModel() {
            return whisperModel;
        }

        public void setWhisperModel(String whisperModel) {
            this.whisperModel = whisperModel;
        }

        public String getTesseract() {
            return tesseract;
        }

        public void setTesseract(String tesseract) {
            this.tesseract = tesseract;
        }

        public Duration getDownloadTimeout() {
            return downloadTimeout;
        }

        public void setDownloadTimeout(Duration downloadTimeout) {
            this.downloadTimeout = downloadTimeout;
        }
    }

    public VisionPolicy visionPolicy() {
        return new VisionPolicy(extract.getVision().getMode(), fusion.getReviewThreshold());
    }
}
