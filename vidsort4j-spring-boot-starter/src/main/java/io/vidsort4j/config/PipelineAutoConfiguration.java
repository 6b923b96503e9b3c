package io.vidsort4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.Pipeline;
import io.vidsort4j.PlatformGateway;
import io.vidsort4j.TextRecognizer;
import io.vidsort4j.Transcriber;
import io.vidsort4j.VisionDescriber;
import io.vidsort4j.core.GatewayRegistry;
import io.vidsort4j.extract.EvidenceLabeler;
import io.vidsort4j.extract.FrameSampler;
import io.vidsort4j.extract.KeywordEvidenceLabeler;
import io.vidsort4j.extract.OnScreenTextExtractor;
import io.vidsort4j.extract.SignalExtractor;
import io.vidsort4j.extract.TranscriptExtractor;
import io.vidsort4j.extract.VisualDescriptionExtractor;
import io.vidsort4j.fingerprint.ContentFingerprinter;
import io.vidsort4j.fingerprint.DifferenceHashFingerprinter;
import io.vidsort4j.fusion.EvidenceFusion;
import io.vidsort4j.fusion.TagRelationships;
import io.vidsort4j.fusion.TagRelationshipsLoader;
import io.vidsort4j.internal.DefaultPipeline;
import io.vidsort4j.internal.ExtractionStage;
import io.vidsort4j.internal.JobRunner;
import io.vidsort4j.internal.llm.LlmLabelerSettings;
import io.vidsort4j.internal.llm.OllamaEvidenceLabeler;
import io.vidsort4j.internal.mongo.MongoArchiveIndex;
import io.vidsort4j.internal.mongo.MongoJobStore;
import io.vidsort4j.internal.mongo.MongoProposedTagLog;
import io.vidsort4j.retry.RetryScheduler;
import io.vidsort4j.store.ArchiveIndex;
import io.vidsort4j.store.JobStore;
import io.vidsort4j.store.ProposedTagLog;
import io.vidsort4j.tools.FfmpegMediaTools;
import io.vidsort4j.tools.ProcessRunner;
import io.vidsort4j.tools.TesseractTextRecognizer;
import io.vidsort4j.tools.WhisperCppTranscriber;
import io.vidsort4j.tools.YtDlpPlatformGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the ingestion pipeline.
 *
 * <p>Every bean backs off when the application defines its own, so a deployment can swap the command-line
 * tool adapters (yt-dlp, ffmpeg, whisper.cpp, tesseract) for other implementations. A
 * {@link VisionDescriber} is never created here; visual description runs only when the application
 * provides one.
 */
@AutoConfiguration
@ConditionalOnClass({Pipeline.class, MongoTemplate.class})
@EnableConfigurationProperties(PipelineProperties.class)
@ConditionalOnProperty(prefix = "vidsort", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineAutoConfiguration {

    // stores

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ArchiveIndex archiveIndex(MongoTemplate mongoTemplate, PipelineProperties props, Clock vidsortClock) {
        return new MongoArchiveIndex(mongoTemplate, props.getDedup().toSettings(), vidsortClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProposedTagLog proposedTagLog(MongoTemplate mongoTemplate) {
        return new MongoProposedTagLog(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected PipelineMongoIndexConfig pipelineMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new PipelineMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(name = "vidsortClock")
    public Clock vidsortClock() {
        return Clock.systemUTC();
    }

    // external tools

    @Bean
    @ConditionalOnMissingBean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public FfmpegMediaTools ffmpegMediaTools(ProcessRunner runner, ObjectMapper objectMapper, PipelineProperties props) {
        PipelineProperties.Tools tools = props.getTools();
        return new FfmpegMediaTools(runner, objectMapper, tools.getFfmpeg(), tools.getFfprobe(),
                props.getExtract().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(PlatformGateway.class)
    public YtDlpPlatformGateway ytDlpPlatformGateway(ProcessRunner runner, ObjectMapper objectMapper,
                                                     FfmpegMediaTools mediaTools, PipelineProperties props) {
        PipelineProperties.Tools tools = props.getTools();
        return new YtDlpPlatformGateway(runner, objectMapper, mediaTools, tools.getYtDlp(), tools.getDownloadTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayRegistry gatewayRegistry(ObjectProvider<List<PlatformGateway>> gatewaysProvider) {
        List<PlatformGateway> gateways = gatewaysProvider.getIfAvailable(List::of);
        return new GatewayRegistry(gateways);
    }

    @Bean
    @ConditionalOnMissingBean
    public Transcriber transcriber(ProcessRunner runner, PipelineProperties props) {
        PipelineProperties.Tools tools = props.getTools();
        return new WhisperCppTranscriber(runner, tools.getWhisper(), tools.getWhisperModel(),
                props.getExtract().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TextRecognizer textRecognizer(ProcessRunner runner, PipelineProperties props) {
        return new TesseractTextRecognizer(runner, props.getTools().getTesseract(), props.getExtract().getTimeout());
    }

    // classification

    @Bean
    @ConditionalOnMissingBean
    public TagRelationships tagRelationships(ObjectMapper objectMapper, PipelineProperties props,
                                             ResourceLoader resourceLoader) throws IOException {
        TagRelationshipsLoader loader = new TagRelationshipsLoader(objectMapper);
        String location = props.getTagRelationshipsLocation();
        if (location == null || location.isBlank()) {
            return loader.loadDefault();
        }
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return loader.load(in);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceLabeler evidenceLabeler(ObjectMapper objectMapper, TagRelationships relationships,
                                           PipelineProperties props) throws IOException {
        KeywordEvidenceLabeler keywords = KeywordEvidenceLabeler.fromClasspath(objectMapper, relationships);
        PipelineProperties.Labeler labeler = props.getExtract().getLabeler();
        if (labeler.getMode() != PipelineProperties.LabelerMode.LLM) {
            return keywords;
        }
        LlmLabelerSettings settings = labeler.toSettings();
        return new OllamaEvidenceLabeler(OllamaEvidenceLabeler.restTemplate(settings), objectMapper, settings, keywords);
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceFusion evidenceFusion(PipelineProperties props, TagRelationships relationships) {
        return new EvidenceFusion(props.getFusion().toSettings(), relationships);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryScheduler retryScheduler(PipelineProperties props) {
        return new RetryScheduler(props.getRetry().toPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentFingerprinter contentFingerprinter(FfmpegMediaTools mediaTools, PipelineProperties props) {
        return new DifferenceHashFingerprinter(mediaTools, workDir(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExtractionStage extractionStage(FfmpegMediaTools mediaTools,
                                           Transcriber transcriber,
                                           TextRecognizer textRecognizer,
                                           ObjectProvider<VisionDescriber> visionDescriber,
                                           EvidenceLabeler labeler,
                                           PipelineProperties props) {
        PipelineProperties.Extract extract = props.getExtract();
        FrameSampler sampler = new FrameSampler(extract.getFrameSamples());
        Path workDir = workDir(props);

        List<SignalExtractor> textExtractors = new ArrayList<>(2);
        textExtractors.add(new TranscriptExtractor(mediaTools, transcriber, labeler,
                extract.getTranscript().toSettings(), workDir));
        textExtractors.add(new OnScreenTextExtractor(mediaTools, textRecognizer, labeler, sampler,
                extract.getOcr().languageOrder(), workDir));

        VisionDescriber describer = visionDescriber.getIfAvailable();
        SignalExtractor vision = describer == null
                ? null
                : new VisualDescriptionExtractor(mediaTools, describer, labeler, sampler, workDir);

        return new ExtractionStage(textExtractors, vision, props.visionPolicy(), extract.getTimeout());
    }

    // orchestration

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(JobStore jobStore,
                               GatewayRegistry gateways,
                               ContentFingerprinter fingerprinter,
                               ArchiveIndex archiveIndex,
                               ExtractionStage extractionStage,
                               EvidenceFusion fusion,
                               RetryScheduler retryScheduler,
                               ProposedTagLog proposedTagLog,
                               PipelineProperties props,
                               Clock vidsortClock) {
        return new JobRunner(jobStore, gateways, fingerprinter, archiveIndex, extractionStage, fusion,
                retryScheduler, proposedTagLog, Path.of(props.getMediaDir()), vidsortClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Pipeline pipeline(PipelineProperties props, JobStore jobStore, JobRunner jobRunner, Clock vidsortClock) {
        return new DefaultPipeline(props, jobStore, jobRunner, vidsortClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineLifecycle pipelineLifecycle(Pipeline pipeline, PipelineProperties props) {
        return new PipelineLifecycle(pipeline, props.isAutoStart());
    }

    @Bean
    @ConditionalOnProperty(prefix = "vidsort", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton vidsortIndexesInitializer(PipelineMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    private static Path workDir(PipelineProperties props) {
        return Path.of(props.getMediaDir()).resolve(".work");
    }
}
