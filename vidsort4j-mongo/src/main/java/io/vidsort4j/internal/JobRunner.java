package io.vidsort4j.internal;

import io.vidsort4j.PlatformGateway;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.ErrorKind;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.FetchedMedia;
import io.vidsort4j.core.FragmentKind;
import io.vidsort4j.core.GatewayRegistry;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobError;
import io.vidsort4j.core.JobPatch;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.SourceMetadata;
import io.vidsort4j.core.Tag;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.core.error.PipelineException;
import io.vidsort4j.fingerprint.ContentFingerprinter;
import io.vidsort4j.fusion.EvidenceFusion;
import io.vidsort4j.retry.RetryDecision;
import io.vidsort4j.retry.RetryScheduler;
import io.vidsort4j.store.ArchiveIndex;
import io.vidsort4j.store.JobStore;
import io.vidsort4j.store.ProposedTag;
import io.vidsort4j.store.ProposedTagLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one claimed job through fetch, dedup, extraction and fusion.
 *
 * <p>Every transition is a compare-and-set on the job's status and claim. When one fails, another worker
 * has taken the job over (our lease expired) and this attempt stops without writing anything else.
 * Cancellation is checked at each stage boundary; in-flight external calls are left to finish and their
 * results are dropped.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore jobStore;
    private final GatewayRegistry gateways;
    private final ContentFingerprinter fingerprinter;
    private final ArchiveIndex archiveIndex;
    private final ExtractionStage extraction;
    private final EvidenceFusion fusion;
    private final RetryScheduler retryScheduler;
    private final ProposedTagLog proposedTags;
    private final Path mediaDir;
    private final Clock clock;

    public JobRunner(JobStore jobStore,
                     GatewayRegistry gateways,
                     ContentFingerprinter fingerprinter,
                     ArchiveIndex archiveIndex,
                     ExtractionStage extraction,
                     EvidenceFusion fusion,
                     RetryScheduler retryScheduler,
                     ProposedTagLog proposedTags,
                     Path mediaDir,
                     Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.gateways = Objects.requireNonNull(gateways, "gateways must not be null");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.archiveIndex = Objects.requireNonNull(archiveIndex, "archiveIndex must not be null");
        this.extraction = Objects.requireNonNull(extraction, "extraction must not be null");
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler must not be null");
        this.proposedTags = Objects.requireNonNull(proposedTags, "proposedTags must not be null");
        this.mediaDir = Objects.requireNonNull(mediaDir, "mediaDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param job a job just claimed by {@code workerId} (status FETCHING)
     */
    public void run(Job job, String workerId) {
        Attempt a = new Attempt(job, workerId);
        try {
            a.execute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // lease expiry makes the job claimable again
            log.warn("vidsort job interrupted url={} stage={}", job.url(), a.stage);
        } catch (PipelineException e) {
            a.fail(JobError.of(e.errorKind(), e.getMessage(), now()));
        } catch (RuntimeException e) {
            log.error("vidsort job crashed url={} stage={} msg={}", job.url(), a.stage, e.getMessage(), e);
            a.fail(JobError.of(ErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage(), now()));
        }
    }

    private Instant now() {
        return clock.instant();
    }

    Path jobDir(String url) {
        return mediaDir.resolve(UUID.nameUUIDFromBytes(url.getBytes(StandardCharsets.UTF_8)).toString());
    }

    /**
     * State of one attempt; {@code stage} is the status the store holds for the job.
     */
    private final class Attempt {
        private final Job job;
        private final String url;
        private final String workerId;
        private JobStatus stage;

        private Attempt(Job job, String workerId) {
            this.job = job;
            this.url = job.url();
            this.workerId = workerId;
            this.stage = job.status();
        }

        void execute() throws PipelineException, InterruptedException {
            log.debug("vidsort job started url={} attempt={} workerId={}", url, job.attempts(), workerId);

            // fetch
            if (cancelled()) {
                return;
            }
            MediaAsset media = reusableMedia();
            SourceMetadata source = null;
            if (media == null) {
                PlatformGateway gateway = gateways.getRequired(job.platform());
                FetchedMedia fetched = gateway.fetch(url, jobDir(url));
                media = fetched.asset();
                source = SourceMetadata.fromInfoJson(fetched.rawMetadata());
                log.debug("vidsort fetched url={} path={} duration={} resolution={} title={}",
                        url, media.path(), media.durationSeconds(), media.resolution(),
                        source == null ? null : source.title());
            }
            if (!advance(JobStatus.DEDUP_CHECKING, JobPatch.fetched(media, source))) {
                return;
            }

            // dedup
            if (cancelled()) {
                return;
            }
            if (!media.isFingerprinted()) {
                media = media.withPerceptualHash(fingerprinter.fingerprint(media));
            }
            if (cancelled()) {
                return;
            }
            Optional<String> original = archiveIndex.checkAndInsert(url, media.perceptualHash(),
                    media.durationSeconds(), media.width(), media.height());
            if (original.isPresent()) {
                if (advance(JobStatus.DUPLICATE, JobPatch.duplicate(media, original.get()))) {
                    log.info("vidsort job duplicate url={} duplicateOf={} hash={}", url, original.get(), media.perceptualHash());
                }
                return;
            }
            if (!advance(JobStatus.EXTRACTING, JobPatch.media(media))) {
                return;
            }

            // extract
            if (cancelled()) {
                return;
            }
            ExtractionOutcome outcome = extraction.run(job, media);
            if (outcome.allTransient()) {
                ExtractionException first = outcome.firstFailure();
                throw ExtractionException.transientFailure("all extractors failed: " + outcome.failures().keySet()
                        + (first == null ? "" : " (" + first.getMessage() + ")"), first);
            }
            if (cancelled()) {
                return;
            }
            recordProposedLabels(outcome);
            if (!advance(JobStatus.FUSING, JobPatch.none())) {
                return;
            }

            // fuse
            Classification result = fusion.fuse(outcome.fragments(), outcome.expected(), outcome.required());
            if (advance(JobStatus.COMPLETED, JobPatch.result(result))) {
                log.info("vidsort job completed url={} category={} confidence={} review={} tags={}",
                        url, result.category().label(), String.format("%.2f", result.overallConfidence()),
                        result.requiresReview(), result.tags().size());
            }
        }

        void fail(JobError error) {
            RetryDecision decision = retryScheduler.decide(job, error);
            boolean canRequeue = stage.canTransitionTo(JobStatus.PENDING);
            if (decision.retry() && canRequeue) {
                Instant next = error.at().plus(decision.delay());
                if (jobStore.advance(url, workerId, stage, JobStatus.PENDING, JobPatch.retryAt(error, next), now())) {
                    log.info("vidsort job retry scheduled url={} attempt={} kind={} nextAttemptAt={} msg={}",
                            url, job.attempts(), error.kind(), next, error.message());
                } else {
                    log.warn("vidsort job lost claim before retry url={} stage={}", url, stage);
                }
                return;
            }
            if (jobStore.advance(url, workerId, stage, JobStatus.FAILED, JobPatch.error(error), now())) {
                log.warn("vidsort job failed url={} attempt={} kind={} reason={} msg={}",
                        url, job.attempts(), error.kind(),
                        decision.retry() ? "not requeueable from " + stage : decision.reason(), error.message());
            } else {
                log.warn("vidsort job lost claim before failing url={} stage={}", url, stage);
            }
        }

        private boolean advance(JobStatus to, JobPatch patch) {
            if (jobStore.advance(url, workerId, stage, to, patch, now())) {
                log.debug("vidsort job transition url={} from={} to={}", url, stage, to);
                stage = to;
                return true;
            }
            log.warn("vidsort job transition rejected url={} from={} to={} workerId={}", url, stage, to, workerId);
            return false;
        }

        private boolean cancelled() {
            if (!jobStore.isCancelRequested(url)) {
                return false;
            }
            if (jobStore.advance(url, workerId, stage, JobStatus.FAILED, JobPatch.error(JobError.cancelled(now())), now())) {
                log.info("vidsort job cancelled url={} stage={}", url, stage);
            }
            return true;
        }

        private MediaAsset reusableMedia() {
            MediaAsset media = job.media();
            if (media != null && Files.isRegularFile(Path.of(media.path()))) {
                log.debug("vidsort resuming with downloaded media url={} path={}", url, media.path());
                return media;
            }
            return null;
        }

        private void recordProposedLabels(ExtractionOutcome outcome) {
            for (EvidenceFragment f : outcome.fragments()) {
                boolean unknown = (f.kind() == FragmentKind.TAG && Tag.fromLabel(f.text()).isEmpty())
                        || (f.kind() == FragmentKind.CATEGORY && Category.fromLabel(f.text()).isEmpty());
                if (unknown) {
                    proposedTags.append(new ProposedTag(f.text().trim(), f.source(), f.confidence(), url, now()));
                    log.info("vidsort proposed label url={} label={} source={}", url, f.text(), f.source());
                }
            }
        }
    }
}
