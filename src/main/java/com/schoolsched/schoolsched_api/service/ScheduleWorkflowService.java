package com.schoolsched.schoolsched_api.service;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PreviewResponse;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.dto.PublishResponse;
import com.schoolsched.schoolsched_api.exception.AvailabilityConflictException;
import com.schoolsched.schoolsched_api.exception.FeasibilityException;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.solver.FeasibilityValidator;
import com.schoolsched.schoolsched_api.solver.GridIntegrityValidator;
import com.schoolsched.schoolsched_api.solver.ScheduleContext;
import com.schoolsched.schoolsched_api.solver.ScheduleGrid;
import com.schoolsched.schoolsched_api.solver.SlotDistributionGenerator;

/**
 * Drives a request through validate, generate and preview, and hands previews to the publisher.
 */
@Service
public class ScheduleWorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleWorkflowService.class);

    private final ScheduleContextLoader contextLoader;
    private final FeasibilityValidator feasibilityValidator;
    private final SlotDistributionGenerator generator;
    private final GridIntegrityValidator integrityValidator;
    private final PreviewStore previewStore;
    private final ScheduleLockRegistry lockRegistry;
    private final SchedulePublisher publisher;

    public ScheduleWorkflowService(ScheduleContextLoader contextLoader, FeasibilityValidator feasibilityValidator,
                                   SlotDistributionGenerator generator, GridIntegrityValidator integrityValidator,
                                   PreviewStore previewStore, ScheduleLockRegistry lockRegistry,
                                   SchedulePublisher publisher) {
        this.contextLoader = contextLoader;
        this.feasibilityValidator = feasibilityValidator;
        this.generator = generator;
        this.integrityValidator = integrityValidator;
        this.previewStore = previewStore;
        this.lockRegistry = lockRegistry;
        this.publisher = publisher;
    }

    /**
     * Read-only capacity check. Always returns a report, feasible or not.
     */
    public FeasibilityReport validateFeasibility(GenerateScheduleRequest request) {
        ScheduleContext context = contextLoader.load(request);
        return feasibilityValidator.validate(context);
    }

    public SchedulePreview generatePreview(GenerateScheduleRequest request, String requestedBy) {
        request.validate();
        String token = UUID.randomUUID().toString();
        previewStore.begin(token);
        logger.info("Received preview request {} from {}: {}", token, requestedBy, request);

        String lockKey = ScheduleKey.classLockKey(request.getAcademicYearId(), request.getSessionType(),
                request.getClassId());
        try {
            return lockRegistry.withLock(lockKey, () -> buildPreview(token, request, requestedBy));
        } catch (RuntimeException e) {
            // the token never reached the caller
            previewStore.forget(token);
            throw e;
        }
    }

    private SchedulePreview buildPreview(String token, GenerateScheduleRequest request, String requestedBy) {
        previewStore.setState(token, GenerationState.VALIDATING);
        ScheduleContext context = contextLoader.load(request);
        FeasibilityReport report = feasibilityValidator.validate(context);
        if (!report.feasible()) {
            throw new FeasibilityException(report);
        }

        previewStore.setState(token, GenerationState.GENERATING);
        List<ScheduleGrid> grids = generator.generate(context);
        integrityValidator.requireValid(context, grids);

        SchedulePreview preview = new SchedulePreview(token, request, context.schoolClass().getDisplayName(), grids,
                requestedBy, previewStore.now(), previewStore.expiryFromNow());
        previewStore.put(preview);
        logger.info("Preview {} ready: {} grid(s), {} cell(s), expires {}", token, grids.size(),
                preview.getCellCount(), preview.getExpiresAt());
        return preview;
    }

    public SchedulePreview getPreview(String token) {
        return previewStore.get(token)
                .orElseThrow(() -> new NoSuchElementException("Preview " + token + " not found or expired."));
    }

    public GenerationState getState(String token) {
        // an expired preview reports DISCARDED
        previewStore.get(token);
        return previewStore.getState(token)
                .orElseThrow(() -> new NoSuchElementException("No generation request with token " + token + "."));
    }

    /**
     * Drops a preview. Touches nothing persistent.
     */
    public void discard(String token) {
        previewStore.remove(token, GenerationState.DISCARDED)
                .orElseThrow(() -> new NoSuchElementException("Preview " + token + " not found or expired."));
        logger.info("Preview {} discarded", token);
    }

    public PublishResponse publish(PublishRequest publishRequest, String publishedBy) {
        if (publishRequest == null) {
            throw new IllegalArgumentException("Publish request body is required.");
        }
        SchedulePreview preview;
        boolean regenerated = false;
        if (publishRequest.previewToken() != null && !publishRequest.previewToken().isBlank()) {
            preview = getPreview(publishRequest.previewToken());
        } else if (publishRequest.request() != null) {
            logger.info("Publish without preview token, regenerating for {}", publishRequest.request());
            preview = generatePreview(publishRequest.request(), publishedBy);
            regenerated = true;
        } else {
            throw new IllegalArgumentException("Either previewToken or request is required.");
        }

        GenerateScheduleRequest request = preview.getRequest();
        String lockKey = ScheduleKey.classLockKey(request.getAcademicYearId(), request.getSessionType(),
                request.getClassId());
        SchedulePreview toPublish = preview;
        try {
            PublishResponse response = lockRegistry.withLock(lockKey,
                    () -> publisher.publish(toPublish, publishRequest.name(), publishedBy));
            previewStore.remove(preview.getToken(), GenerationState.PUBLISHED);
            return response;
        } catch (AvailabilityConflictException e) {
            // the preview was built on availability that no longer holds
            if (regenerated) {
                previewStore.forget(preview.getToken());
            } else {
                previewStore.remove(preview.getToken(), GenerationState.FAILED);
            }
            throw e;
        } catch (RuntimeException e) {
            if (regenerated) {
                // a regenerated preview's token was never handed out
                previewStore.forget(preview.getToken());
            }
            throw e;
        }
    }

    public PreviewResponse toResponse(SchedulePreview preview) {
        GenerateScheduleRequest request = preview.getRequest();
        List<PreviewResponse.SectionGrid> grids = new ArrayList<>();
        for (ScheduleGrid grid : preview.getGrids()) {
            grids.add(new PreviewResponse.SectionGrid(grid.getSection(), grid.getFilledCount(), grid.getCells()));
        }
        GenerationState state = previewStore.getState(preview.getToken()).orElse(GenerationState.PREVIEW_READY);
        return new PreviewResponse(preview.getToken(), state, request.getAcademicYearId(), request.getSessionType(),
                request.getClassId(), preview.getClassDisplayName(), preview.getCellCount(), grids,
                preview.getExpiresAt());
    }
}
