package com.cityhunt.engine;

import com.cityhunt.engine.EngineModels.*;
import com.cityhunt.error.ErrorKind;
import com.cityhunt.error.HuntException;
import com.cityhunt.progress.ProgressModels.ProgressRecord;
import com.cityhunt.progress.ProgressStore;
import com.cityhunt.progress.StageGate;
import com.cityhunt.repository.AuthorizationJdbcRepository;
import com.cityhunt.repository.CredentialJdbcRepository;
import com.cityhunt.repository.StageJdbcRepository;
import com.cityhunt.stage.StageIds;
import com.cityhunt.stage.StageModels.StageDefinition;
import com.cityhunt.validation.AnswerPolicy;
import com.cityhunt.validation.AnswerPolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.function.Supplier;
import java.util.regex.Pattern;

@Service
public class ProgressionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProgressionEngine.class);

    private static final Pattern PIN_PATTERN = Pattern.compile("^\\d+$");
    private static final String DEFAULT_HINT = "Try again!";
    private static final String DEFAULT_MEDIA_TYPE = "none";

    private final CredentialJdbcRepository credentials;
    private final AuthorizationJdbcRepository authorizations;
    private final StageJdbcRepository stages;
    private final ProgressStore progressStore;
    private final AnswerPolicyRegistry policies;

    public ProgressionEngine(CredentialJdbcRepository credentials,
                             AuthorizationJdbcRepository authorizations,
                             StageJdbcRepository stages,
                             ProgressStore progressStore,
                             AnswerPolicyRegistry policies) {
        this.credentials = credentials;
        this.authorizations = authorizations;
        this.stages = stages;
        this.progressStore = progressStore;
        this.policies = policies;
    }

    public AuthorizeResponse authorize(String sessionId, String groupId, String pin) {
        requireSession(sessionId);
        if (isBlank(groupId) || isBlank(pin)) {
            throw HuntException.invalidArgument("groupId and pin are required.");
        }
        if (!PIN_PATTERN.matcher(pin).matches()) {
            throw HuntException.invalidArgument("PIN must be numeric.");
        }

        return guarded("authorizing group access", () -> {
            String storedPin = credentials.findPin(groupId)
                    .orElseThrow(() -> HuntException.notFound("Group not found."));
            if (!storedPin.equals(pin)) {
                log.warn("Rejected PIN for group {} from session {}", groupId, sessionId);
                throw HuntException.permissionDenied("Invalid PIN.");
            }
            authorizations.grant(groupId, sessionId, Instant.now());
            log.info("Granted group {} to session {}", groupId, sessionId);
            return new AuthorizeResponse(true, "Access granted", groupId);
        });
    }

    public StageContentResponse getStageContent(String sessionId, String groupId, String stageId) {
        requireSession(sessionId);
        requireGroup(groupId);
        int stageNumber = StageIds.parse(stageId);

        return guarded("fetching stage content", () -> {
            ProgressRecord progress = progressStore.read(groupId);
            if (!StageGate.isUnlocked(progress, stageNumber)) {
                throw HuntException.permissionDenied("This stage is locked. Complete previous stages first.");
            }
            StageDefinition stage = findStage(stageNumber);

            return new StageContentResponse(
                    true,
                    stageNumber,
                    stage.stageName() == null ? "Stage " + stageNumber : stage.stageName(),
                    stage.title() == null ? "" : stage.title(),
                    stage.description() == null ? "" : stage.description(),
                    stage.media(),
                    stage.mediaType() == null ? DEFAULT_MEDIA_TYPE : stage.mediaType(),
                    progress.isCompleted(stageNumber),
                    true,
                    !stage.terminal());
        });
    }

    public AnswerResponse validateAnswer(String sessionId, String groupId, String stageId, String answer) {
        requireSession(sessionId);
        requireGroup(groupId);
        int stageNumber = StageIds.parse(stageId);
        if (isBlank(answer)) {
            throw HuntException.invalidArgument("answer is required.");
        }

        return guarded("validating the answer", () -> {
            StageDefinition stage = findStage(stageNumber);
            if (stage.terminal()) {
                throw new HuntException(ErrorKind.FAILED_PRECONDITION, "This stage does not accept answer submissions.");
            }
            if (!StageGate.isUnlocked(progressStore.read(groupId), stageNumber)) {
                throw HuntException.permissionDenied("This stage is locked. Complete previous stages first.");
            }

            AnswerPolicy policy = policies.resolve(stage.validationFunction());
            if (!policy.matches(answer, stage.answer())) {
                return new AnswerResponse(true, false,
                        isBlank(stage.hint()) ? DEFAULT_HINT : stage.hint(),
                        "Incorrect answer. Try again!");
            }

            ProgressRecord updated = progressStore.applyCompletion(groupId, stageNumber);
            log.info("Group {} completed stage {} (highest reached {})", groupId, stageNumber, updated.highestReachedStage());
            return new AnswerResponse(true, true, null, "Correct answer! You can proceed to the next stage.");
        });
    }

    public GroupProgressResponse getGroupProgress(String sessionId, String groupId) {
        requireSession(sessionId);
        requireGroup(groupId);

        return guarded("fetching progress", () -> {
            ProgressRecord progress = progressStore.read(groupId);
            return new GroupProgressResponse(true, progress.highestReachedStage(), progress.completedStages(), stages.count());
        });
    }

    private StageDefinition findStage(int stageNumber) {
        return stages.findByNumber(stageNumber)
                .orElseThrow(() -> HuntException.notFound("Stage " + stageNumber + " not found."));
    }

    private <T> T guarded(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (HuntException e) {
            throw e;
        } catch (RuntimeException e) {
            throw HuntException.internal("An error occurred while " + action + ".", e);
        }
    }

    private static void requireSession(String sessionId) {
        if (isBlank(sessionId)) {
            throw new HuntException(ErrorKind.UNAUTHENTICATED, "User must be authenticated to access this function.");
        }
    }

    private static void requireGroup(String groupId) {
        if (isBlank(groupId)) {
            throw HuntException.invalidArgument("groupId is required.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
