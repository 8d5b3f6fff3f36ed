package com.cityhunt.api;

import com.cityhunt.engine.EngineModels;
import com.cityhunt.engine.ProgressionEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/hunt")
public class HuntController {
    static final String SESSION_HEADER = "X-Session-Id";

    private final ProgressionEngine engine;

    public HuntController(ProgressionEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/authorize")
    public ResponseEntity<EngineModels.AuthorizeResponse> authorize(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                                                    @RequestBody AuthorizeRequest request) {
        return ResponseEntity.ok(engine.authorize(sessionId, request.groupId(), request.pin()));
    }

    @GetMapping("/stage")
    public ResponseEntity<EngineModels.StageContentResponse> stage(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                                                   @RequestParam(required = false) String groupId,
                                                                   @RequestParam(required = false) String stageId) {
        return ResponseEntity.ok(engine.getStageContent(sessionId, groupId, stageId));
    }

    @PostMapping("/answer")
    public ResponseEntity<EngineModels.AnswerResponse> answer(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                                              @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(engine.validateAnswer(sessionId, request.groupId(), request.stageId(), request.answer()));
    }

    @GetMapping("/progress")
    public ResponseEntity<EngineModels.GroupProgressResponse> progress(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                                                       @RequestParam(required = false) String groupId) {
        return ResponseEntity.ok(engine.getGroupProgress(sessionId, groupId));
    }

    public record AuthorizeRequest(String groupId, String pin) {}

    public record AnswerRequest(String groupId, String stageId, String answer) {}
}
