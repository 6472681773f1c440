package com.herzen.recall.api;

import com.herzen.recall.scoring.ScoringModels.SessionResult;
import com.herzen.recall.session.SessionModels;
import com.herzen.recall.session.SessionService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<SessionModels.ScoredSession> submit(@RequestBody SubmitRequest request) {
        if (request.testId() == null || request.testId().isBlank()) {
            throw new IllegalArgumentException("testId is required");
        }
        if (request.elapsedTimeSec() == null) {
            throw new IllegalArgumentException("elapsedTimeSec is required");
        }
        return ResponseEntity.ok(sessionService.submitRecall(
                new SessionModels.RecallSubmission(request.testId(), request.recallText(), request.elapsedTimeSec())));
    }

    @PostMapping("/transcripts/refine")
    public ResponseEntity<SessionModels.RefinedTranscript> refine(@RequestBody RefineRequest request) {
        return ResponseEntity.ok(sessionService.refineTranscript(request.rawText()));
    }

    @GetMapping
    public ResponseEntity<List<SessionResult>> history() {
        return ResponseEntity.ok(sessionService.history());
    }

    @GetMapping("/latest")
    public ResponseEntity<SessionResult> latest() {
        return sessionService.latest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/trend")
    public ResponseEntity<SessionModels.SessionTrend> trend() {
        return ResponseEntity.ok(sessionService.trend());
    }

    @GetMapping("/{sessionId}/feedback")
    public ResponseEntity<String> feedback(@PathVariable String sessionId) {
        return sessionService.feedback(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"recall-sessions.csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(sessionService.exportCsv());
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        sessionService.clearHistory();
        return ResponseEntity.noContent().build();
    }

    public record SubmitRequest(String testId, String recallText, Double elapsedTimeSec) {}

    public record RefineRequest(String rawText) {}
}
