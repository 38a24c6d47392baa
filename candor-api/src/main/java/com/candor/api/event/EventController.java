package com.candor.api.event;

import com.candor.core.domain.CaseEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final CaseEventLog eventLog;

    public EventController(CaseEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping
    public ResponseEntity<List<CaseEvent>> listEvents(
            @RequestParam(defaultValue = "0") long after,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(eventLog.list(after, Math.max(1, Math.min(limit, 1000))));
    }

    @GetMapping("/report/{reportId}")
    public ResponseEntity<List<CaseEvent>> reportEvents(@PathVariable long reportId) {
        return ResponseEntity.ok(eventLog.forReport(reportId));
    }

    @GetMapping("/verify")
    public ResponseEntity<CaseEventLog.ChainVerification> verifyChain() {
        return ResponseEntity.ok(eventLog.verifyChain());
    }
}
