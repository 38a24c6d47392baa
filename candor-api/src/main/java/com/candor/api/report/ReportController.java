package com.candor.api.report;

import com.candor.core.domain.Principal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private final ReportRegistryService reportRegistryService;

    public ReportController(ReportRegistryService reportRegistryService) {
        this.reportRegistryService = reportRegistryService;
    }

    @PostMapping
    public ResponseEntity<ReportRegistryService.SubmissionResult> submitReport(
            @AuthenticationPrincipal Principal caller,
            @Valid @RequestBody SubmitReportRequest request) {
        var result = reportRegistryService.submit(
                caller, request.category(), request.anonymous(), request.severity());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{reportId}")
    public ResponseEntity<ReportRegistryService.ReportInfo> getReport(@PathVariable long reportId) {
        return ResponseEntity.ok(reportRegistryService.getBasicInfo(reportId));
    }

    @GetMapping("/{reportId}/sealed")
    public ResponseEntity<ReportRegistryService.SealedFieldsView> readSealedFields(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId) {
        return ResponseEntity.ok(reportRegistryService.readSealedFields(reportId, caller));
    }

    @GetMapping("/stats")
    public ResponseEntity<ReportRegistryService.SystemStats> getStats() {
        return ResponseEntity.ok(reportRegistryService.getStats());
    }

    // Range checks live in the service so direct callers get the same errors
    public record SubmitReportRequest(
            @NotNull Integer category,
            boolean anonymous,
            @NotNull Integer severity
    ) {}
}
