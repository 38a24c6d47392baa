package com.candor.api.investigation;

import com.candor.core.domain.Principal;
import com.candor.core.domain.ReportStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class InvestigationController {

    private final InvestigationService investigationService;

    public InvestigationController(InvestigationService investigationService) {
        this.investigationService = investigationService;
    }

    @PostMapping("/reports/{reportId}/assignment")
    public ResponseEntity<InvestigationService.AssignmentResult> assign(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId,
            @Valid @RequestBody AssignRequest request) {
        var result = investigationService.assign(caller, reportId, Principal.of(request.investigator()));
        return ResponseEntity.ok(result);
    }

    @PutMapping("/reports/{reportId}/notes")
    public ResponseEntity<Void> addNotes(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId,
            @Valid @RequestBody NotesRequest request) {
        investigationService.addNotes(caller, reportId, request.notes());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/reports/{reportId}/status")
    public ResponseEntity<StatusResponse> updateStatus(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId,
            @Valid @RequestBody StatusRequest request) {
        ReportStatus status = investigationService.updateStatus(caller, reportId, request.status());
        return ResponseEntity.ok(new StatusResponse(reportId, status));
    }

    @GetMapping("/reports/{reportId}/investigation")
    public ResponseEntity<InvestigationService.InvestigationInfo> getInvestigation(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId) {
        return ResponseEntity.ok(investigationService.getInvestigationInfo(reportId, caller));
    }

    @GetMapping("/investigators/{address}/reports")
    public ResponseEntity<List<Long>> getInvestigatorReports(
            @AuthenticationPrincipal Principal caller,
            @PathVariable String address) {
        return ResponseEntity.ok(investigationService.getInvestigatorReports(Principal.of(address), caller));
    }

    public record AssignRequest(@NotBlank String investigator) {}
    public record NotesRequest(@NotNull String notes) {}
    public record StatusRequest(@NotNull ReportStatus status) {}
    public record StatusResponse(long reportId, ReportStatus status) {}
}
