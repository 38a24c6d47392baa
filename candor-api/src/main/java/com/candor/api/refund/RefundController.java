package com.candor.api.refund;

import com.candor.core.domain.Principal;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/reports/{reportId}/refund")
public class RefundController {

    private final TimeoutRecoveryService timeoutRecoveryService;

    public RefundController(TimeoutRecoveryService timeoutRecoveryService) {
        this.timeoutRecoveryService = timeoutRecoveryService;
    }

    // open to anyone; an anonymous claim is recorded with the null identity
    @PostMapping("/decryption-timeout")
    public ResponseEntity<TimeoutRecoveryService.RefundResult> claimDecryptionTimeout(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId) {
        return ResponseEntity.ok(timeoutRecoveryService.claimDecryptionTimeoutRefund(caller, reportId));
    }

    @PostMapping("/investigation-timeout")
    public ResponseEntity<TimeoutRecoveryService.RefundResult> claimInvestigationTimeout(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId) {
        return ResponseEntity.ok(timeoutRecoveryService.claimInvestigationTimeoutRefund(caller, reportId));
    }

    @GetMapping
    public ResponseEntity<TimeoutRecoveryService.RefundAvailability> isRefundAvailable(@PathVariable long reportId) {
        return ResponseEntity.ok(timeoutRecoveryService.isRefundAvailable(reportId));
    }
}
