package com.candor.api.decryption;

import com.candor.core.domain.Principal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.web3j.utils.Numeric;

@RestController
@RequestMapping("/api/v1")
public class DecryptionController {

    private static final String HEX_BYTES = "^(0x)?([0-9a-fA-F]{2})*$";

    private final DecryptionOracleService decryptionOracleService;

    public DecryptionController(DecryptionOracleService decryptionOracleService) {
        this.decryptionOracleService = decryptionOracleService;
    }

    @PostMapping("/reports/{reportId}/decryption")
    public ResponseEntity<DecryptionOracleService.DecryptionTicket> requestDecryption(
            @AuthenticationPrincipal Principal caller,
            @PathVariable long reportId) {
        var ticket = decryptionOracleService.requestDecryption(caller, reportId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ticket);
    }

    @GetMapping("/reports/{reportId}/decryption")
    public ResponseEntity<DecryptionOracleService.DecryptionStatus> getDecryptionStatus(@PathVariable long reportId) {
        return ResponseEntity.ok(decryptionOracleService.getDecryptionStatus(reportId));
    }

    /**
     * Entry point for oracle responses relayed from outside the process.
     */
    @PostMapping("/decryption/callback")
    public ResponseEntity<DecryptionOracleService.CallbackResult> handleCallback(
            @Valid @RequestBody CallbackRequest request) {
        var result = decryptionOracleService.handleCallback(
                request.requestId(),
                Numeric.hexStringToByteArray(request.clearValues()),
                Numeric.hexStringToByteArray(request.proof()));
        return ResponseEntity.ok(result);
    }

    public record CallbackRequest(
            @NotNull @Positive Long requestId,
            @NotNull @Pattern(regexp = HEX_BYTES) String clearValues,
            @NotNull @Pattern(regexp = HEX_BYTES) String proof
    ) {}
}
