package com.candor.api.access;

import com.candor.core.domain.Principal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/access")
public class AccessController {

    private final AccessControlService accessControlService;

    public AccessController(AccessControlService accessControlService) {
        this.accessControlService = accessControlService;
    }

    @PostMapping("/investigators")
    public ResponseEntity<RosterResponse> addInvestigator(
            @AuthenticationPrincipal Principal caller,
            @Valid @RequestBody AddressRequest request) {
        Principal investigator = Principal.of(request.address());
        accessControlService.addInvestigator(caller, investigator);
        return ResponseEntity.ok(new RosterResponse(investigator.address(), true));
    }

    @DeleteMapping("/investigators/{address}")
    public ResponseEntity<RosterResponse> removeInvestigator(
            @AuthenticationPrincipal Principal caller,
            @PathVariable String address) {
        Principal investigator = Principal.of(address);
        accessControlService.removeInvestigator(caller, investigator);
        return ResponseEntity.ok(new RosterResponse(investigator.address(), false));
    }

    @GetMapping("/investigators")
    public ResponseEntity<List<String>> listInvestigators() {
        return ResponseEntity.ok(accessControlService.getInvestigators().stream()
                .map(Principal::address)
                .toList());
    }

    @GetMapping("/investigators/{address}")
    public ResponseEntity<RosterResponse> isAuthorizedInvestigator(@PathVariable String address) {
        Principal principal = Principal.of(address);
        return ResponseEntity.ok(new RosterResponse(principal.address(),
                accessControlService.isAuthorizedInvestigator(principal)));
    }

    @GetMapping("/authority")
    public ResponseEntity<AuthorityResponse> getAuthority() {
        return ResponseEntity.ok(new AuthorityResponse(accessControlService.getAuthority().address()));
    }

    @PutMapping("/authority")
    public ResponseEntity<AuthorityResponse> transferAuthority(
            @AuthenticationPrincipal Principal caller,
            @Valid @RequestBody AddressRequest request) {
        Principal newAuthority = Principal.of(request.address());
        accessControlService.transferAuthority(caller, newAuthority);
        return ResponseEntity.ok(new AuthorityResponse(newAuthority.address()));
    }

    public record AddressRequest(@NotBlank String address) {}
    public record RosterResponse(String address, boolean authorized) {}
    public record AuthorityResponse(String authority) {}
}
