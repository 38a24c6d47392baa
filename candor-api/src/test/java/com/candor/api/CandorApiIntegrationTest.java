package com.candor.api;

import com.candor.api.access.AccessController;
import com.candor.api.config.GlobalExceptionHandler.ErrorResponse;
import com.candor.api.decryption.DecryptionController.CallbackRequest;
import com.candor.api.decryption.DecryptionOracleService.CallbackResult;
import com.candor.api.decryption.DecryptionOracleService.DecryptionTicket;
import com.candor.api.event.CaseEventLog.ChainVerification;
import com.candor.api.investigation.InvestigationController;
import com.candor.api.investigation.InvestigationService.AssignmentResult;
import com.candor.api.investigation.InvestigationService.InvestigationInfo;
import com.candor.api.refund.TimeoutRecoveryService.RefundResult;
import com.candor.api.report.ReportController.SubmitReportRequest;
import com.candor.api.report.ReportRegistryService.ReportInfo;
import com.candor.api.report.ReportRegistryService.SubmissionResult;
import com.candor.api.report.ReportRegistryService.SystemStats;
import com.candor.api.support.MutableClock;
import com.candor.core.domain.Principal;
import com.candor.core.domain.ReportStatus;
import com.candor.core.seal.SealedType;
import com.candor.oracle.codec.ClearValuesCodec;
import com.candor.oracle.proof.ProofSigner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the REST surface against the full application context.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class CandorApiIntegrationTest {

    private static final String AUTHORITY = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String INVESTIGATOR = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    private static final String OTHER_INVESTIGATOR = "0xcccccccccccccccccccccccccccccccccccccccc";
    private static final String REPORTER = "0xdddddddddddddddddddddddddddddddddddddddd";

    @TestConfiguration
    static class TestClockConfiguration {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        }
    }

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ClearValuesCodec codec;

    @Autowired
    private ProofSigner signer;

    // ==================== Full workflow ====================

    @Test
    void reportIsResolvedThroughRelayedOracleCallback() {
        ensureInvestigator(INVESTIGATOR);
        long reportId = submit(0, true, 50);

        ResponseEntity<AssignmentResult> assigned = rest.exchange("/api/v1/reports/{id}/assignment", HttpMethod.POST,
                entity(AUTHORITY, new InvestigationController.AssignRequest(INVESTIGATOR)), AssignmentResult.class, reportId);
        assertThat(assigned.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(assigned.getBody().status()).isEqualTo(ReportStatus.UNDER_INVESTIGATION);

        ResponseEntity<DecryptionTicket> ticket = rest.exchange("/api/v1/reports/{id}/decryption", HttpMethod.POST,
                entity(INVESTIGATOR, null), DecryptionTicket.class, reportId);
        assertThat(ticket.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(ticket.getBody().deadline()).isEqualTo(ticket.getBody().requestedAt().plus(Duration.ofDays(7)));

        long requestId = ticket.getBody().requestId();
        ResponseEntity<CallbackResult> callback = rest.postForEntity("/api/v1/decryption/callback",
                callbackRequest(requestId, 90, false), CallbackResult.class);
        assertThat(callback.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(callback.getBody().status()).isEqualTo(ReportStatus.RESOLVED);

        ResponseEntity<ReportInfo> info = rest.getForEntity("/api/v1/reports/{id}", ReportInfo.class, reportId);
        assertThat(info.getBody().revealedSeverity()).isEqualTo(90);
        assertThat(info.getBody().callbackCompleted()).isTrue();

        ResponseEntity<ErrorResponse> replay = rest.postForEntity("/api/v1/decryption/callback",
                callbackRequest(requestId, 90, false), ErrorResponse.class);
        assertThat(replay.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(replay.getBody().code()).isEqualTo("CASE_409");

        ResponseEntity<InvestigationInfo> investigation = rest.exchange("/api/v1/reports/{id}/investigation",
                HttpMethod.GET, entity(INVESTIGATOR, null), InvestigationInfo.class, reportId);
        assertThat(investigation.getBody().active()).isFalse();

        SystemStats stats = rest.getForObject("/api/v1/reports/stats", SystemStats.class);
        assertThat(stats.total()).isEqualTo(stats.resolved() + stats.pending() + stats.refunded());
        assertThat(stats.resolved()).isGreaterThanOrEqualTo(1);

        ChainVerification chain = rest.getForObject("/api/v1/events/verify", ChainVerification.class);
        assertThat(chain.valid()).isTrue();
    }

    @Test
    void stalledDecryptionIsRefundedAfterDeadline() {
        ensureInvestigator(INVESTIGATOR);
        long reportId = submit(1, false, 40);
        rest.exchange("/api/v1/reports/{id}/assignment", HttpMethod.POST,
                entity(AUTHORITY, new InvestigationController.AssignRequest(INVESTIGATOR)), AssignmentResult.class, reportId);
        rest.exchange("/api/v1/reports/{id}/decryption", HttpMethod.POST,
                entity(AUTHORITY, null), DecryptionTicket.class, reportId);

        ResponseEntity<ErrorResponse> early = rest.postForEntity(
                "/api/v1/reports/{id}/refund/decryption-timeout", null, ErrorResponse.class, reportId);
        assertThat(early.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);

        clock.advance(Duration.ofDays(8));
        ResponseEntity<RefundResult> refund = rest.postForEntity(
                "/api/v1/reports/{id}/refund/decryption-timeout", null, RefundResult.class, reportId);
        assertThat(refund.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(refund.getBody().status()).isEqualTo(ReportStatus.REFUNDED);

        ResponseEntity<ErrorResponse> again = rest.postForEntity(
                "/api/v1/reports/{id}/refund/decryption-timeout", null, ErrorResponse.class, reportId);
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    // ==================== Error mapping ====================

    @Test
    void invalidSubmissionIsBadRequest() {
        ResponseEntity<ErrorResponse> response = rest.exchange("/api/v1/reports", HttpMethod.POST,
                entity(REPORTER, new SubmitReportRequest(9, true, 50)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo("CASE_400");
        assertThat(response.getBody().message()).contains("Invalid category");
    }

    @Test
    void missingCallerIsUnauthorized() {
        long reportId = submit(0, true, 50);

        ResponseEntity<ErrorResponse> response = rest.getForEntity(
                "/api/v1/reports/{id}/investigation", ErrorResponse.class, reportId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().code()).isEqualTo("CASE_401");
    }

    @Test
    void malformedCallerIsBadRequest() {
        ResponseEntity<ErrorResponse> response = rest.exchange("/api/v1/reports", HttpMethod.POST,
                entity("not-an-address", new SubmitReportRequest(0, true, 50)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo("CASE_400");
        assertThat(response.getBody().message()).contains("Malformed address");
    }

    @Test
    void readsAndRefundChecksNeedNoCaller() {
        long reportId = submit(1, true, 20);

        assertThat(rest.getForEntity("/api/v1/reports/stats", SystemStats.class).getStatusCode())
                .isEqualTo(HttpStatus.OK);
        assertThat(rest.getForEntity("/api/v1/reports/{id}", ReportInfo.class, reportId).getStatusCode())
                .isEqualTo(HttpStatus.OK);
        ResponseEntity<ErrorResponse> refund = rest.postForEntity(
                "/api/v1/reports/{id}/refund/decryption-timeout", null, ErrorResponse.class, reportId);
        assertThat(refund.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ResponseEntity<ErrorResponse> sealed = rest.getForEntity(
                "/api/v1/reports/{id}/sealed", ErrorResponse.class, reportId);
        assertThat(sealed.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void wrongInvestigatorIsForbidden() {
        ensureInvestigator(INVESTIGATOR);
        ensureInvestigator(OTHER_INVESTIGATOR);
        long reportId = submit(2, true, 30);
        rest.exchange("/api/v1/reports/{id}/assignment", HttpMethod.POST,
                entity(AUTHORITY, new InvestigationController.AssignRequest(INVESTIGATOR)), AssignmentResult.class, reportId);

        ResponseEntity<ErrorResponse> response = rest.exchange("/api/v1/reports/{id}/notes", HttpMethod.PUT,
                entity(OTHER_INVESTIGATOR, new InvestigationController.NotesRequest("mine now")), ErrorResponse.class, reportId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody().code()).isEqualTo("CASE_403");
    }

    @Test
    void forgedProofIsUnprocessable() {
        ensureInvestigator(INVESTIGATOR);
        long reportId = submit(3, true, 60);
        rest.exchange("/api/v1/reports/{id}/assignment", HttpMethod.POST,
                entity(AUTHORITY, new InvestigationController.AssignRequest(INVESTIGATOR)), AssignmentResult.class, reportId);
        DecryptionTicket ticket = rest.exchange("/api/v1/reports/{id}/decryption", HttpMethod.POST,
                entity(INVESTIGATOR, null), DecryptionTicket.class, reportId).getBody();

        ResponseEntity<ErrorResponse> response = rest.postForEntity("/api/v1/decryption/callback",
                callbackRequest(ticket.requestId(), 95, true), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().code()).isEqualTo("CASE_422");
        ReportInfo info = rest.getForObject("/api/v1/reports/{id}", ReportInfo.class, reportId);
        assertThat(info.status()).isEqualTo(ReportStatus.DECRYPTION_PENDING);
        assertThat(info.callbackCompleted()).isFalse();
    }

    @Test
    void authorityIsReadable() {
        AccessController.AuthorityResponse response =
                rest.getForObject("/api/v1/access/authority", AccessController.AuthorityResponse.class);

        assertThat(Principal.of(response.authority())).isEqualTo(Principal.of(AUTHORITY));
    }

    // ==================== Helpers ====================

    private void ensureInvestigator(String address) {
        AccessController.RosterResponse roster = rest.getForObject(
                "/api/v1/access/investigators/{address}", AccessController.RosterResponse.class, address);
        if (!roster.authorized()) {
            ResponseEntity<AccessController.RosterResponse> added = rest.exchange("/api/v1/access/investigators",
                    HttpMethod.POST, entity(AUTHORITY, new AccessController.AddressRequest(address)),
                    AccessController.RosterResponse.class);
            assertThat(added.getStatusCode()).isEqualTo(HttpStatus.OK);
        }
    }

    private long submit(int category, boolean anonymous, int severity) {
        ResponseEntity<SubmissionResult> response = rest.exchange("/api/v1/reports", HttpMethod.POST,
                entity(REPORTER, new SubmitReportRequest(category, anonymous, severity)), SubmissionResult.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().reportId();
    }

    private CallbackRequest callbackRequest(long requestId, int severity, boolean forge) {
        byte[] clearValues = codec.encode(List.of(SealedType.UINT8, SealedType.UINT32, SealedType.UINT64),
                List.of(BigInteger.ZERO, BigInteger.valueOf(severity), BigInteger.valueOf(1_735_689_600L)));
        byte[] proof = signer.sign(requestId, clearValues);
        if (forge) {
            clearValues[31] = 5;
        }
        return new CallbackRequest(requestId, Numeric.toHexString(clearValues), Numeric.toHexString(proof));
    }

    private static HttpEntity<Object> entity(String principal, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Candor-Principal", principal);
        return new HttpEntity<>(body, headers);
    }
}
