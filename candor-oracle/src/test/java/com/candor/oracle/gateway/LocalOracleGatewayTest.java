package com.candor.oracle.gateway;

import com.candor.core.seal.DecryptionResponse;
import com.candor.core.seal.PendingDecryption;
import com.candor.core.seal.SealedHandle;
import com.candor.core.seal.SealedType;
import com.candor.oracle.OracleConfig;
import com.candor.oracle.codec.ClearValuesCodec;
import com.candor.oracle.proof.ProofSigner;
import com.candor.oracle.proof.SignatureProofVerifier;
import com.candor.oracle.vault.SealedValueVault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class LocalOracleGatewayTest {

    private static final List<SealedType> DISCLOSED = List.of(SealedType.UINT8, SealedType.UINT32, SealedType.UINT64);

    private OracleConfig config;
    private SealedValueVault vault;
    private ClearValuesCodec codec;
    private ProofSigner signer;
    private LocalOracleGateway gateway;

    @BeforeEach
    void setUp() {
        config = new OracleConfig();
        config.setAutoRespond(false);
        vault = new SealedValueVault(config);
        codec = new ClearValuesCodec();
        signer = new ProofSigner(config);
        gateway = new LocalOracleGateway(config, vault, codec, signer);
    }

    @AfterEach
    void tearDown() {
        gateway.destroy();
    }

    @Test
    void requestIdsAreSequentialFromOne() {
        List<SealedHandle> handles = sealDisclosed(1, 40, 1_700_000_000L);

        assertThat(gateway.requestReveal(handles).requestId()).isEqualTo(1L);
        assertThat(gateway.requestReveal(handles).requestId()).isEqualTo(2L);
        assertThat(gateway.outstandingRequestIds()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void manualFulfillCompletesWithVerifiableResponse() throws Exception {
        PendingDecryption pending = gateway.requestReveal(sealDisclosed(3, 90, 1_700_000_000L));
        assertThat(pending.response()).isNotDone();

        gateway.fulfill(pending.requestId());

        DecryptionResponse response = pending.response().get(1, TimeUnit.SECONDS);
        assertThat(response.requestId()).isEqualTo(pending.requestId());
        assertThat(codec.decode(response.clearValues(), DISCLOSED))
                .containsExactly(BigInteger.valueOf(3), BigInteger.valueOf(90), BigInteger.valueOf(1_700_000_000L));
        assertThat(new SignatureProofVerifier(config, signer)
                .verify(response.requestId(), response.clearValues(), response.proof())).isTrue();
        assertThat(gateway.outstandingRequestIds()).isEmpty();
    }

    @Test
    void requestIsAnsweredOnlyOnce() {
        PendingDecryption pending = gateway.requestReveal(sealDisclosed(0, 10, 1L));
        gateway.fulfill(pending.requestId());

        assertThatThrownBy(() -> gateway.fulfill(pending.requestId()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownRequestIsRejected() {
        assertThatThrownBy(() -> gateway.fulfill(42))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("42");
    }

    @Test
    void unknownHandleIsRejectedAtRequestTime() {
        SealedHandle forged = new SealedHandle("sealed:forged", SealedType.UINT8);

        assertThatThrownBy(() -> gateway.requestReveal(List.of(forged)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.requestReveal(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void autoRespondAnswersAfterDelay() throws Exception {
        OracleConfig auto = new OracleConfig();
        auto.setResponseDelay(Duration.ofMillis(10));
        LocalOracleGateway autoGateway = new LocalOracleGateway(auto, vault, codec, signer);
        try {
            PendingDecryption pending = autoGateway.requestReveal(sealDisclosed(2, 55, 99L));

            DecryptionResponse response = pending.response().get(5, TimeUnit.SECONDS);

            assertThat(codec.decode(response.clearValues(), DISCLOSED).get(1)).isEqualTo(BigInteger.valueOf(55));
        } finally {
            autoGateway.destroy();
        }
    }

    private List<SealedHandle> sealDisclosed(int category, int severity, long timestamp) {
        return List.of(
                vault.seal(SealedType.UINT8, BigInteger.valueOf(category)),
                vault.seal(SealedType.UINT32, BigInteger.valueOf(severity)),
                vault.seal(SealedType.UINT64, BigInteger.valueOf(timestamp)));
    }
}
