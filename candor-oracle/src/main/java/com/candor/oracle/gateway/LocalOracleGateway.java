package com.candor.oracle.gateway;

import com.candor.core.seal.DecryptionGateway;
import com.candor.core.seal.DecryptionResponse;
import com.candor.core.seal.PendingDecryption;
import com.candor.core.seal.SealedHandle;
import com.candor.core.seal.SealedType;
import com.candor.oracle.OracleConfig;
import com.candor.oracle.codec.ClearValuesCodec;
import com.candor.oracle.proof.ProofSigner;
import com.candor.oracle.vault.SealedValueVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process decryption oracle.
 *
 * Requests get sequential ids from 1. With auto-respond on, each request is decrypted,
 * encoded and signed on a scheduler thread after the configured delay; otherwise it stays
 * outstanding until {@link #fulfill} is called.
 */
@Service
public class LocalOracleGateway implements DecryptionGateway, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LocalOracleGateway.class);

    private final SealedValueVault vault;
    private final ClearValuesCodec codec;
    private final ProofSigner signer;
    private final boolean autoRespond;
    private final Duration responseDelay;

    private final AtomicLong lastRequestId = new AtomicLong();
    private final Map<Long, OutstandingRequest> outstanding = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public LocalOracleGateway(OracleConfig config, SealedValueVault vault, ClearValuesCodec codec, ProofSigner signer) {
        this.vault = vault;
        this.codec = codec;
        this.signer = signer;
        this.autoRespond = config.isAutoRespond();
        this.responseDelay = config.getResponseDelay();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "candor-oracle");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public PendingDecryption requestReveal(List<SealedHandle> handles) {
        Objects.requireNonNull(handles, "Handles cannot be null");
        if (handles.isEmpty()) {
            throw new IllegalArgumentException("At least one handle is required");
        }
        handles.forEach(handle -> {
            if (!vault.exists(handle)) {
                throw new IllegalArgumentException("Unknown sealed handle: " + handle.id());
            }
        });

        long requestId = lastRequestId.incrementAndGet();
        CompletableFuture<DecryptionResponse> response = new CompletableFuture<>();
        outstanding.put(requestId, new OutstandingRequest(List.copyOf(handles), response));
        log.debug("Decryption request {} accepted for {} handles", requestId, handles.size());

        if (autoRespond) {
            scheduler.schedule(() -> fulfillQuietly(requestId), responseDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
        return new PendingDecryption(requestId, response);
    }

    /**
     * Answers an outstanding request now and completes its future.
     *
     * @throws IllegalArgumentException if the request is unknown or already answered
     */
    public DecryptionResponse fulfill(long requestId) {
        OutstandingRequest request = outstanding.remove(requestId);
        if (request == null) {
            throw new IllegalArgumentException("No outstanding decryption request " + requestId);
        }
        try {
            List<SealedType> types = request.handles().stream().map(SealedHandle::type).toList();
            List<BigInteger> values = request.handles().stream().map(vault::decryptForOracle).toList();
            byte[] clearValues = codec.encode(types, values);
            DecryptionResponse response = new DecryptionResponse(requestId, clearValues, signer.sign(requestId, clearValues));
            request.response().complete(response);
            return response;
        } catch (RuntimeException e) {
            request.response().completeExceptionally(e);
            throw e;
        }
    }

    public Set<Long> outstandingRequestIds() {
        return Set.copyOf(outstanding.keySet());
    }

    @Override
    public void destroy() {
        scheduler.shutdownNow();
    }

    private void fulfillQuietly(long requestId) {
        try {
            fulfill(requestId);
        } catch (RuntimeException e) {
            log.warn("Oracle failed to answer decryption request {}: {}", requestId, e.getMessage());
        }
    }

    private record OutstandingRequest(List<SealedHandle> handles, CompletableFuture<DecryptionResponse> response) {}
}
