package com.candor.oracle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the sealing vault and the decryption oracle.
 */
@Configuration
@ConfigurationProperties(prefix = "candor.oracle")
public class OracleConfig {

    private String signerPrivateKey;
    private List<String> trustedSigners = new ArrayList<>();
    private int signatureThreshold = 1;
    private boolean autoRespond = true;
    private Duration responseDelay = Duration.ofSeconds(2);
    private String masterKey; // Base64, 32 bytes

    public String getSignerPrivateKey() { return signerPrivateKey; }
    public void setSignerPrivateKey(String signerPrivateKey) { this.signerPrivateKey = signerPrivateKey; }
    public List<String> getTrustedSigners() { return trustedSigners; }
    public void setTrustedSigners(List<String> trustedSigners) { this.trustedSigners = trustedSigners; }
    public int getSignatureThreshold() { return signatureThreshold; }
    public void setSignatureThreshold(int signatureThreshold) { this.signatureThreshold = signatureThreshold; }
    public boolean isAutoRespond() { return autoRespond; }
    public void setAutoRespond(boolean autoRespond) { this.autoRespond = autoRespond; }
    public Duration getResponseDelay() { return responseDelay; }
    public void setResponseDelay(Duration responseDelay) { this.responseDelay = responseDelay; }
    public String getMasterKey() { return masterKey; }
    public void setMasterKey(String masterKey) { this.masterKey = masterKey; }
}
