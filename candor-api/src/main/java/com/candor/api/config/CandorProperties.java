package com.candor.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Case workflow settings.
 */
@Configuration
@ConfigurationProperties(prefix = "candor.case")
public class CandorProperties {

    private String authority;
    private Duration investigationWindow = Duration.ofDays(90);
    private Duration decryptionWindow = Duration.ofDays(7);
    private int autoResolveThreshold = 80;
    private long notesCostUnit = 1L;

    public String getAuthority() { return authority; }
    public void setAuthority(String authority) { this.authority = authority; }
    public Duration getInvestigationWindow() { return investigationWindow; }
    public void setInvestigationWindow(Duration investigationWindow) { this.investigationWindow = investigationWindow; }
    public Duration getDecryptionWindow() { return decryptionWindow; }
    public void setDecryptionWindow(Duration decryptionWindow) { this.decryptionWindow = decryptionWindow; }
    public int getAutoResolveThreshold() { return autoResolveThreshold; }
    public void setAutoResolveThreshold(int autoResolveThreshold) { this.autoResolveThreshold = autoResolveThreshold; }
    public long getNotesCostUnit() { return notesCostUnit; }
    public void setNotesCostUnit(long notesCostUnit) { this.notesCostUnit = notesCostUnit; }
}
