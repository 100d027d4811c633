package de.bsommerfeld.toolvault.app.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.toolvault.core.offline.OfflineConfig;

/**
 * Contents of {@code settings.json} in the application data directory.
 * Every key is optional; unknown keys are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolVaultSettings {

    /** Local mirror folder. Defaults to {@code <appData>/mirror}. */
    @JsonProperty("mirror_root")
    private String mirrorRoot;

    @JsonProperty("remote_manifest_url")
    private String remoteManifestUrl;

    @JsonProperty("offline_mode")
    private boolean offlineMode;

    @JsonProperty("force_offline")
    private boolean forceOffline;

    public String getMirrorRoot() {
        return mirrorRoot;
    }

    public void setMirrorRoot(String mirrorRoot) {
        this.mirrorRoot = mirrorRoot;
    }

    public String getRemoteManifestUrl() {
        return remoteManifestUrl;
    }

    public void setRemoteManifestUrl(String remoteManifestUrl) {
        this.remoteManifestUrl = remoteManifestUrl;
    }

    public boolean isOfflineMode() {
        return offlineMode;
    }

    public void setOfflineMode(boolean offlineMode) {
        this.offlineMode = offlineMode;
    }

    public boolean isForceOffline() {
        return forceOffline;
    }

    public void setForceOffline(boolean forceOffline) {
        this.forceOffline = forceOffline;
    }

    public boolean hasRemoteMirror() {
        return remoteManifestUrl != null && !remoteManifestUrl.isBlank();
    }

    public OfflineConfig offlineConfig() {
        return new OfflineConfig(offlineMode, forceOffline);
    }
}
