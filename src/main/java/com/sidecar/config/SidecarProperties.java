package com.sidecar.config;

import com.sidecar.core.model.ProtocolVersion;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sidecar.sse")
public class SidecarProperties {

    private String apiVersion = "1.5.2";
    private long emitterTimeoutMs = 30 * 60 * 1000L;
    private long heartbeatIntervalSeconds = 30;

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public long getEmitterTimeoutMs() {
        return emitterTimeoutMs;
    }

    public void setEmitterTimeoutMs(long emitterTimeoutMs) {
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    public long getHeartbeatIntervalSeconds() {
        return heartbeatIntervalSeconds;
    }

    public void setHeartbeatIntervalSeconds(long heartbeatIntervalSeconds) {
        this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
    }

    public ProtocolVersion protocolVersion() {
        return ProtocolVersion.parse(apiVersion);
    }
}
