package org.arpha.conduit.server.dto;

import lombok.Builder;
import lombok.Data;
import org.arpha.conduit.configuration.ConfigurationManager;
import org.arpha.conduit.core.SilentCompletionPolicy;

@Data
@Builder
public class ServerProperties {

    @Builder.Default
    private String host = "0.0.0.0";
    @Builder.Default
    private int port = 8080;
    @Builder.Default
    private String rootPath = "/";
    @Builder.Default
    private int maxContentLength = 512 * 1024;
    @Builder.Default
    private SilentCompletionPolicy silentCompletion = SilentCompletionPolicy.IGNORE;

    public static ServerProperties initialize() {
        ConfigurationManager config = ConfigurationManager.getINSTANCE();

        return ServerProperties.builder()
                .host(config.getProperty("server.host", "0.0.0.0"))
                .port(config.getIntProperty("server.port", 8080))
                .rootPath(config.getProperty("server.rootPath", "/"))
                .maxContentLength(config.getIntProperty("server.maxContentLength", 512 * 1024))
                .silentCompletion(config.getEnumProperty("pipeline.silentCompletion",
                        SilentCompletionPolicy.class, SilentCompletionPolicy.IGNORE))
                .build();
    }

}
