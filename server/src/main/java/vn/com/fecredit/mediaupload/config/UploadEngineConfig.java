package vn.com.fecredit.mediaupload.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.mediaupload.core.SessionReaper;
import vn.com.fecredit.mediaupload.port.impl.FileSystemArtifactStorePort;
import vn.com.fecredit.mediaupload.port.impl.FileSystemChunkStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.IArtifactStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;
import vn.com.fecredit.mediaupload.service.ChunkUploadService;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the storage adapters and the session reaper of the upload engine.
 */
@Configuration
public class UploadEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(UploadEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IChunkStorePort chunkStorePort(@Value("${mediaupload.chunk-dir:uploads/chunks}") String chunkDir) throws IOException {
        log.info("Storing chunks under {}", chunkDir);
        return new FileSystemChunkStorePort(chunkDir);
    }

    @Bean
    public IArtifactStorePort artifactStorePort(@Value("${mediaupload.artifact-dir:uploads/complete}") String artifactDir) throws IOException {
        log.info("Storing merged artifacts under {}", artifactDir);
        return new FileSystemArtifactStorePort(artifactDir);
    }

    @Bean
    public SessionReaper sessionReaper(ChunkUploadService uploadService, Clock clock,
                                       @Value("${mediaupload.session-ttl:PT30M}") Duration ttl,
                                       @Value("${mediaupload.terminal-retention:P7D}") Duration retention) {
        return new SessionReaper(uploadService, clock, ttl, retention);
    }
}
