package com.neutrala.session;

import com.neutrala.core.TracerException;
import com.neutrala.platform.PlatformAdapter;
import com.neutrala.platform.TraceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Creates a fresh session directory under the configured work dir. Nothing here deletes
 * sessions; eviction is handled outside the tracer.
 */
@Component
public class SessionAllocator {

    private static final Logger log = LoggerFactory.getLogger(SessionAllocator.class);

    private final TraceProperties traceProperties;
    private final PlatformAdapter platformAdapter;

    public SessionAllocator(TraceProperties traceProperties, PlatformAdapter platformAdapter) {
        this.traceProperties = traceProperties;
        this.platformAdapter = platformAdapter;
    }

    public SessionArtifacts allocate(String sourceExtension) {
        String sessionId = UUID.randomUUID().toString();
        Path dir = traceProperties.workDirPath().resolve(sessionId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TracerException("Could not create session directory " + dir, e);
        }
        log.debug("Allocated session {} at {}", sessionId, dir);
        return SessionArtifacts.in(dir, sessionId, sourceExtension,
                platformAdapter.executableFileName("exec_" + sessionId));
    }
}
