package com.playlistbridge.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.io.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Token files on disk, one JSON object per platform session.
 */
public class SessionFileStore {

    private static final Logger log = LoggerFactory.getLogger(SessionFileStore.class);

    private final ObjectMapper mapper;

    public SessionFileStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public AuthSession load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Token file not found: " + file);
        }
        AuthSession session = mapper.readValue(file.toFile(), AuthSession.class);
        if (session == null || (!session.hasAccessToken() && !session.canRefresh())) {
            throw new IOException("Token file " + file + " holds neither an access nor a refresh token");
        }
        return session;
    }

    public void save(Path file, AuthSession session) throws IOException {
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
        AtomicFileWriter.write(file, writer -> writer.write(json));
        log.debug("Wrote session tokens to {}", file);
    }
}
