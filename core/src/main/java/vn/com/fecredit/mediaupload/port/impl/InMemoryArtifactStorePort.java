package vn.com.fecredit.mediaupload.port.impl;

import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.model.ArtifactDescriptor;
import vn.com.fecredit.mediaupload.port.interfaces.IArtifactStorePort;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of {@link IArtifactStorePort}.
 */
public class InMemoryArtifactStorePort implements IArtifactStorePort {

    private final Map<String, byte[]> artifacts = new ConcurrentHashMap<>();

    @Override
    public String store(ArtifactDescriptor descriptor, InputStream content) {
        byte[] bytes;
        try {
            bytes = content.readAllBytes();
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read artifact content for session " + descriptor.getSessionId(), e);
        }
        String reference = "memory:" + descriptor.getSessionId() + "/" + descriptor.getFilename();
        artifacts.put(reference, bytes);
        return reference;
    }

    @Override
    public InputStream open(String reference) {
        byte[] bytes = artifacts.get(reference);
        if (bytes == null) {
            throw new StorageUnavailableException("Artifact not found: " + reference);
        }
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public void delete(String reference) {
        artifacts.remove(reference);
    }

    public boolean contains(String reference) {
        return artifacts.containsKey(reference);
    }

    public int size() {
        return artifacts.size();
    }
}
