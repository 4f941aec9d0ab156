package com.example.render_tracker.backend;

import com.example.render_tracker.exception.UnsupportedJobMetadataException;
import com.example.render_tracker.util.RenderBackend;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a status query to the client registered for the job's backend.
 */
@Component
public class RenderBackendAdapter {
    private final Map<RenderBackend, RenderBackendClient> clients = new EnumMap<>(RenderBackend.class);

    public RenderBackendAdapter(List<RenderBackendClient> clients) {
        for (RenderBackendClient client : clients) {
            RenderBackendClient previous = this.clients.putIfAbsent(client.backend(), client);
            if (previous != null) {
                throw new IllegalStateException("Duplicate render backend client for " + client.backend());
            }
        }
    }

    public BackendStatus query(RenderBackend backend, String correlationId) {
        RenderBackendClient client = clients.get(backend);
        if (client == null) {
            throw new UnsupportedJobMetadataException("No render backend client registered for " + backend);
        }
        return client.query(correlationId);
    }
}
