package com.vidnyan.dre.adapter.out.store;

import com.vidnyan.dre.application.port.out.RequestArchive;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.RequestTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local archive of terminal requests. Entries are never removed.
 */
@Slf4j
@Component
public class InMemoryRequestArchive implements RequestArchive {

    private final Map<String, ArchivedRequest> archived = new ConcurrentHashMap<>();

    @Override
    public void archive(AgentRequest request, List<RequestTransition> history) {
        if (!request.isComplete()) {
            throw new IllegalStateException("Only terminal requests can be archived: " + request.getRequestId());
        }
        archived.putIfAbsent(request.getRequestId(), new ArchivedRequest(request, List.copyOf(history)));
        log.debug("Archived request {} ({})", request.getRequestId(), request.getStatus());
    }

    @Override
    public Optional<AgentRequest> find(String requestId) {
        return Optional.ofNullable(archived.get(requestId)).map(ArchivedRequest::request);
    }

    @Override
    public List<RequestTransition> history(String requestId) {
        ArchivedRequest entry = archived.get(requestId);
        return entry == null ? List.of() : entry.history();
    }

    private record ArchivedRequest(AgentRequest request, List<RequestTransition> history) {
    }
}
