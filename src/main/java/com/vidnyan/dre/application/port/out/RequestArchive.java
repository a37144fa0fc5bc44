package com.vidnyan.dre.application.port.out;

import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.RequestTransition;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for requests that reached a terminal state.
 */
public interface RequestArchive {

    void archive(AgentRequest request, List<RequestTransition> history);

    Optional<AgentRequest> find(String requestId);

    List<RequestTransition> history(String requestId);
}
