package com.vidnyan.dre.domain.error;

/**
 * Results were asked for before the request reached a terminal state.
 */
public class ResultsNotAvailableException extends DynamicRequestException {

    public ResultsNotAvailableException(String requestId, String status) {
        super("Results for request " + requestId + " are not available yet (status " + status + ")");
    }
}
