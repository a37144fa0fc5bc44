package com.vidnyan.dre.domain.error;

public class RequestNotFoundException extends DynamicRequestException {

    public RequestNotFoundException(String requestId) {
        super("Request not found: " + requestId);
    }
}
