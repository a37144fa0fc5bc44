package com.vidnyan.dre.domain.error;

public class IntegrationNotFoundException extends DynamicRequestException {

    public IntegrationNotFoundException(String integrationId) {
        super("Integration not found: " + integrationId);
    }
}
