package com.vidnyan.dre.application.port.out;

import com.vidnyan.dre.domain.request.ContextPackage;

import java.util.Optional;

/**
 * Keeps generated context packages for audit.
 */
public interface ContextPackageStore {

    void save(ContextPackage contextPackage);

    Optional<ContextPackage> find(String packageId);
}
