package com.vidnyan.dre.adapter.out.store;

import com.vidnyan.dre.application.port.out.ContextPackageStore;
import com.vidnyan.dre.domain.request.ContextPackage;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryContextPackageStore implements ContextPackageStore {

    private final Map<String, ContextPackage> packages = new ConcurrentHashMap<>();

    @Override
    public void save(ContextPackage contextPackage) {
        packages.putIfAbsent(contextPackage.packageId(), contextPackage);
    }

    @Override
    public Optional<ContextPackage> find(String packageId) {
        return Optional.ofNullable(packages.get(packageId));
    }
}
