package com.github.salilvnair.funnelengine.store;

import com.github.salilvnair.funnelengine.repo.ResourceRepository;
import com.github.salilvnair.funnelengine.spi.FunnelResource;
import com.github.salilvnair.funnelengine.spi.ResourceDirectory;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class JpaResourceDirectory implements ResourceDirectory {

    private final ResourceRepository resourceRepository;

    @Override
    public Optional<FunnelResource> findResource(String name, String scope) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return resourceRepository.findFirstByNameAndScopeAndEnabledTrueOrderByResourceIdAsc(name, scope)
                .map(r -> new FunnelResource(r.getName(), r.getLink(), r.getCategory()));
    }
}
