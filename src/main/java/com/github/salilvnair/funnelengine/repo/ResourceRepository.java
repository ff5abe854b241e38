package com.github.salilvnair.funnelengine.repo;

import com.github.salilvnair.funnelengine.entity.FeResource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ResourceRepository extends JpaRepository<FeResource, Long> {

    Optional<FeResource> findFirstByNameAndScopeAndEnabledTrueOrderByResourceIdAsc(String name, String scope);
}
