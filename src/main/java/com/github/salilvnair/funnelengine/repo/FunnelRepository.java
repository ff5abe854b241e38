package com.github.salilvnair.funnelengine.repo;

import com.github.salilvnair.funnelengine.entity.FeFunnel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface FunnelRepository extends JpaRepository<FeFunnel, Long> {

    Optional<FeFunnel> findFirstByFunnelIdAndPublishedTrueOrderByVersionDesc(String funnelId);
}
