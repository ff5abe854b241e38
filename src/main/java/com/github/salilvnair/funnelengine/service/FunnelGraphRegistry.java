package com.github.salilvnair.funnelengine.service;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeFunnel;
import com.github.salilvnair.funnelengine.graph.FunnelGraphParser;
import com.github.salilvnair.funnelengine.repo.FunnelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Latest published, validated graph per funnel id. Malformed documents are refused here and
 * never reach the transition engine.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class FunnelGraphRegistry {

    public static final String CACHE_NAME = "fe_funnel_graph";

    private final FunnelRepository funnelRepository;
    private final FunnelGraphParser parser;

    @Cacheable(CACHE_NAME)
    public PublishedFunnel graphFor(String funnelId) {
        FeFunnel funnel = funnelRepository.findFirstByFunnelIdAndPublishedTrueOrderByVersionDesc(funnelId)
                .orElseThrow(() -> new FunnelEngineException(FunnelEngineErrorCode.FUNNEL_NOT_FOUND,
                        "No published funnel found for id " + funnelId));
        PublishedFunnel published = new PublishedFunnel(funnel.getFunnelId(), funnel.getVersion(), funnel.getScope(),
                parser.parse(funnel.getFlowJson()));
        log.info("Loaded funnel {} v{} ({} blocks, {} stages)", funnelId, funnel.getVersion(),
                published.graph().blocks().size(), published.graph().stages().size());
        return published;
    }

    @CacheEvict(value = CACHE_NAME, key = "#funnelId")
    public void evict(String funnelId) {
        log.info("Evicted cached graph for funnel {}", funnelId);
    }

    @CacheEvict(value = CACHE_NAME, allEntries = true)
    public void evictAll() {
        log.info("Evicted all cached funnel graphs");
    }
}
