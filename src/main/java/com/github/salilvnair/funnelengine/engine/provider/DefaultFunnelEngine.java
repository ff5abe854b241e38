package com.github.salilvnair.funnelengine.engine.provider;

import com.github.salilvnair.funnelengine.engine.core.FunnelEngine;
import com.github.salilvnair.funnelengine.engine.factory.TransitionPipelineFactory;
import com.github.salilvnair.funnelengine.engine.model.AdvanceResult;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

@RequiredArgsConstructor
@Component
public class DefaultFunnelEngine implements FunnelEngine {

    private final TransitionPipelineFactory pipelineFactory;
    private final Clock clock;

    @Override
    public AdvanceResult advance(FunnelGraph graph, FeConversation conversation, String rawInput) {
        TransitionSession session = new TransitionSession(graph, conversation, rawInput, OffsetDateTime.now(clock));
        return pipelineFactory.create().execute(session);
    }
}
