package com.github.salilvnair.funnelengine.engine.steps;

import com.github.salilvnair.funnelengine.engine.match.OptionMatcher;
import com.github.salilvnair.funnelengine.engine.model.AdvanceOutcome;
import com.github.salilvnair.funnelengine.engine.model.MatchedOption;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.funnelengine.engine.render.BlockRenderer;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(ResolveCurrentBlockStep.class)
public class MatchOptionStep implements TransitionStep {

    private final OptionMatcher optionMatcher;
    private final BlockRenderer blockRenderer;

    @Override
    public StepResult execute(TransitionSession session) {
        FunnelBlock block = session.getCurrentBlock();

        // an option-less block ends the funnel on whatever comes next
        if (!block.hasOptions()) {
            session.setOutcome(AdvanceOutcome.CLOSED);
            return new StepResult.Continue();
        }

        Optional<MatchedOption> matched = optionMatcher.match(block, session.getRawInput());
        if (matched.isEmpty()) {
            log.debug("No option of block {} matched input '{}' convId={}",
                    block.id(), session.getRawInput(), session.getConversationId());
            session.setOutcome(AdvanceOutcome.INVALID_INPUT);
            session.setBotOutput(blockRenderer.render(block, session.getConversation()));
            return new StepResult.Stop(session.toResult());
        }

        MatchedOption option = matched.get();
        log.debug("Block {} matched option {} ('{}') convId={}",
                block.id(), option.number(), option.option().text(), session.getConversationId());
        session.setMatchedOption(option);
        session.setOutcome(option.option().isTerminal() ? AdvanceOutcome.CLOSED : AdvanceOutcome.ADVANCED);
        return new StepResult.Continue();
    }
}
