package com.github.salilvnair.funnelengine.engine.render;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.BlockOption;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.link.LinkResolver;
import com.github.salilvnair.funnelengine.link.LinkSource;
import com.github.salilvnair.funnelengine.link.ResolvedLink;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import com.github.salilvnair.funnelengine.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockRendererTest {

    @Mock
    private LinkResolver linkResolver;

    private BlockRenderer renderer;
    private FeConversation conversation;

    @BeforeEach
    void setUp() {
        FunnelEngineConfig config = TestEngines.config();
        renderer = new BlockRenderer(linkResolver, config);
        conversation = FunnelFixtures.conversationAt(BLOCK_VALUE_ECOM, new MutableClock().nowOffset());
    }

    @Test
    void substitutesResolvedLinkAndListsOptions() {
        when(linkResolver.resolve(RESOURCE_GUIDE, conversation))
                .thenReturn(new ResolvedLink(GUIDE_TAGGED_LINK, LinkSource.DIRECTORY));
        FunnelBlock block = new FunnelBlock(BLOCK_VALUE_ECOM, "Guide: [LINK] (also [LINK])",
                List.of(new BlockOption(OPTION_DONE, BLOCK_TRANSITION), new BlockOption("More", BLOCK_WELCOME)),
                RESOURCE_GUIDE);

        String text = renderer.render(block, conversation);

        assertEquals("Guide: " + GUIDE_TAGGED_LINK + " (also " + GUIDE_TAGGED_LINK + ")\n\n1. Done\n2. More", text);
    }

    @Test
    void placeholderWithoutResourceGetsFallbackLink() {
        when(linkResolver.fallbackUrl()).thenReturn(FALLBACK_URL);
        FunnelBlock block = new FunnelBlock("b", "See [LINK]", List.of(), null);

        assertEquals("See " + FALLBACK_URL, renderer.render(block, conversation));
    }

    @Test
    void plainMessageIsRenderedAsIs() {
        FunnelBlock block = new FunnelBlock("b", "Bye", List.of(), null);

        assertEquals("Bye", renderer.render(block, conversation));
        verifyNoInteractions(linkResolver);
    }

    @Test
    void fallbackFromResolverIsSubstitutedToo() {
        when(linkResolver.resolve(any(), any())).thenReturn(new ResolvedLink(FALLBACK_URL, LinkSource.FALLBACK));
        FunnelBlock block = new FunnelBlock("b", "[LINK]", List.of(), "Missing");

        assertEquals(FALLBACK_URL, renderer.render(block, conversation));
    }
}
