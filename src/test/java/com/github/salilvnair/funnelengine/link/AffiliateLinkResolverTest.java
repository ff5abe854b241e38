package com.github.salilvnair.funnelengine.link;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import com.github.salilvnair.funnelengine.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AffiliateLinkResolverTest {

    private FunnelEngineConfig config;
    private TestEngines.MapResourceDirectory directory;
    private AffiliateLinkResolver resolver;
    private FeConversation conversation;

    @BeforeEach
    void setUp() {
        config = TestEngines.config();
        directory = new TestEngines.MapResourceDirectory();
        resolver = new AffiliateLinkResolver(directory, config);
        conversation = FunnelFixtures.conversationAt(BLOCK_VALUE_ECOM, new MutableClock().nowOffset());
    }

    @Test
    void directoryLinkIsTaggedWithScopeAndCached() {
        directory.put(RESOURCE_GUIDE, SCOPE, GUIDE_RAW_LINK);

        ResolvedLink link = resolver.resolve(RESOURCE_GUIDE, conversation);

        assertEquals(new ResolvedLink(GUIDE_TAGGED_LINK, LinkSource.DIRECTORY), link);
        assertEquals(GUIDE_TAGGED_LINK, conversation.resolvedLinkFor(RESOURCE_GUIDE));
    }

    @Test
    void linkWithExistingAttributionIsNotTaggedTwice() {
        directory.put(RESOURCE_AFFILIATE, SCOPE, AFFILIATE_RAW_LINK);

        assertEquals(AFFILIATE_RAW_LINK, resolver.resolve(RESOURCE_AFFILIATE, conversation).url());
        assertTrue(resolver.hasAttribution("https://x/y?APP=other"));
        assertFalse(resolver.hasAttribution(GUIDE_RAW_LINK));
    }

    @Test
    void cachedLinkSurvivesDirectoryChanges() {
        directory.put(RESOURCE_GUIDE, SCOPE, GUIDE_RAW_LINK);
        resolver.resolve(RESOURCE_GUIDE, conversation);
        directory.put(RESOURCE_GUIDE, SCOPE, "https://x/rotated");

        ResolvedLink again = resolver.resolve(RESOURCE_GUIDE, conversation);

        assertEquals(new ResolvedLink(GUIDE_TAGGED_LINK, LinkSource.CACHED), again);
    }

    @Test
    void missingResourceFallsBackWithoutCaching() {
        ResolvedLink link = resolver.resolve(RESOURCE_GUIDE, conversation);

        assertTrue(link.isFallback());
        assertEquals(FALLBACK_URL, link.url());
        assertNull(conversation.resolvedLinkFor(RESOURCE_GUIDE));

        directory.put(RESOURCE_GUIDE, SCOPE, GUIDE_RAW_LINK);
        assertEquals(LinkSource.DIRECTORY, resolver.resolve(RESOURCE_GUIDE, conversation).source());
    }

    @Test
    void resourcesAreLookedUpWithinTheConversationScope() {
        directory.put(RESOURCE_GUIDE, "other_scope", GUIDE_RAW_LINK);

        assertTrue(resolver.resolve(RESOURCE_GUIDE, conversation).isFallback());
    }

    @Test
    void configuredAttributionValueWinsOverScope() {
        config.getLink().setAttributionValue("partner");
        directory.put(RESOURCE_GUIDE, SCOPE, GUIDE_RAW_LINK);

        assertEquals(GUIDE_RAW_LINK + "?app=partner", resolver.resolve(RESOURCE_GUIDE, conversation).url());
    }

    @Test
    void funnelIdIsUsedWhenScopeIsMissing() {
        conversation.setScope(null);
        directory.put(RESOURCE_GUIDE, null, GUIDE_RAW_LINK);

        assertEquals(GUIDE_RAW_LINK + "?app=" + FUNNEL_ID, resolver.resolve(RESOURCE_GUIDE, conversation).url());
    }
}
