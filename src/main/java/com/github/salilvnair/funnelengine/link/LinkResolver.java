package com.github.salilvnair.funnelengine.link;

import com.github.salilvnair.funnelengine.entity.FeConversation;

public interface LinkResolver {

    /**
     * Resolves the link for {@code resourceName} on behalf of {@code conversation}. A link taken
     * from the resource directory is stored on the conversation passed in, so later calls
     * return it verbatim.
     */
    ResolvedLink resolve(String resourceName, FeConversation conversation);

    String fallbackUrl();
}
