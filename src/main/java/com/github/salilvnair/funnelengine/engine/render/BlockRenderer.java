package com.github.salilvnair.funnelengine.engine.render;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.BlockOption;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.link.LinkResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class BlockRenderer {

    private final LinkResolver linkResolver;
    private final FunnelEngineConfig config;

    /**
     * Message with the link placeholder substituted, followed by a blank line and the
     * numbered options. Resolving a resource link caches it on {@code conversation}.
     */
    public String render(FunnelBlock block, FeConversation conversation) {
        String message = block.message() == null ? "" : block.message();
        String placeholder = config.getLink().getPlaceholder();
        if (block.hasResource()) {
            String url = linkResolver.resolve(block.resourceName(), conversation).url();
            message = substitute(message, placeholder, url);
        }
        else if (placeholder != null && !placeholder.isEmpty() && message.contains(placeholder)) {
            message = substitute(message, placeholder, linkResolver.fallbackUrl());
        }
        return message + renderOptions(block.options());
    }

    private String substitute(String message, String placeholder, String url) {
        if (placeholder == null || placeholder.isEmpty()) {
            return message;
        }
        return message.replace(placeholder, url == null ? "" : url);
    }

    private String renderOptions(List<BlockOption> options) {
        if (options.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\n");
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". ").append(options.get(i).text());
        }
        return sb.toString();
    }
}
