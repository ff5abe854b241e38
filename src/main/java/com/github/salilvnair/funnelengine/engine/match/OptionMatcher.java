package com.github.salilvnair.funnelengine.engine.match;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.model.MatchedOption;
import com.github.salilvnair.funnelengine.graph.model.BlockOption;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structural matcher: the normalized input must equal an option's 1-based number or its
 * normalized text. Options are tried top to bottom and the first hit wins.
 */
@Component
@RequiredArgsConstructor
public class OptionMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final FunnelEngineConfig config;

    public Optional<MatchedOption> match(FunnelBlock block, String rawInput) {
        if (block == null || rawInput == null || !block.hasOptions()) {
            return Optional.empty();
        }
        String input = normalize(rawInput);
        if (input.isEmpty()) {
            return Optional.empty();
        }
        List<BlockOption> options = block.options();
        for (int i = 0; i < options.size(); i++) {
            BlockOption option = options.get(i);
            int number = i + 1;
            if (config.getMatching().isNumericIndex() && input.equals(String.valueOf(number))) {
                return Optional.of(new MatchedOption(number, option));
            }
            if (input.equals(normalize(option.text()))) {
                return Optional.of(new MatchedOption(number, option));
            }
        }
        return Optional.empty();
    }

    public String normalize(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value;
        if (config.getMatching().isTrim()) {
            normalized = normalized.strip();
        }
        if (config.getMatching().isCollapseWhitespace()) {
            normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
