package io.github.cyfko.zapformat.core.ast;

import java.util.List;

/**
 * Root of a parsed Zap source text.
 * <p>
 * Options and items are kept in two separate lists, each in source order. Interleaving of
 * options with items in the source is not recorded: options always render first.
 * </p>
 *
 * @param options the {@code opt} declarations
 * @param items   comments, events, functions, namespaces and type definitions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ZapConfiguration(List<OptionNode> options, List<ConfigItem> items) {

    public ZapConfiguration {
        options = List.copyOf(options);
        items = List.copyOf(items);
    }
}
