package org.braceform.engine.passes;

import com.typesafe.config.Config;

/**
 * Opaque gates and switches for the normalization passes, read from the {@code braceform}
 * section of the application configuration.
 *
 * @param virtualBraces          Run the brace virtualization pass.
 * @param virtualSemicolons      Run the virtual semicolon insertion.
 * @param semicolonScope         Which statements the insertion considers.
 * @param scrubVirtualSemicolons Run the scrub that hides redundant virtual semicolons.
 * @param normalizeConditionals  Pair parallel branches of conditional groups.
 * @param squeezeIfdef           Collapse blank lines around directives nested in braces.
 * @param squeezeIfdefTopLevel   Also collapse them around level-0 directives.
 * @param emitVirtualSemicolons  Render visible virtual semicolons as {@code ;}.
 */
public record PassOptions(
        boolean virtualBraces,
        boolean virtualSemicolons,
        SemicolonScope semicolonScope,
        boolean scrubVirtualSemicolons,
        boolean normalizeConditionals,
        boolean squeezeIfdef,
        boolean squeezeIfdefTopLevel,
        boolean emitVirtualSemicolons
) {

    public PassOptions {
        if (semicolonScope == null) {
            throw new IllegalArgumentException("semicolonScope must not be null");
        }
    }

    /** @return The defaults shipped in {@code reference.conf}. */
    public static PassOptions defaults() {
        return new PassOptions(true, true, SemicolonScope.VIRTUAL_BLOCKS, true, true, true, false, false);
    }

    /**
     * Reads options from a configuration. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The root application config (containing {@code braceform { ... }}) or the
     *               {@code braceform} section itself.
     * @return The options.
     * @throws com.typesafe.config.ConfigException.BadValue if {@code semicolon-scope} is not a known scope.
     */
    public static PassOptions fromConfig(Config config) {
        Config options = config.hasPath("braceform") ? config.getConfig("braceform") : config;
        PassOptions d = defaults();
        return new PassOptions(
                flag(options, "passes.virtual-braces", d.virtualBraces()),
                flag(options, "passes.virtual-semicolons", d.virtualSemicolons()),
                options.hasPath("passes.semicolon-scope")
                        ? options.getEnum(SemicolonScope.class, "passes.semicolon-scope")
                        : d.semicolonScope(),
                flag(options, "passes.scrub-virtual-semicolons", d.scrubVirtualSemicolons()),
                flag(options, "passes.normalize-conditionals", d.normalizeConditionals()),
                flag(options, "passes.squeeze-ifdef", d.squeezeIfdef()),
                flag(options, "passes.squeeze-ifdef-top-level", d.squeezeIfdefTopLevel()),
                flag(options, "output.emit-virtual-semicolons", d.emitVirtualSemicolons())
        );
    }

    /** @return A copy with {@code emitVirtualSemicolons} replaced. */
    public PassOptions withEmitVirtualSemicolons(boolean emit) {
        return new PassOptions(virtualBraces, virtualSemicolons, semicolonScope, scrubVirtualSemicolons,
                normalizeConditionals, squeezeIfdef, squeezeIfdefTopLevel, emit);
    }

    /** @return A copy with {@code semicolonScope} replaced. */
    public PassOptions withSemicolonScope(SemicolonScope scope) {
        return new PassOptions(virtualBraces, virtualSemicolons, scope, scrubVirtualSemicolons,
                normalizeConditionals, squeezeIfdef, squeezeIfdefTopLevel, emitVirtualSemicolons);
    }

    private static boolean flag(Config options, String path, boolean fallback) {
        return options.hasPath(path) ? options.getBoolean(path) : fallback;
    }
}
