package com.questrail.svga.codec;

import com.questrail.svga.config.SvgaCodecConfig;
import com.questrail.svga.observability.NullObservabilitySink;
import com.questrail.svga.observability.Slf4jSvgaObservabilitySink;
import com.questrail.svga.observability.SvgaObservabilitySink;
import com.questrail.svga.schema.SvgaSchema;
import com.questrail.svga.schema.SvgaSchemaRegistry;

import java.util.Objects;

/**
 * Everything a decoder or encoder needs, constructed once at startup and
 * handed to each codec explicitly.
 */
public record SvgaCodecContext(
        SvgaSchema schema,
        SvgaCodecConfig config,
        SvgaObservabilitySink sink
) {
    public SvgaCodecContext {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");
    }

    /**
     * Shared schema, default configuration, SLF4J logging.
     *
     * @throws DependencyUnavailableException if the schema cannot be built
     */
    public static SvgaCodecContext defaults() {
        return new SvgaCodecContext(
                SvgaSchemaRegistry.shared(),
                SvgaCodecConfig.defaults(),
                new Slf4jSvgaObservabilitySink());
    }

    /**
     * Shared schema, default configuration, no observability output.
     */
    public static SvgaCodecContext silent() {
        return new SvgaCodecContext(
                SvgaSchemaRegistry.shared(),
                SvgaCodecConfig.defaults(),
                NullObservabilitySink.INSTANCE);
    }

    public SvgaCodecContext withSink(SvgaObservabilitySink newSink) {
        return new SvgaCodecContext(schema, config, newSink);
    }

    public SvgaCodecContext withConfig(SvgaCodecConfig newConfig) {
        return new SvgaCodecContext(schema, newConfig, sink);
    }
}
