package com.nistpubid.core.renderer;

import com.nistpubid.core.PubId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Dispatches rendering of a {@link PubId} to the {@link StyleRenderer} of the requested style.
 *
 * <p>The no-argument constructor discovers renderers through {@link ServiceLoader}. Either
 * constructor fails when a style is left without a renderer or has two, so a constructed
 * instance can render every style.
 */
public class PubIdRenderer {

    private static final Logger log = LoggerFactory.getLogger(PubIdRenderer.class);

    private final Map<PubIdStyle, StyleRenderer> renderers = new EnumMap<>(PubIdStyle.class);

    /**
     * Creates a renderer backed by the style renderers registered in {@code META-INF/services}.
     *
     * @throws IllegalStateException if a style has no registered renderer or more than one
     */
    public PubIdRenderer() {
        this(discover());
    }

    /**
     * Creates a renderer backed by the given style renderers.
     *
     * @param styleRenderers one renderer per style
     * @throws IllegalStateException if a style has no renderer or more than one
     */
    public PubIdRenderer(Collection<? extends StyleRenderer> styleRenderers) {
        Objects.requireNonNull(styleRenderers, "styleRenderers must not be null");
        for (StyleRenderer renderer : styleRenderers) {
            StyleRenderer previous = renderers.putIfAbsent(renderer.getStyle(), renderer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate renderers for style " + renderer.getStyle() + ": "
                    + previous.getClass().getName() + ", " + renderer.getClass().getName());
            }
            log.debug("Registered {} for style {}", renderer.getClass().getSimpleName(), renderer.getStyle());
        }
        for (PubIdStyle style : PubIdStyle.values()) {
            if (!renderers.containsKey(style)) {
                throw new IllegalStateException("No renderer registered for style " + style);
            }
        }
    }

    /**
     * Renders an identifier in the given style.
     *
     * @param pubId identifier to render
     * @param style output style
     * @return identifier text
     */
    public String render(PubId pubId, PubIdStyle style) {
        Objects.requireNonNull(pubId, "pubId must not be null");
        Objects.requireNonNull(style, "style must not be null");
        return renderers.get(style).render(pubId);
    }

    private static List<StyleRenderer> discover() {
        return ServiceLoader.load(StyleRenderer.class, StyleRenderer.class.getClassLoader())
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }
}
