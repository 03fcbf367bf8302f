package com.nistpubid.core.renderer;

import com.nistpubid.core.PubId;

/**
 * Projection of a {@link PubId} into one {@link PubIdStyle}.
 *
 * <p>Rendering is total: every identifier that could be built can be rendered, so
 * implementations never throw for a valid {@link PubId}. Implementations are stateless and
 * shared between threads.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI); exactly one renderer
 * must be registered per style.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.nistpubid.core.renderer.StyleRenderer}
 *
 * @see PubIdRenderer
 */
public interface StyleRenderer {

    /**
     * Returns the style this renderer produces.
     *
     * @return output style
     */
    PubIdStyle getStyle();

    /**
     * Renders an identifier.
     *
     * @param pubId identifier to render
     * @return identifier text in this renderer's style
     */
    String render(PubId pubId);
}
