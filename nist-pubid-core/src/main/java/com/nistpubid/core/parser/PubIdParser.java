package com.nistpubid.core.parser;

import com.nistpubid.core.PubId;
import com.nistpubid.core.exception.InvalidPubIdException;
import com.nistpubid.core.exception.MalformedDocNumberException;
import com.nistpubid.core.exception.PubIdParseException;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.series.SeriesRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses publication identifier strings into {@link PubId} instances.
 *
 * <p>Accepts every style the renderers produce:
 * <ul>
 *   <li><b>Short:</b> {@code NIST SP 800-53r5}, {@code NIST SP(IPD) 800-53r5}, {@code NBS FIPS PUB 100}</li>
 *   <li><b>Machine-readable:</b> {@code NIST.SP.800-53r4.u3-2015}, {@code NIST.SP.800-38A.add-1}</li>
 *   <li><b>Long:</b> {@code National Institute of Standards and Technology Special Publication 800-53, Revision 5}</li>
 *   <li><b>Abbreviated:</b> {@code Natl. Bur. Stand. Spec. Publ. 800-53, Rev. 5}</li>
 * </ul>
 * plus legacy spellings such as {@code NISTIR 8115}, {@code NBS FIPS 100} and
 * {@code NBS CRPL-F-B150}, which resolve to their current series.
 *
 * <p>Failures are reported as {@link com.nistpubid.core.exception.UnknownSeriesException} when the
 * series cannot be resolved and as {@link MalformedDocNumberException} for anything wrong after
 * the series, including qualifier combinations the model rejects. Nothing is guessed or
 * silently dropped.
 *
 * <p>Parsing is pure and the parser is immutable; one instance may be shared between threads.
 */
public class PubIdParser {

    private static final Logger log = LoggerFactory.getLogger(PubIdParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final SeriesRegistry registry;
    private final CompactGrammar compactGrammar;
    private final DescriptiveGrammar descriptiveGrammar;

    /**
     * Creates a parser resolving series against the given registry.
     *
     * @param registry series registry
     */
    public PubIdParser(SeriesRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.compactGrammar = new CompactGrammar(registry);
        this.descriptiveGrammar = new DescriptiveGrammar(registry);
    }

    /**
     * Parses an identifier.
     *
     * @param text identifier in any supported style
     * @return parsed identifier
     * @throws com.nistpubid.core.exception.UnknownSeriesException if the series cannot be resolved
     * @throws MalformedDocNumberException if the document number or qualifiers are malformed
     */
    public PubId parse(String text) throws PubIdParseException {
        if (text == null || text.isBlank()) {
            throw new MalformedDocNumberException(text, "PubID must not be blank");
        }
        InputStyle style = detectStyle(text.trim());
        log.debug("Parsing PubID '{}' as {}", text, style);

        PubId.Builder builder = switch (style) {
            case SHORT, MR -> compactGrammar.parse(text, style);
            case DESCRIPTIVE -> descriptiveGrammar.parse(text);
        };
        try {
            return builder.build();
        } catch (InvalidPubIdException e) {
            throw new MalformedDocNumberException(text, e.getMessage() + " in '" + text + "'", e);
        }
    }

    /**
     * Decides which grammar applies to the text.
     *
     * @param text trimmed identifier text
     * @return input style
     */
    InputStyle detectStyle(String text) {
        if (!WHITESPACE.matcher(text).find()) {
            return InputStyle.MR;
        }
        String head = text.split("\\s+", 2)[0];
        boolean compactHead = Publisher.fromCode(head).isPresent() || registry.resolveCompound(head).isPresent();
        if (compactHead && !descriptiveGrammar.startsWithEmbeddedTitle(text)) {
            return InputStyle.SHORT;
        }
        return InputStyle.DESCRIPTIVE;
    }

    public SeriesRegistry getRegistry() {
        return registry;
    }
}
