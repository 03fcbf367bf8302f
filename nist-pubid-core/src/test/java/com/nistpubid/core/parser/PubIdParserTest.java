package com.nistpubid.core.parser;

import com.nistpubid.core.PubId;
import com.nistpubid.core.exception.MalformedDocNumberException;
import com.nistpubid.core.exception.PubIdParseException;
import com.nistpubid.core.exception.UnknownSeriesException;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Stage;
import com.nistpubid.core.series.SeriesRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PubIdParserTest {

    private PubIdParser parser;

    @BeforeEach
    void setUp() {
        parser = new PubIdParser(SeriesRegistry.defaultRegistry());
    }

    // ========== Style detection ==========

    @Test
    void detectStyle_noWhitespace_isMachineReadable() {
        assertThat(parser.detectStyle("NIST.SP.800-53r5")).isEqualTo(InputStyle.MR);
    }

    @Test
    void detectStyle_publisherCodeHead_isShort() {
        assertThat(parser.detectStyle("NIST SP 800-53r5")).isEqualTo(InputStyle.SHORT);
        assertThat(parser.detectStyle("NISTIR 8115")).isEqualTo(InputStyle.SHORT);
    }

    @Test
    void detectStyle_publisherName_isDescriptive() {
        assertThat(parser.detectStyle("Natl. Inst. Stand. Technol. Spec. Publ. 800-53")).isEqualTo(InputStyle.DESCRIPTIVE);
        assertThat(parser.detectStyle("Addendum to National Bureau of Standards Circular 5")).isEqualTo(InputStyle.DESCRIPTIVE);
    }

    @Test
    void detectStyle_titleNamingPublisher_isDescriptive() {
        assertThat(parser.detectStyle("NIST Cybersecurity White Paper 5")).isEqualTo(InputStyle.DESCRIPTIVE);
        assertThat(parser.detectStyle("NIST CSWP 5")).isEqualTo(InputStyle.SHORT);
    }

    // ========== Short form ==========

    @Test
    void parse_shortForm_extractsAllFields() throws PubIdParseException {
        PubId pubId = parser.parse("NIST SP(2PD) 800-57pt1r4/Upd 2:202001(fra)");

        assertThat(pubId.getPublisher()).isEqualTo(Publisher.NIST);
        assertThat(pubId.getSeries().code()).isEqualTo("SP");
        assertThat(pubId.getDocNumber().value()).isEqualTo("800-57");
        assertThat(pubId.getStage()).isEqualTo(Stage.SECOND_PUBLIC_DRAFT);
        assertThat(pubId.getPart()).isEqualTo("1");
        assertThat(pubId.getRevision()).isEqualTo(4);
        assertThat(pubId.getUpdate().number()).isEqualTo(2);
        assertThat(pubId.getUpdate().date()).isEqualTo("202001");
        assertThat(pubId.getTranslation()).isEqualTo("fra");
    }

    @Test
    void parse_shortFormUndatedUpdate_hasNoDate() throws PubIdParseException {
        PubId pubId = parser.parse("NIST SP 800-53r4/Upd 1");

        assertThat(pubId.getUpdate().hasDate()).isFalse();
        assertThat(pubId.getUpdate().number()).isEqualTo(1);
    }

    @Test
    void parse_numberedAddendum_keepsNumber() throws PubIdParseException {
        PubId pubId = parser.parse("NIST SP 800-38A Addendum 2");

        assertThat(pubId.getAddendum()).isEqualTo(2);
        assertThat(pubId.getDocNumber().subSeries()).isEqualTo("A");
    }

    @Test
    void parse_lowerCasePublisherAndSeries_resolves() throws PubIdParseException {
        PubId pubId = parser.parse("nist sp 800-53r5");

        assertThat(pubId.toString()).isEqualTo("NIST SP 800-53r5");
    }

    @Test
    void parse_versionMarkerOutsideVolumeSeries_isVersion() throws PubIdParseException {
        PubId pubId = parser.parse("NIST CSWP 5v2");

        assertThat(pubId.getVersion()).isEqualTo(2);
        assertThat(pubId.getVolume()).isNull();
    }

    @Test
    void parse_volumeAndVersionInVolumeSeries_keepsBoth() throws PubIdParseException {
        PubId pubId = parser.parse("NIST NCSTAR 1-1Cv1ver2");

        assertThat(pubId.getVolume()).isEqualTo(1);
        assertThat(pubId.getVersion()).isEqualTo(2);
        assertThat(pubId.toString()).isEqualTo("NIST NCSTAR 1-1Cv1ver2");
    }

    @Test
    void parse_nbsCompound_resolvesInteragencyReport() throws PubIdParseException {
        PubId pubId = parser.parse("NBSIR 85-3273");

        assertThat(pubId.getPublisher()).isEqualTo(Publisher.NBS);
        assertThat(pubId.toString()).isEqualTo("NBS IR 85-3273");
    }

    @Test
    void parse_legacyAlias_resolvesCanonicalSeries() throws PubIdParseException {
        assertThat(parser.parse("NBS LCIRC 1050").toString()).isEqualTo("NBS LC 1050");
    }

    // ========== Machine-readable form ==========

    @Test
    void parse_machineReadable_extractsSuffixes() throws PubIdParseException {
        PubId pubId = parser.parse("NIST.SP.IPD.800-53r4.u3-2015");

        assertThat(pubId.getStage()).isEqualTo(Stage.INITIAL_PUBLIC_DRAFT);
        assertThat(pubId.getRevision()).isEqualTo(4);
        assertThat(pubId.getUpdate().number()).isEqualTo(3);
        assertThat(pubId.getUpdate().date()).isEqualTo("2015");
    }

    @Test
    void parse_machineReadableNumberedAddendum_keepsNumber() throws PubIdParseException {
        assertThat(parser.parse("NIST.SP.800-38A.add-3").getAddendum()).isEqualTo(3);
    }

    // ========== Descriptive forms ==========

    @Test
    void parse_longFormWithAllClauses_extractsFields() throws PubIdParseException {
        PubId pubId = parser.parse(
            "National Institute of Standards and Technology Special Publication Final Public Draft 800-57 Part 2 Version 3, Revision 1 Update 1:20200115 (SPA)");

        assertThat(pubId.getStage()).isEqualTo(Stage.FINAL_PUBLIC_DRAFT);
        assertThat(pubId.getPart()).isEqualTo("2");
        assertThat(pubId.getVersion()).isEqualTo(3);
        assertThat(pubId.getRevision()).isEqualTo(1);
        assertThat(pubId.getUpdate().date()).isEqualTo("20200115");
        assertThat(pubId.getTranslation()).isEqualTo("spa");
    }

    @Test
    void parse_abbreviatedNumberedAddendum_keepsNumber() throws PubIdParseException {
        PubId pubId = parser.parse("Add. 2 to Natl. Bur. Stand. Circ. 500");

        assertThat(pubId.getPublisher()).isEqualTo(Publisher.NBS);
        assertThat(pubId.getAddendum()).isEqualTo(2);
        assertThat(pubId.toString()).isEqualTo("NBS CIRC 500 Addendum 2");
    }

    @Test
    void parse_mixedVocabulary_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("Natl. Inst. Stand. Technol. Spec. Publ. 800-53, Revision 5"))
            .isInstanceOf(MalformedDocNumberException.class);
    }

    @Test
    void parse_unknownSeriesTitle_throwsUnknownSeries() {
        assertThatThrownBy(() -> parser.parse("National Institute of Standards and Technology Secret Report 12"))
            .isInstanceOf(UnknownSeriesException.class);
    }

    // ========== Errors ==========

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void parse_blankInput_throwsMalformed(String input) {
        assertThatThrownBy(() -> parser.parse(input))
            .isInstanceOf(MalformedDocNumberException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ACME SP 800-53", "NIST WRONG-SERIE 800-11", "NIST 800-53", "NBS CSWP 5", "NIST CIRC 5"})
    void parse_unresolvableSeries_throwsUnknownSeries(String input) {
        assertThatThrownBy(() -> parser.parse(input))
            .isInstanceOf(UnknownSeriesException.class)
            .satisfies(e -> assertThat(((PubIdParseException) e).input()).isEqualTo(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "NIST SP WRONG-CODE",
        "NIST SP",
        "NIST SP 800-53r5r6",
        "NIST SP 800-53x",
        "NIST SP 800-53 extra",
        "NIST SP(XYZ) 800-53",
        "NIST.SP.800-53.",
        "NIST.SP.800-53.z9",
        "NBS FIPS PUB 100-1-2",
        "NIST SP 800-53r99999999999",
        "NIST SP 800-53(ESP)",
        "NIST.SP.800-53(x1)",
        "NIST.SP.IPD.IPD.800-53",
        "National Institute of Standards and Technology Special Publication",
        "Natl. Inst. Stand. Technol. Spec. Publ. Initial Public Draft",
        "NIST Cybersecurity White Paper",
        "National Institute of Standards and Technology Special Publication 800-53 (esp)"
    })
    void parse_malformedRemainder_throwsMalformed(String input) {
        assertThatThrownBy(() -> parser.parse(input))
            .isInstanceOf(MalformedDocNumberException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "NIST SP 800-53(IPD)",
        "NIST.SP.800-53(IPD)",
        "NIST SP 800-53r5(fpd)",
        "National Institute of Standards and Technology Special Publication 800-53 (IPD)"
    })
    void parse_stageCodeAfterDocNumber_throwsMalformed(String input) {
        assertThatThrownBy(() -> parser.parse(input))
            .isInstanceOf(MalformedDocNumberException.class)
            .hasMessageContaining("Draft stage");
    }

    @Test
    void parse_repeatedMachineReadableStage_namesOffendingToken() {
        assertThatThrownBy(() -> parser.parse("NIST.SP.IPD.IPD.800-53"))
            .isInstanceOf(MalformedDocNumberException.class)
            .hasMessageStartingWith("Unexpected token 'IPD'");
    }

    @Test
    void parse_seriesTitleWithoutDocNumber_throwsMissingDocNumber() {
        assertThatThrownBy(() -> parser.parse("National Institute of Standards and Technology Special Publication"))
            .isInstanceOf(MalformedDocNumberException.class)
            .hasMessageContaining("Missing document number");
    }

    @Test
    void parse_addendumPrefixInOtherWording_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("Addendum to Natl. Inst. Stand. Technol. Spec. Publ. 800-38A"))
            .isInstanceOf(MalformedDocNumberException.class)
            .hasMessageContaining("Addendum prefix");
        assertThatThrownBy(() -> parser.parse("Add. to National Institute of Standards and Technology Special Publication 800-38A"))
            .isInstanceOf(MalformedDocNumberException.class);
    }

    @Test
    void parse_lowerCaseTranslation_isTranslation() throws PubIdParseException {
        PubId pubId = parser.parse("NIST SP 800-53r5(esp)");

        assertThat(pubId.getTranslation()).isEqualTo("esp");
        assertThat(pubId.getStage()).isNull();
    }

    @Test
    void parse_volumeInSeriesWithoutVolumes_isReadAsVersion() throws PubIdParseException {
        assertThat(parser.parse("NIST SP 800-53v2").getVersion()).isEqualTo(2);
    }
}
