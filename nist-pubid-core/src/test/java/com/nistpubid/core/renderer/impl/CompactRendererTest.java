package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.PubId;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Stage;
import com.nistpubid.core.model.Update;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ShortRenderer} and {@link MachineReadableRenderer}.
 */
class CompactRendererTest {

    private final ShortRenderer shortRenderer = new ShortRenderer();
    private final MachineReadableRenderer mrRenderer = new MachineReadableRenderer();

    @Test
    void render_allQualifiers_usesCanonicalOrder() {
        PubId pubId = PubId.builder()
            .publisher(Publisher.NIST)
            .series("NCSTAR")
            .docNumber("1-1C")
            .translation("ESP")
            .revision(2)
            .version(3)
            .part("B")
            .volume(1)
            .stage(Stage.WORK_IN_PROGRESS_DRAFT)
            .update(Update.of(1, "2021"))
            .build();

        assertThat(shortRenderer.render(pubId)).isEqualTo("NIST NCSTAR(WD) 1-1Cv1ptBver3r2/Upd 1:2021(esp)");
        assertThat(mrRenderer.render(pubId)).isEqualTo("NIST.NCSTAR.WD.1-1Cv1ptBver3r2.u1-2021(esp)");
    }

    @Test
    void render_versionOutsideVolumeSeries_usesShortMarker() {
        PubId pubId = PubId.builder()
            .publisher(Publisher.NIST)
            .series("SP")
            .docNumber("1800-25")
            .version(2)
            .build();

        assertThat(shortRenderer.render(pubId)).isEqualTo("NIST SP 1800-25v2");
    }

    @Test
    void render_numberedAddendum_includesNumber() {
        PubId pubId = PubId.builder()
            .publisher(Publisher.NBS)
            .series("CIRC")
            .docNumber("500")
            .addendum(2)
            .build();

        assertThat(shortRenderer.render(pubId)).isEqualTo("NBS CIRC 500 Addendum 2");
        assertThat(mrRenderer.render(pubId)).isEqualTo("NBS.CIRC.500.add-2");
    }

    @Test
    void render_undatedUpdate_omitsDate() {
        PubId pubId = PubId.builder()
            .publisher(Publisher.NIST)
            .series("SP")
            .docNumber("800-53")
            .revision(4)
            .update(Update.undated(1))
            .build();

        assertThat(shortRenderer.render(pubId)).isEqualTo("NIST SP 800-53r4/Upd 1");
        assertThat(mrRenderer.render(pubId)).isEqualTo("NIST.SP.800-53r4.u1");
    }

    @Test
    void render_multiWordSeriesCode_dotsInMachineReadable() {
        PubId pubId = PubId.builder()
            .publisher(Publisher.NIST)
            .series("FIPS")
            .docNumber("140-3")
            .build();

        assertThat(shortRenderer.render(pubId)).isEqualTo("NIST FIPS PUB 140-3");
        assertThat(mrRenderer.render(pubId)).isEqualTo("NIST.FIPS.PUB.140-3");
    }
}
