package com.nistpubid.core.grammar;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;

class CompactMarkerTest {

    @Test
    void pattern_longerMarkerMatchesFirst() {
        Matcher version = CompactMarker.VERSION.pattern().matcher("ver2");
        Matcher volume = CompactMarker.VOLUME.pattern().matcher("ver2");

        assertThat(version.lookingAt()).isTrue();
        assertThat(version.group(1)).isEqualTo("2");
        assertThat(volume.lookingAt()).isFalse();
        assertThat(CompactMarker.VERSION.ordinal()).isLessThan(CompactMarker.VOLUME.ordinal());
    }

    @Test
    void pattern_partAcceptsAlphanumericLabel() {
        Matcher part = CompactMarker.PART.pattern().matcher("pt1Ar4");

        assertThat(part.lookingAt()).isTrue();
        assertThat(part.group(1)).isEqualTo("1A");
    }

    @Test
    void renderOrder_placesVolumeFirstAndEditionLast() {
        assertThat(CompactMarker.renderOrder()).containsExactly(
            CompactMarker.VOLUME, CompactMarker.PART, CompactMarker.VERSION, CompactMarker.REVISION, CompactMarker.EDITION);
    }

    @Test
    void renderOrder_returnsCopy() {
        CompactMarker[] order = CompactMarker.renderOrder();
        order[0] = CompactMarker.EDITION;

        assertThat(CompactMarker.renderOrder()[0]).isEqualTo(CompactMarker.VOLUME);
    }

    @Test
    void addendumPrefix_omitsFirstNumber() {
        assertThat(Vocabulary.LONG.addendumPrefix(1)).isEqualTo("Addendum to ");
        assertThat(Vocabulary.ABBREV.addendumPrefix(3)).isEqualTo("Add. 3 to ");
    }
}
