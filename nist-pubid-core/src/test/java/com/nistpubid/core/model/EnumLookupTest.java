package com.nistpubid.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the code lookups of {@link Publisher} and {@link Stage}, and for {@link Update}.
 */
class EnumLookupTest {

    @Test
    void publisherFromCode_ignoresCase() {
        assertThat(Publisher.fromCode("nbs")).contains(Publisher.NBS);
        assertThat(Publisher.fromCode("NIST")).contains(Publisher.NIST);
        assertThat(Publisher.fromCode("ANSI")).isEmpty();
        assertThat(Publisher.fromCode(null)).isEmpty();
    }

    @Test
    void stageFromCode_findsEveryStage() {
        for (Stage stage : Stage.values()) {
            assertThat(Stage.fromCode(stage.code())).contains(stage);
        }
        assertThat(Stage.fromCode("ipd")).contains(Stage.INITIAL_PUBLIC_DRAFT);
        assertThat(Stage.fromCode("XYZ")).isEmpty();
    }

    @Test
    void stageMatchDisplayName_requiresWordBoundary() {
        assertThat(Stage.matchDisplayName("Final Public Draft 800-53")).contains(Stage.FINAL_PUBLIC_DRAFT);
        assertThat(Stage.matchDisplayName("Work-in-Progress Draft")).contains(Stage.WORK_IN_PROGRESS_DRAFT);
        assertThat(Stage.matchDisplayName("Final Public Drafts 800-53")).isEmpty();
        assertThat(Stage.matchDisplayName("800-53")).isEmpty();
    }

    @Test
    void update_validDates_areAccepted() {
        assertThat(Update.of(1, "2015").hasDate()).isTrue();
        assertThat(Update.of(1, "201503").date()).isEqualTo("201503");
        assertThat(Update.of(1, "20150301").date()).isEqualTo("20150301");
        assertThat(Update.undated(2).hasDate()).isFalse();
    }

    @Test
    void update_invalidDate_throws() {
        assertThatThrownBy(() -> Update.of(1, "15"))
            .hasMessageContaining("YYYY");
        assertThatThrownBy(() -> Update.of(-1, null))
            .hasMessageContaining("negative");
    }
}
