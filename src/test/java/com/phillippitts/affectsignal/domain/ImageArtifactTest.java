package com.phillippitts.affectsignal.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageArtifactTest {

    @Test
    void defaultsFileName() {
        ImageArtifact image = new ImageArtifact(new byte[]{1}, "image/png", " ");

        assertThat(image.fileName()).isEqualTo(ImageArtifact.DEFAULT_FILE_NAME);
        assertThat(image.size()).isEqualTo(1);
    }

    @Test
    void rejectsEmptyPayload() {
        assertThatThrownBy(() -> new ImageArtifact(new byte[0], "image/jpeg"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringOmitsPayload() {
        assertThat(new ImageArtifact(new byte[]{1, 2}, "image/jpeg").toString())
                .isEqualTo("ImageArtifact[frame.jpg, image/jpeg, 2 bytes]");
    }
}
