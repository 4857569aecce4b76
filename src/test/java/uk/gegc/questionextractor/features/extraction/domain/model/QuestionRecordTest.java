package uk.gegc.questionextractor.features.extraction.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuestionRecord Tests")
class QuestionRecordTest {

    @Test
    @DisplayName("constructor: copies options and images so later changes do not leak in")
    void constructor_copiesCollections() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("b", "second");
        options.put("a", "first");
        List<QuestionImage> images = new ArrayList<>(List.of(new QuestionImage("image_1.png", new byte[]{1})));

        QuestionRecord record = new QuestionRecord(1, "Stem", options, null, null, images);
        options.put("c", "late");
        images.clear();

        assertThat(record.options()).containsExactly(Map.entry("b", "second"), Map.entry("a", "first"));
        assertThat(record.images()).hasSize(1);
        assertThatThrownBy(() -> record.options().put("d", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("constructor: null stem, options and images become empty values")
    void constructor_nullsBecomeEmpty() {
        QuestionRecord record = new QuestionRecord(null, null, null, null, null, null);

        assertThat(record.stem()).isEmpty();
        assertThat(record.options()).isEmpty();
        assertThat(record.images()).isEmpty();
    }

    @Test
    @DisplayName("equals: records with equal image bytes compare equal")
    void equals_comparesImageContent() {
        QuestionRecord first = new QuestionRecord(2, "S", Map.of(), "a", null,
                List.of(new QuestionImage("image_1.png", new byte[]{1, 2})));
        QuestionRecord second = new QuestionRecord(2, "S", Map.of(), "a", null,
                List.of(new QuestionImage("image_1.png", new byte[]{1, 2})));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    @DisplayName("image: finds an image by filename")
    void image_lookup() {
        QuestionRecord record = QuestionRecord.of(
                new QuestionFields(3, "S", Map.of(), null, null),
                List.of(new QuestionImage("image_4.gif", new byte[]{9})));

        assertThat(record.image("image_4.gif")).map(QuestionImage::size).contains(1);
        assertThat(record.image("image_5.gif")).isEmpty();
    }

    @Test
    @DisplayName("QuestionImage: content is copied on the way in and out")
    void questionImage_defensiveCopies() {
        byte[] bytes = {1, 2, 3};
        QuestionImage image = new QuestionImage("image_1.png", bytes);
        bytes[0] = 9;
        image.content()[1] = 9;

        assertThat(image.content()).containsExactly(1, 2, 3);
    }
}
