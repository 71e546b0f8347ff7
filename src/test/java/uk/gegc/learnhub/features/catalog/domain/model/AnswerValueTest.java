package uk.gegc.learnhub.features.catalog.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnswerValueTest {

    @Test
    @DisplayName("SINGLE answers match by exact value")
    void singleMatchesByEquality() {
        assertThat(AnswerValue.single("B").matches(AnswerValue.single("B"))).isTrue();
        assertThat(AnswerValue.single("B").matches(AnswerValue.single("b"))).isFalse();
    }

    @Test
    @DisplayName("MULTIPLE answers match regardless of order")
    void multipleMatchesAsSet() {
        AnswerValue expected = AnswerValue.multiple("A", "C");

        assertThat(expected.matches(AnswerValue.multiple("C", "A"))).isTrue();
        assertThat(expected.matches(AnswerValue.multiple("A"))).isFalse();
        assertThat(expected.matches(AnswerValue.multiple("A", "C", "D"))).isFalse();
    }

    @Test
    @DisplayName("Answers of different kinds never match")
    void differentKindsNeverMatch() {
        assertThat(AnswerValue.single("A").matches(AnswerValue.multiple("A"))).isFalse();
        assertThat(AnswerValue.single("A").matches(null)).isFalse();
    }

    @Test
    @DisplayName("Construction rejects empty, null-valued and multi-valued SINGLE answers")
    void rejectsMalformedAnswers() {
        assertThatThrownBy(() -> new AnswerValue(AnswerKind.MULTIPLE, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnswerValue(AnswerKind.MULTIPLE, Arrays.asList("A", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnswerValue(AnswerKind.SINGLE, List.of("A", "B")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnswerValue(null, List.of("A")))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Converter stores answers as JSON and reads them back")
    void converterStoresJson() {
        AnswerValueConverter converter = new AnswerValueConverter();

        String json = converter.convertToDatabaseColumn(AnswerValue.multiple("A", "C"));

        assertThat(json).contains("\"MULTIPLE\"");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(AnswerValue.multiple("A", "C"));
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }
}
