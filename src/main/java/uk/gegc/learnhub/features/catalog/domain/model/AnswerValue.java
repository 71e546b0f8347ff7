package uk.gegc.learnhub.features.catalog.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A quiz answer, either the expected one stored on a question or one submitted by a learner.
 * <p>
 * {@link AnswerKind#SINGLE} holds exactly one value and matches by equality.
 * {@link AnswerKind#MULTIPLE} holds one or more values and matches regardless of order.
 * Answers of different kinds never match.
 */
public record AnswerValue(AnswerKind kind, List<String> values) {

    public AnswerValue {
        Objects.requireNonNull(kind, "kind must not be null");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Answer must carry at least one value");
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Answer values must not be null");
        }
        if (kind == AnswerKind.SINGLE && values.size() != 1) {
            throw new IllegalArgumentException("SINGLE answer must carry exactly one value");
        }
        values = List.copyOf(values);
    }

    public static AnswerValue single(String value) {
        return new AnswerValue(AnswerKind.SINGLE, List.of(value));
    }

    public static AnswerValue multiple(String... values) {
        return new AnswerValue(AnswerKind.MULTIPLE, List.of(values));
    }

    public boolean matches(AnswerValue other) {
        if (other == null || other.kind != kind) {
            return false;
        }
        if (kind == AnswerKind.SINGLE) {
            return values.get(0).equals(other.values.get(0));
        }
        return new HashSet<>(values).equals(new HashSet<>(other.values));
    }
}
