package dk.cloudcreate.eventcore.common.result;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResultTest {
    @Test
    void verify_failure_classification_walks_the_cause_chain() {
        // Given
        var conflict = new ClassifiedException(FailureKind.CONCURRENCY_CONFLICT);
        var wrapped  = new RuntimeException("Commit failed", new IllegalStateException("Inner", conflict));

        // When
        var failure = Failure.from(wrapped);

        // Then
        assertThat(failure.kind()).isEqualTo(FailureKind.CONCURRENCY_CONFLICT);
        assertThat(failure.cause()).isSameAs(conflict);
    }

    @Test
    void verify_unclassified_failures_are_storage_errors() {
        var failure = Failure.from(new Exception("Disk full"));

        assertThat(failure.kind()).isEqualTo(FailureKind.STORAGE_ERROR);
        assertThat(failure.message()).isEqualTo("Disk full");
        assertThat(failure.cause()).hasCauseInstanceOf(Exception.class);
    }

    @Test
    void verify_success_and_failure_accessors() {
        var success = Result.success("value");
        assertThat(success.isSuccess()).isTrue();
        assertThat(success.map(String::length).value()).isEqualTo(5);
        assertThatThrownBy(success::failure).isInstanceOf(IllegalStateException.class);

        Result<String> failure = Result.failure(FailureKind.NOT_FOUND, new IllegalArgumentException("Missing"));
        assertThat(failure.isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
        assertThat(failure.map(String::length).isFailure()).isTrue();
        assertThatThrownBy(failure::value).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(failure::orElseThrow).isInstanceOf(IllegalArgumentException.class)
                                                .hasMessage("Missing");
    }

    private static class ClassifiedException extends RuntimeException implements FailureKindAware {
        private final FailureKind kind;

        ClassifiedException(FailureKind kind) {
            super(kind.name());
            this.kind = kind;
        }

        @Override
        public FailureKind failureKind() {
            return kind;
        }
    }
}
