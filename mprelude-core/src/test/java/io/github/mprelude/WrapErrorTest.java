package io.github.mprelude;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WrapErrorTest {

    @Test
    void normalCompletionIsRight() {
        Either<Throwable, Integer> result = Either.wrapError(Collections.singleton(ArithmeticException.class), () -> 42);

        assertThat(result).isEqualTo(Either.right(42));
    }

    @Test
    void classifiedErrorIsLeft() {
        int zero = 0;
        Either<Throwable, Integer> result = Either.wrapError(Collections.singleton(ArithmeticException.class),
            () -> 1 / zero);

        assertThat(result.isLeft()).isTrue();
        assertThat(result.fromLeft()).isInstanceOf(ArithmeticException.class).hasMessage("/ by zero");
    }

    @Test
    void anyListedKindMatches() {
        IllegalStateException error = new IllegalStateException("closed");
        Either<Throwable, Object> result = Either.wrapError(
            Arrays.asList(ArithmeticException.class, IllegalStateException.class),
            () -> {
                throw error;
            });

        assertThat(result.fromLeft()).isSameAs(error);
    }

    @Test
    void subclassOfListedKindMatches() {
        Either<Throwable, Object> result = Either.wrapError(Collections.singleton(RuntimeException.class),
            () -> {
                throw new UnsupportedOperationException();
            });

        assertThat(result.fromLeft()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void unclassifiedErrorPropagates() {
        IllegalArgumentException error = new IllegalArgumentException("unrelated");

        assertThatThrownBy(() -> Either.wrapError(Collections.singleton(ArithmeticException.class), () -> {
            throw error;
        })).isSameAs(error);
        assertThatThrownBy(() -> Either.wrapError(Collections.emptySet(), () -> {
            throw error;
        })).isSameAs(error);
    }

    @Test
    void errorsPropagate() {
        StackOverflowError error = new StackOverflowError();

        assertThatThrownBy(() -> Either.wrapError(Collections.singleton(Exception.class), () -> {
            throw error;
        })).isSameAs(error);
    }

    @Test
    void checkedExceptionIsLeft() throws IOException {
        FileNotFoundException error = new FileNotFoundException("missing.txt");
        Either<Throwable, String> result = Either.wrapError(Collections.singleton(IOException.class), () -> {
            if (error != null) {
                throw error;
            }
            return "content";
        });

        assertThat(result).isEqualTo(Either.left(error));
    }

    @Test
    void unclassifiedCheckedExceptionPropagates() {
        IOException error = new IOException("disk");

        assertThatThrownBy(() -> Either.wrapError(Collections.singleton(ArithmeticException.class), () -> {
            throw error;
        })).isSameAs(error);
    }

    @Test
    void singleKindIsTyped() {
        Either<NumberFormatException, Integer> parsed = Either.wrapError(NumberFormatException.class,
            () -> Integer.parseInt("12"));
        Either<NumberFormatException, Integer> failed = Either.wrapError(NumberFormatException.class,
            () -> Integer.parseInt("twelve"));

        assertThat(parsed).isEqualTo(Either.right(12));
        assertThat(failed.fromLeft()).hasMessageContaining("twelve");
        assertThat(failed.lmap(Throwable::getMessage).fromRight(message -> -1)).isEqualTo(-1);
    }

    @Test
    void singleKindPropagatesOthers() {
        ArithmeticException error = new ArithmeticException();

        assertThatThrownBy(() -> Either.wrapError(NumberFormatException.class, () -> {
            throw error;
        })).isSameAs(error);
    }

    @Test
    void nullKindIsRejectedBeforeBodyRuns() {
        List<String> runs = new ArrayList<>();

        assertThatThrownBy(() -> Either.wrapError(Arrays.asList(ArithmeticException.class, null), () -> {
            runs.add("body");
            return 1;
        })).isInstanceOf(NullPointerException.class)
            .hasMessage("kinds must not contain null");
        assertThat(runs).isEmpty();
    }

    @Test
    void missingBody() {
        SupplierE<Integer, RuntimeException> body = null;

        assertThatThrownBy(() -> Either.wrapError(Collections.singleton(ArithmeticException.class), body))
            .isInstanceOf(MissingCallbackException.class)
            .hasMessage("Missing callback: body");
        assertThatThrownBy(() -> Either.wrapError(ArithmeticException.class, body))
            .isInstanceOf(MissingCallbackException.class);
    }
}
