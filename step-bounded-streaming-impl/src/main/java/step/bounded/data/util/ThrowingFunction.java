package step.bounded.data.util;

import java.io.IOException;

@FunctionalInterface
public interface ThrowingFunction<T, R> {
    R apply(T value) throws IOException;
}
