package info.isaksson.erland.funcanalyzer.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Runs a primary strategy and, if it throws, a secondary one on the same input.
 *
 * <p>Both the annotation normalizer and the docstring extractor are built on this: a structured
 * parse that may fail, and a best-effort pattern pass that must not. Failures of the primary
 * strategy are logged at DEBUG and never reach the caller. {@link Error}s are not caught.</p>
 *
 * @param <T> input type
 * @param <R> result type
 */
public final class WithFallback<T, R> implements Function<T, R> {

    private static final Logger LOG = LoggerFactory.getLogger(WithFallback.class);

    /** A strategy that may fail with any exception. */
    @FunctionalInterface
    public interface Strategy<T, R> {
        R apply(T input) throws Exception;
    }

    private final String name;
    private final Strategy<? super T, ? extends R> primary;
    private final Function<? super T, ? extends R> secondary;

    private WithFallback(String name, Strategy<? super T, ? extends R> primary, Function<? super T, ? extends R> secondary) {
        this.name = Objects.requireNonNull(name, "name");
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
    }

    public static <T, R> WithFallback<T, R> of(
            String name,
            Strategy<? super T, ? extends R> primary,
            Function<? super T, ? extends R> secondary
    ) {
        return new WithFallback<>(name, primary, secondary);
    }

    @Override
    public R apply(T input) {
        R result;
        try {
            result = primary.apply(input);
        } catch (Exception e) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: primary strategy failed, using fallback ({})", name, e.toString());
            }
            return secondary.apply(input);
        }
        return result;
    }

    public String name() {
        return name;
    }
}
