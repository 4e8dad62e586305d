package com.d2stacks.portainer;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Authentication state of a {@link PortainerApi}: either {@link NotLogged} or
 * {@link Logged} with the bearer token and the endpoint every scoped call targets.
 *
 * <p>Read sites go through {@link #fold}, which forces both states to be handled.
 */
public sealed interface SessionState permits SessionState.NotLogged, SessionState.Logged {

    static SessionState notLogged() {
        return NotLogged.INSTANCE;
    }

    static SessionState logged(String token, int endpointId) {
        return new Logged(token, endpointId);
    }

    <R> R fold(Supplier<? extends R> onNotLogged, Function<? super Logged, ? extends R> onLogged);

    default boolean isLogged() {
        return fold(() -> false, logged -> true);
    }

    /**
     * Returns the logged-in data, failing fast when there is none.
     *
     * @throws NotLoggedException when the state is {@link NotLogged}
     */
    default Logged requireLogged() {
        return fold(() -> {
            throw new NotLoggedException();
        }, Function.identity());
    }

    record NotLogged() implements SessionState {

        static final NotLogged INSTANCE = new NotLogged();

        @Override
        public <R> R fold(Supplier<? extends R> onNotLogged, Function<? super Logged, ? extends R> onLogged) {
            return onNotLogged.get();
        }
    }

    record Logged(String token, int endpointId) implements SessionState {

        public Logged {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public <R> R fold(Supplier<? extends R> onNotLogged, Function<? super Logged, ? extends R> onLogged) {
            return onLogged.apply(this);
        }

        @Override
        public String toString() {
            return "Logged[endpointId=" + endpointId + "]";
        }
    }
}
