package com.trendline.engine;

import com.trendline.core.model.Position;

import java.util.Optional;

/**
 * Position state of one strategy instance. Opening is only possible from
 * {@link Flat} and closing only from {@link InPosition}, so a second
 * position cannot be opened while one is held.
 */
public sealed interface StrategyState permits StrategyState.Flat, StrategyState.InPosition {

    static Flat flat() {
        return Flat.INSTANCE;
    }

    default boolean isFlat() {
        return this instanceof Flat;
    }

    default Optional<Position> currentPosition() {
        return this instanceof InPosition in ? Optional.of(in.position()) : Optional.empty();
    }

    record Flat() implements StrategyState {
        private static final Flat INSTANCE = new Flat();

        public InPosition open(Position position) {
            return new InPosition(position);
        }
    }

    record InPosition(Position position) implements StrategyState {
        public InPosition {
            if (position == null) {
                throw new IllegalArgumentException("position is required");
            }
        }

        public Flat close() {
            return Flat.INSTANCE;
        }
    }
}
