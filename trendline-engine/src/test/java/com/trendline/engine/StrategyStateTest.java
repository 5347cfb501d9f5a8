package com.trendline.engine;

import com.trendline.core.model.Position;
import com.trendline.core.model.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StrategyStateTest {

    @Test
    @DisplayName("FLAT opens into IN_POSITION and closes back to FLAT")
    void transitions() {
        Position position = new Position(1L, 100, 2, PositionSide.LONG, 98, 104, 0);

        StrategyState.Flat flat = StrategyState.flat();
        assertTrue(flat.isFlat());
        assertTrue(flat.currentPosition().isEmpty());

        StrategyState.InPosition open = flat.open(position);
        assertFalse(open.isFlat());
        assertEquals(position, open.currentPosition().orElseThrow());

        StrategyState closed = open.close();
        assertTrue(closed.isFlat());
        assertSame(StrategyState.flat(), closed);
    }

    @Test
    @DisplayName("IN_POSITION requires a position")
    void requiresPosition() {
        assertThrows(IllegalArgumentException.class, () -> new StrategyState.InPosition(null));
    }
}
