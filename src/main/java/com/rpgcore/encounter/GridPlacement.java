package com.rpgcore.encounter;

import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.GridPosition;

/**
 * Начальная расстановка на квадратной сетке: игрок в центре,
 * NPC через клетку в рядах 1-3 у верхнего края, затем любая свободная клетка.
 */
final class GridPlacement {
    private static final int EDGE_MARGIN = 3;

    private GridPlacement() {
    }

    static GridPosition playerStart(int gridSize) {
        return new GridPosition(gridSize / 2, gridSize / 2);
    }

    /**
     * Свободная клетка для нового NPC; null, если сетка заполнена
     */
    static GridPosition nextNpcSlot(Encounter encounter) {
        int size = encounter.getGridSize();
        for (int row = 1; row <= Math.min(3, size - 1); row++) {
            for (int col = EDGE_MARGIN; col < size - EDGE_MARGIN; col += 2) {
                GridPosition candidate = new GridPosition(row, col);
                if (!encounter.isOccupied(candidate)) {
                    return candidate;
                }
            }
        }
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                GridPosition candidate = new GridPosition(row, col);
                if (!encounter.isOccupied(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
