package com.rpgcore.game_rules;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random с заранее заданными гранями кубиков: nextInt(bound) отдаёт очередную грань минус 1
 */
public class ScriptedRandom extends Random {
    private final Deque<Integer> faces = new ArrayDeque<>();

    public ScriptedRandom(int... faces) {
        queue(faces);
    }

    public ScriptedRandom queue(int... next) {
        for (int face : next) {
            faces.addLast(face);
        }
        return this;
    }

    public int remaining() {
        return faces.size();
    }

    @Override
    public int nextInt(int bound) {
        if (faces.isEmpty()) {
            throw new IllegalStateException("No scripted roll left for d" + bound);
        }
        int face = faces.removeFirst();
        if (face < 1 || face > bound) {
            throw new IllegalStateException("Scripted face " + face + " does not fit d" + bound);
        }
        return face - 1;
    }
}
