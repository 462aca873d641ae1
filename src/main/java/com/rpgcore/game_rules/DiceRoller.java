package com.rpgcore.game_rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Броски кубиков D&D. Источник случайности передаётся снаружи,
 * чтобы ход можно было воспроизвести.
 */
public class DiceRoller {
    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d*)d(\\d+)([+-]\\d+)?");
    private static final int MAX_DICE = 100;
    private static final int MAX_SIDES = 1000;

    private final Random random;

    public DiceRoller() {
        this(new Random());
    }

    public DiceRoller(Random random) {
        this.random = random;
    }

    /**
     * Разбор выражения вида "1d20+3", "2d6", "d8"
     */
    public static DiceExpression parse(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Empty dice expression");
        }
        String normalized = expression.toLowerCase().replace(" ", "");
        Matcher matcher = DICE_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid dice expression: " + expression);
        }
        int numDice = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        int sides = Integer.parseInt(matcher.group(2));
        String modifierStr = matcher.group(3);
        int modifier = modifierStr != null ? Integer.parseInt(modifierStr) : 0;
        if (numDice > MAX_DICE || sides < 1 || sides > MAX_SIDES) {
            throw new IllegalArgumentException("Dice expression out of range: " + expression);
        }
        return new DiceExpression(numDice, sides, modifier);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Удваивает количество кубиков (критическое попадание); модификатор не меняется
     */
    public static String doubleDice(String expression) {
        return parse(expression).doubled().toString();
    }

    public DiceResult roll(String expression) {
        return roll(parse(expression));
    }

    public DiceResult roll(DiceExpression expression) {
        List<Integer> rolls = new ArrayList<>();
        for (int i = 0; i < expression.getCount(); i++) {
            rolls.add(random.nextInt(expression.getSides()) + 1);
        }
        int total = rolls.stream().mapToInt(Integer::intValue).sum() + expression.getModifier();
        return new DiceResult(total, rolls, expression.getModifier(), expression.toString(),
            expression.getCount(), expression.getSides());
    }

    /**
     * Бросок d20 с модификатором
     */
    public D20Result rollD20(int modifier) {
        int roll = random.nextInt(20) + 1;
        return new D20Result(roll, roll + modifier, modifier, roll == 20, roll == 1);
    }

    public static class DiceExpression {
        private final int count;
        private final int sides;
        private final int modifier;

        public DiceExpression(int count, int sides, int modifier) {
            this.count = count;
            this.sides = sides;
            this.modifier = modifier;
        }

        public DiceExpression doubled() {
            return new DiceExpression(count * 2, sides, modifier);
        }

        public DiceExpression withoutModifier() {
            return new DiceExpression(count, sides, 0);
        }

        public DiceExpression plusDice(int extra) {
            return new DiceExpression(count + extra, sides, modifier);
        }

        public int getCount() { return count; }
        public int getSides() { return sides; }
        public int getModifier() { return modifier; }

        @Override
        public String toString() {
            String dice = count + "d" + sides;
            if (modifier > 0) {
                return dice + "+" + modifier;
            }
            return modifier < 0 ? dice + modifier : dice;
        }
    }

    // Result classes
    public static class DiceResult {
        private final int total;
        private final List<Integer> rolls;
        private final int modifier;
        private final String expression;
        private final int numDice;
        private final int sides;

        public DiceResult(int total, List<Integer> rolls, int modifier,
                         String expression, int numDice, int sides) {
            this.total = total;
            this.rolls = Collections.unmodifiableList(rolls);
            this.modifier = modifier;
            this.expression = expression;
            this.numDice = numDice;
            this.sides = sides;
        }

        public int getTotal() { return total; }
        public List<Integer> getRolls() { return rolls; }
        public int getModifier() { return modifier; }
        public String getExpression() { return expression; }
        public int getNumDice() { return numDice; }
        public int getSides() { return sides; }
    }

    public static class D20Result {
        private final int roll;
        private final int total;
        private final int modifier;
        private final boolean critical;
        private final boolean criticalFail;

        public D20Result(int roll, int total, int modifier, boolean critical, boolean criticalFail) {
            this.roll = roll;
            this.total = total;
            this.modifier = modifier;
            this.critical = critical;
            this.criticalFail = criticalFail;
        }

        public int getRoll() { return roll; }
        public int getTotal() { return total; }
        public int getModifier() { return modifier; }
        public boolean isCritical() { return critical; }
        public boolean isCriticalFail() { return criticalFail; }
    }
}
