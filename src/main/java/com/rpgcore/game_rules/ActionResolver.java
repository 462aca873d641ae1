package com.rpgcore.game_rules;

import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterFeature;
import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Npc;
import com.rpgcore.game_state.Skill;
import com.rpgcore.intents.ActionIntent;
import com.rpgcore.intents.AttackIntent;
import com.rpgcore.intents.ExtraDamageRequest;
import com.rpgcore.intents.ExtraDamageSource;
import com.rpgcore.intents.ImpossibleIntent;
import com.rpgcore.intents.NoCheckIntent;
import com.rpgcore.intents.SavingThrowIntent;
import com.rpgcore.intents.SkillCheckIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.rpgcore.game_rules.RollSummaryFormatter.formatModifier;

/**
 * Разрешение классифицированного действия игрока в полностью брошенный {@link RollResult}.
 * <p>
 * Все броски идут через {@link DiceRoller}: сначала d20, затем кубики урона в порядке
 * источников (оружие, Brutal Critical, бонусный урон эффектов, заявленные источники).
 * На натуральной 20 число кубиков каждого источника удваивается и они бросаются заново,
 * плоские бонусы не удваиваются.
 * <p>
 * Метод {@link #resolve} не бросает исключений: неизвестное намерение даёт NoCheck.
 */
@Component
public class ActionResolver {
    private static final Logger log = LoggerFactory.getLogger(ActionResolver.class);
    private static final Pattern BONUS_DAMAGE = Pattern.compile("^(\\d+d\\d+)(?:\\s+(.+))?$", Pattern.CASE_INSENSITIVE);
    private static final int GREAT_WEAPON_MASTER_PENALTY = -5;
    private static final int GREAT_WEAPON_MASTER_DAMAGE = 10;

    private final DiceRoller dice;

    public ActionResolver(DiceRoller dice) {
        this.dice = dice;
    }

    public RollResult resolve(ActionIntent intent, DerivedStats stats, Npc target) {
        return resolve(intent, stats, target, 0);
    }

    /**
     * @param round текущий раунд боя, 0 вне боя
     */
    public RollResult resolve(ActionIntent intent, DerivedStats stats, Npc target, int round) {
        if (intent == null) {
            return RollResult.noCheck("Unknown intent: no action was classified; no roll made.");
        }
        try {
            return switch (intent.getKind()) {
                case ATTACK -> resolveAttack((AttackIntent) intent, stats, target, round);
                case SKILL_CHECK -> resolveSkillCheck((SkillCheckIntent) intent, stats);
                case SAVING_THROW -> resolveSavingThrow((SavingThrowIntent) intent, stats);
                case IMPOSSIBLE -> RollResult.impossible(((ImpossibleIntent) intent).getReason());
                case NO_CHECK -> RollResult.noCheck(((NoCheckIntent) intent).getReason());
            };
        } catch (RuntimeException e) {
            log.error("Не удалось разрешить действие {}: {}", intent.getKind(), e.getMessage(), e);
            return RollResult.noCheck("Could not resolve this action: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------- checks

    private RollResult resolveSkillCheck(SkillCheckIntent intent, DerivedStats stats) {
        Skill skill = intent.getSkill();
        Ability ability = skill.getAbility();
        int abilityMod = stats.getModifier(ability);
        int prof = stats.getProficiencyBonus();
        boolean proficient = stats.isSkillProficient(skill);

        List<String> parts = new ArrayList<>();
        parts.add(ability.getShortName() + " " + formatModifier(abilityMod));
        int modifier = abilityMod;
        if (proficient && hasExpertise(stats.getCharacter(), skill)) {
            modifier += prof * 2;
            parts.add("Expertise " + formatModifier(prof * 2));
        } else if (proficient) {
            modifier += prof;
            parts.add("Prof " + formatModifier(prof));
        } else if (stats.hasHalfProficiency()) {
            int half = Math.floorDiv(prof, 2);
            modifier += half;
            parts.add("Half Prof " + formatModifier(half));
        }

        int natural = dice.rollD20(modifier).getRoll();
        int effective = natural;
        if (proficient && stats.getMinCheckRoll() > natural) {
            effective = stats.getMinCheckRoll();
        }
        boolean success = effective + modifier >= intent.getDc();
        String notes = success ? "Check succeeds" : "Check fails";
        if (effective != natural) {
            notes += " (Reliable Talent: d20 " + natural + " -> " + effective + ")";
        }
        return RollResult.rolled(skill.getDisplayName() + " Check", parts, effective, modifier,
            intent.getDc(), success, notes, null);
    }

    private RollResult resolveSavingThrow(SavingThrowIntent intent, DerivedStats stats) {
        Ability ability = intent.getAbility();
        int abilityMod = stats.getModifier(ability);
        List<String> parts = new ArrayList<>();
        parts.add(ability.getShortName() + " " + formatModifier(abilityMod));
        int modifier = abilityMod;
        if (stats.isSaveProficient(ability)) {
            modifier += stats.getProficiencyBonus();
            parts.add("Prof " + formatModifier(stats.getProficiencyBonus()));
        }

        DiceRoller.D20Result roll = dice.rollD20(modifier);
        boolean success = roll.getTotal() >= intent.getDc();
        String source = intent.getSource() == null || intent.getSource().isBlank() ? "" : " (" + intent.getSource() + ")";
        return RollResult.rolled(capitalize(ability.getValue()) + " Saving Throw", parts, roll.getRoll(), modifier,
            intent.getDc(), success, (success ? "Save succeeds" : "Save fails") + source, null);
    }

    private static boolean hasExpertise(Character character, Skill skill) {
        CharacterFeature expertise = character.findFeature("Expertise");
        return expertise != null && expertise.getChosenOption() != null
            && expertise.getChosenOption().toLowerCase().contains(skill.getValue());
    }

    // ---------------------------------------------------------------- attacks

    private RollResult resolveAttack(AttackIntent intent, DerivedStats stats, Npc target, int round) {
        Character character = stats.getCharacter();
        CombatAbility ability = character.findAbility(intent.getWeapon());
        if (ability == null) {
            return RollResult.impossible("\"" + intent.getWeapon() + "\" is not among "
                + character.getName() + "'s weapons or abilities");
        }
        if (!ability.isRequiresTarget() || ability.getType() == CombatAbility.Type.ACTION
            || ability.getAttackKind() == CombatAbility.AttackKind.NONE) {
            return RollResult.noCheck(ability.getName() + ": action taken, no roll needed.");
        }
        if (target == null) {
            return RollResult.impossible("Target \"" + (intent.getTarget() == null ? "" : intent.getTarget())
                + "\" not found among active NPCs");
        }
        if (!target.isAlive()) {
            return RollResult.impossible(target.getName() + " is already down");
        }

        if (ability.getType() == CombatAbility.Type.WEAPON) {
            return weaponAttack(intent, stats, ability, target, round);
        }
        return switch (ability.getAttackKind()) {
            case MELEE, RANGED -> spellAttack(intent, stats, ability, target, round);
            case SAVE -> saveSpell(stats, ability, target);
            case AUTO -> autoHit(stats, ability, target);
            case NONE -> RollResult.noCheck(ability.getName() + ": action taken, no roll needed.");
        };
    }

    private RollResult weaponAttack(AttackIntent intent, DerivedStats stats, CombatAbility weapon,
                                    Npc target, int round) {
        if (weapon.getDamageRoll() == null || !DiceRoller.isValid(weapon.getDamageRoll())) {
            return RollResult.impossible(weapon.getName() + " has no usable damage dice");
        }
        Character character = stats.getCharacter();
        boolean melee = weapon.isMelee();
        String abilityLabel = weaponAbilityLabel(weapon.getWeaponStat(), stats);
        int abilityMod = abilityLabel.equals("NONE") ? 0 : stats.getModifier(Ability.fromString(abilityLabel));
        boolean proficient = WeaponProficiency.isProficient(weapon.getName(), character.getWeaponProficiencies());
        int prof = proficient ? stats.getProficiencyBonus() : 0;
        int effectBonus = stats.getAttackBonus(melee);

        ExtraDamagePlan plan = planExtraDamage(intent.getExtraDamage(), stats, weapon, target, round, true);

        List<String> parts = new ArrayList<>();
        parts.add(abilityLabel + " " + formatModifier(abilityMod));
        if (proficient) {
            parts.add("Prof " + formatModifier(prof));
        }
        if (weapon.getWeaponBonus() != 0) {
            parts.add("Bonus " + formatModifier(weapon.getWeaponBonus()));
        }
        if (effectBonus != 0) {
            parts.add("Effects " + formatModifier(effectBonus));
        }
        int attackPenalty = plan.accepted.contains(ExtraDamageSource.GREAT_WEAPON_MASTER) ? GREAT_WEAPON_MASTER_PENALTY : 0;
        if (attackPenalty != 0) {
            parts.add("Great Weapon Master " + formatModifier(attackPenalty));
        }
        int modifier = abilityMod + prof + weapon.getWeaponBonus() + effectBonus + attackPenalty;

        DiceRoller.D20Result roll = dice.rollD20(modifier);
        boolean crit = roll.isCritical();
        boolean hit = attackHits(roll, target.getArmorClass());

        DamageRoll damage = null;
        if (hit) {
            List<DamageBreakdown> breakdown = new ArrayList<>();
            DiceRoller.DiceExpression base = DiceRoller.parse(weapon.getDamageRoll());
            int flat = base.getModifier() + abilityMod + weapon.getWeaponBonus() + stats.getDamageBonus(melee);
            breakdown.add(rollSource(weapon.getName(), base.withoutModifier(), flat, weapon.getDamageType(), crit));
            if (crit && stats.getCritBonusDice() > 0) {
                DiceRoller.DiceExpression brutal = new DiceRoller.DiceExpression(stats.getCritBonusDice(), base.getSides(), 0);
                breakdown.add(rollSource("Brutal Critical", brutal, 0, weapon.getDamageType(), false));
            }
            for (String bonus : stats.getBonusDamage()) {
                Matcher matcher = BONUS_DAMAGE.matcher(bonus.trim());
                if (matcher.matches()) {
                    String type = matcher.group(2) == null ? weapon.getDamageType() : matcher.group(2);
                    breakdown.add(rollSource("Effect Bonus", DiceRoller.parse(matcher.group(1)), 0, type, crit));
                }
            }
            breakdown.addAll(rollExtraDamage(plan, stats, weapon, crit));
            damage = new DamageRoll(breakdown, crit);
        }

        return RollResult.rolled(weapon.getName() + " Attack", parts, roll.getRoll(), modifier,
            target.getArmorClass(), hit, attackNotes(roll, hit, plan), damage);
    }

    private RollResult spellAttack(AttackIntent intent, DerivedStats stats, CombatAbility spell,
                                   Npc target, int round) {
        Ability casting = stats.getCharacter().getEffectiveSpellcastingAbility();
        int abilityMod = stats.getModifier(casting);
        int prof = stats.getProficiencyBonus();
        int effectBonus = stats.getSpellAttackBonus();

        ExtraDamagePlan plan = planExtraDamage(intent.getExtraDamage(), stats, spell, target, round, false);

        List<String> parts = new ArrayList<>();
        parts.add(casting.getShortName() + " " + formatModifier(abilityMod));
        parts.add("Prof " + formatModifier(prof));
        if (effectBonus != 0) {
            parts.add("Effects " + formatModifier(effectBonus));
        }
        int modifier = abilityMod + prof + effectBonus;

        DiceRoller.D20Result roll = dice.rollD20(modifier);
        boolean crit = roll.isCritical();
        boolean hit = attackHits(roll, target.getArmorClass());

        DamageRoll damage = null;
        if (hit) {
            List<DamageBreakdown> breakdown = new ArrayList<>();
            if (spell.getDamageRoll() != null && DiceRoller.isValid(spell.getDamageRoll())) {
                DiceRoller.DiceExpression base = DiceRoller.parse(spell.getDamageRoll());
                breakdown.add(rollSource(spell.getName(), base.withoutModifier(), base.getModifier(),
                    spell.getDamageType(), crit));
            }
            breakdown.addAll(rollExtraDamage(plan, stats, spell, crit));
            damage = new DamageRoll(breakdown, crit);
        }

        return RollResult.rolled(spell.getName() + " Attack", parts, roll.getRoll(), modifier,
            target.getArmorClass(), hit, attackNotes(roll, hit, plan), damage);
    }

    /**
     * Заклинание со спасброском: цель бросает d20 + бонус спасброска против DC заклинателя,
     * заклинание срабатывает при провале цели
     */
    private RollResult saveSpell(DerivedStats stats, CombatAbility spell, Npc target) {
        Ability casting = spell.getSaveDcAbility() != null
            ? spell.getSaveDcAbility()
            : stats.getCharacter().getEffectiveSpellcastingAbility();
        int spellDc = 8 + stats.getModifier(casting) + stats.getProficiencyBonus();
        Ability saveAbility = spell.getSaveAbility() == null ? Ability.DEXTERITY : spell.getSaveAbility();

        DiceRoller.D20Result save = dice.rollD20(target.getSavingThrowBonus());
        boolean lands = save.getTotal() < spellDc;

        DamageRoll damage = null;
        String damageRoll = spell.damageRollForLevel(stats.getLevel());
        if (lands && damageRoll != null && DiceRoller.isValid(damageRoll)) {
            DiceRoller.DiceExpression base = DiceRoller.parse(damageRoll);
            damage = new DamageRoll(List.of(rollSource(spell.getName(), base.withoutModifier(), base.getModifier(),
                spell.getDamageType(), false)), false);
        }

        List<String> parts = List.of(target.getName() + " save " + formatModifier(target.getSavingThrowBonus()));
        String notes = target.getName() + (lands ? " fails" : " succeeds on") + " the "
            + saveAbility.getShortName() + " save against DC " + spellDc
            + " (8 + " + casting.getShortName() + " " + formatModifier(stats.getModifier(casting))
            + " + Prof " + formatModifier(stats.getProficiencyBonus()) + ")";
        return RollResult.rolled(spell.getName() + " (" + saveAbility.getShortName() + " save)", parts,
            save.getRoll(), target.getSavingThrowBonus(), spellDc, lands, notes, damage);
    }

    private RollResult autoHit(DerivedStats stats, CombatAbility spell, Npc target) {
        DamageRoll damage = null;
        if (spell.getDamageRoll() != null && DiceRoller.isValid(spell.getDamageRoll())) {
            DiceRoller.DiceExpression base = DiceRoller.parse(spell.getDamageRoll());
            damage = new DamageRoll(List.of(rollSource(spell.getName(), base.withoutModifier(), base.getModifier(),
                spell.getDamageType(), false)), false);
        }
        return RollResult.rolled(spell.getName() + " (auto-hit)", List.of(), 0, 0,
            target.getArmorClass(), true, spell.getName() + " hits automatically", damage);
    }

    private static boolean attackHits(DiceRoller.D20Result roll, int armorClass) {
        if (roll.isCriticalFail()) {
            return false;
        }
        return roll.isCritical() || roll.getTotal() >= armorClass;
    }

    private static String attackNotes(DiceRoller.D20Result roll, boolean hit, ExtraDamagePlan plan) {
        String notes;
        if (roll.isCritical()) {
            notes = "Natural 20: critical hit!";
        } else if (roll.isCriticalFail()) {
            notes = "Natural 1: automatic miss";
        } else {
            notes = hit ? "Attack hits" : "Attack misses";
        }
        if (!plan.notes.isEmpty()) {
            notes += ". " + String.join(". ", plan.notes);
        }
        return notes;
    }

    private static String weaponAbilityLabel(CombatAbility.WeaponStat stat, DerivedStats stats) {
        if (stat == null) {
            return "STR";
        }
        return switch (stat) {
            case STR -> "STR";
            case DEX -> "DEX";
            case FINESSE -> stats.getModifier(Ability.STRENGTH) >= stats.getModifier(Ability.DEXTERITY) ? "STR" : "DEX";
            case NONE -> "NONE";
        };
    }

    private DamageBreakdown rollSource(String label, DiceRoller.DiceExpression expression, int flat,
                                       String damageType, boolean crit) {
        DiceRoller.DiceExpression rolled = crit ? expression.doubled() : expression;
        DiceRoller.DiceResult result = dice.roll(rolled);
        return new DamageBreakdown(label, rolled.toString(), result.getRolls(), flat, damageType);
    }

    // ---------------------------------------------------------------- extra damage

    /**
     * Проверенные до броска источники доп. урона: что принято и что отклонено.
     * Проверка идёт до d20, потому что Great Weapon Master меняет бонус атаки.
     */
    private static class ExtraDamagePlan {
        final Set<ExtraDamageSource> accepted = EnumSet.noneOf(ExtraDamageSource.class);
        final List<ExtraDamageRequest> requests = new ArrayList<>();
        final List<String> notes = new ArrayList<>();
    }

    private ExtraDamagePlan planExtraDamage(List<ExtraDamageRequest> requests, DerivedStats stats,
                                           CombatAbility ability, Npc target, int round, boolean weaponAttack) {
        ExtraDamagePlan plan = new ExtraDamagePlan();
        for (ExtraDamageRequest request : requests) {
            ExtraDamageSource source = request.getSource();
            if (plan.accepted.contains(source)) {
                continue;
            }
            String rejection = validate(request, stats, ability, target, round, weaponAttack);
            if (rejection == null && source == ExtraDamageSource.RAGE && stats.isFeatureApplied("Rage")) {
                plan.notes.add("Rage damage already included in damage bonus");
                continue;
            }
            if (rejection != null) {
                plan.notes.add(source.getLabel() + " not applied: " + rejection);
                log.debug("Источник {} отклонён: {}", source, rejection);
                continue;
            }
            plan.accepted.add(source);
            plan.requests.add(request);
        }
        return plan;
    }

    private static String validate(ExtraDamageRequest request, DerivedStats stats, CombatAbility ability,
                                   Npc target, int round, boolean weaponAttack) {
        Character character = stats.getCharacter();
        ExtraDamageSource source = request.getSource();
        if (source != ExtraDamageSource.HEX && !weaponAttack) {
            return "applies to weapon attacks only";
        }
        return switch (source) {
            case SNEAK_ATTACK, COLOSSUS_SLAYER, DREAD_AMBUSHER, GREAT_WEAPON_MASTER, DIVINE_SMITE, ELDRITCH_SMITE,
                 RAGE -> {
                if (!character.hasFeature(source.getLabel())) {
                    yield character.getName() + " lacks the " + source.getLabel() + " feature";
                }
                yield switch (source) {
                    case DIVINE_SMITE, ELDRITCH_SMITE -> request.getTier() < 1 || request.getTier() > 4
                        ? "slot level must be 1-4, got " + request.getTier() : null;
                    case COLOSSUS_SLAYER -> target.getCurrentHp() < target.getMaxHp()
                        ? null : target.getName() + " is not below its hit point maximum";
                    case DREAD_AMBUSHER -> round == 1 ? null : "only on the first round of combat";
                    case GREAT_WEAPON_MASTER -> ability.isMelee() ? null : "requires a melee weapon";
                    case RAGE -> !stats.hasCondition(Condition.RAGING) ? character.getName() + " is not raging"
                        : ability.isMelee() ? null : "requires a melee attack";
                    default -> null;
                };
            }
            case HUNTERS_MARK -> stats.isConcentratingOn("hunter's mark") || stats.isConcentratingOn("hunters mark")
                ? null : "not concentrating on Hunter's Mark";
            case HEX -> stats.isConcentratingOn("hex") ? null : "not concentrating on Hex";
        };
    }

    private List<DamageBreakdown> rollExtraDamage(ExtraDamagePlan plan, DerivedStats stats,
                                                  CombatAbility ability, boolean crit) {
        List<DamageBreakdown> breakdown = new ArrayList<>();
        String weaponType = ability.getDamageType();
        for (ExtraDamageRequest request : plan.requests) {
            ExtraDamageSource source = request.getSource();
            String label = source.getLabel();
            switch (source) {
                case SNEAK_ATTACK -> {
                    int count = stats.getSneakAttackDice() > 0
                        ? stats.getSneakAttackDice() : (stats.getLevel() + 1) / 2;
                    breakdown.add(rollSource(label, new DiceRoller.DiceExpression(count, 6, 0), 0, weaponType, crit));
                }
                case DIVINE_SMITE -> breakdown.add(rollSource(label,
                    new DiceRoller.DiceExpression(1 + request.getTier(), 8, 0), 0, "radiant", crit));
                case ELDRITCH_SMITE -> breakdown.add(rollSource(label,
                    new DiceRoller.DiceExpression(1 + request.getTier(), 8, 0), 0, "force", crit));
                case COLOSSUS_SLAYER, DREAD_AMBUSHER -> breakdown.add(rollSource(label,
                    new DiceRoller.DiceExpression(1, 8, 0), 0, weaponType, crit));
                case GREAT_WEAPON_MASTER -> breakdown.add(DamageBreakdown.flat(label, GREAT_WEAPON_MASTER_DAMAGE, weaponType));
                case RAGE -> breakdown.add(DamageBreakdown.flat(label, rageBonus(stats.getLevel()), weaponType));
                case HUNTERS_MARK -> breakdown.add(rollSource(label,
                    new DiceRoller.DiceExpression(1, 6, 0), 0, weaponType, crit));
                case HEX -> breakdown.add(rollSource(label,
                    new DiceRoller.DiceExpression(1, 6, 0), 0, "necrotic", crit));
            }
        }
        return breakdown;
    }

    static int rageBonus(int level) {
        if (level >= 16) {
            return 4;
        }
        return level >= 9 ? 3 : 2;
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : java.lang.Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
