package com.rpgcore.intents;

import java.util.Collections;
import java.util.List;

public class AttackIntent extends ActionIntent {
    private final String weapon;
    private final String target;
    private final List<ExtraDamageRequest> extraDamage;

    public AttackIntent(String weapon, String target) {
        this(weapon, target, List.of());
    }

    public AttackIntent(String weapon, String target, List<ExtraDamageRequest> extraDamage) {
        super(Kind.ATTACK);
        this.weapon = weapon;
        this.target = target;
        this.extraDamage = extraDamage == null ? List.of() : Collections.unmodifiableList(extraDamage);
    }

    /** Имя или id оружия / заклинания из списка способностей персонажа */
    public String getWeapon() { return weapon; }

    /** Id или имя NPC-цели; null для способностей без цели */
    public String getTarget() { return target; }

    public List<ExtraDamageRequest> getExtraDamage() { return extraDamage; }

    public boolean requests(ExtraDamageSource source) {
        return extraDamage.stream().anyMatch(r -> r.getSource() == source);
    }
}
