package com.rpgcore.srd;

/**
 * Боевые характеристики из справочника. Необязательные числа равны null.
 */
public class StatBlock {
    private String kind;
    private String slug;
    private String name;
    private Integer armorClass;
    private Integer hitPoints;
    private Double challengeRating;
    private Integer xp;
    private Integer attackBonus;
    private String damageDice;
    private String damageType;
    private Integer savingThrowBonus;
    private Integer speed;
    private String description;

    public StatBlock() {
    }

    public StatBlock(String kind, String slug, String name) {
        this.kind = kind;
        this.slug = slug;
        this.name = name;
    }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getArmorClass() { return armorClass; }
    public void setArmorClass(Integer armorClass) { this.armorClass = armorClass; }

    public Integer getHitPoints() { return hitPoints; }
    public void setHitPoints(Integer hitPoints) { this.hitPoints = hitPoints; }

    public Double getChallengeRating() { return challengeRating; }
    public void setChallengeRating(Double challengeRating) { this.challengeRating = challengeRating; }

    public Integer getXp() { return xp; }
    public void setXp(Integer xp) { this.xp = xp; }

    public Integer getAttackBonus() { return attackBonus; }
    public void setAttackBonus(Integer attackBonus) { this.attackBonus = attackBonus; }

    public String getDamageDice() { return damageDice; }
    public void setDamageDice(String damageDice) { this.damageDice = damageDice; }

    public String getDamageType() { return damageType; }
    public void setDamageType(String damageType) { this.damageType = damageType; }

    public Integer getSavingThrowBonus() { return savingThrowBonus; }
    public void setSavingThrowBonus(Integer savingThrowBonus) { this.savingThrowBonus = savingThrowBonus; }

    public Integer getSpeed() { return speed; }
    public void setSpeed(Integer speed) { this.speed = speed; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
