package com.rpgcore.srd;

/**
 * Справочные данные (монстры, заклинания) только для чтения.
 * null: обычный результат для неизвестного или самодельного существа.
 */
public interface StatLookup {

    StatBlock lookup(String kind, String slug);

    default StatBlock lookupMonster(String slug) {
        return lookup("monsters", slug);
    }
}
