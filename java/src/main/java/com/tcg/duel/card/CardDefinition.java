package com.tcg.duel.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable card definition as loaded from the catalog. Stats only apply to monsters,
 * the spell and trap sub-types only to their own card type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CardDefinition {
    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final CardType type;

    @JsonProperty("rarity")
    private final Rarity rarity;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("attack")
    private final int attack;

    @JsonProperty("defense")
    private final int defense;

    @JsonProperty("level")
    private final int level;

    @JsonProperty("archetype")
    private final String archetype;

    @JsonProperty("spell_type")
    private final SpellType spellType;

    @JsonProperty("trap_type")
    private final TrapType trapType;

    @JsonProperty("effects")
    private final List<EffectDefinition> effects;

    @JsonCreator
    public CardDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("type") CardType type,
            @JsonProperty("rarity") Rarity rarity,
            @JsonProperty("description") String description,
            @JsonProperty("attack") int attack,
            @JsonProperty("defense") int defense,
            @JsonProperty("level") int level,
            @JsonProperty("archetype") String archetype,
            @JsonProperty("spell_type") SpellType spellType,
            @JsonProperty("trap_type") TrapType trapType,
            @JsonProperty("effects") List<EffectDefinition> effects) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.type = Objects.requireNonNull(type, "type");
        this.rarity = rarity != null ? rarity : Rarity.COMMON;
        this.description = description;
        this.attack = attack;
        this.defense = defense;
        this.level = level;
        this.archetype = archetype;
        this.spellType = type == CardType.SPELL && spellType == null ? SpellType.NORMAL : spellType;
        this.trapType = type == CardType.TRAP && trapType == null ? TrapType.NORMAL : trapType;
        this.effects = effects != null ? List.copyOf(effects) : List.of();
    }

    // ==================== FACTORIES ====================

    public static CardDefinition monster(String id, int level, int attack, int defense, EffectDefinition... effects) {
        return new CardDefinition(id, id, CardType.MONSTER, Rarity.COMMON, null,
                attack, defense, level, null, null, null, List.of(effects));
    }

    public static CardDefinition spell(String id, SpellType spellType, EffectDefinition... effects) {
        return new CardDefinition(id, id, CardType.SPELL, Rarity.COMMON, null,
                0, 0, 0, null, spellType, null, List.of(effects));
    }

    public static CardDefinition trap(String id, TrapType trapType, EffectDefinition... effects) {
        return new CardDefinition(id, id, CardType.TRAP, Rarity.COMMON, null,
                0, 0, 0, null, null, trapType, List.of(effects));
    }

    // ==================== ACCESSORS ====================

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CardType getType() {
        return type;
    }

    public Rarity getRarity() {
        return rarity;
    }

    public String getDescription() {
        return description;
    }

    public int getAttack() {
        return attack;
    }

    public int getDefense() {
        return defense;
    }

    public int getLevel() {
        return level;
    }

    public String getArchetype() {
        return archetype;
    }

    public SpellType getSpellType() {
        return spellType;
    }

    public TrapType getTrapType() {
        return trapType;
    }

    public List<EffectDefinition> getEffects() {
        return effects;
    }

    @JsonIgnore
    public boolean isMonster() {
        return type == CardType.MONSTER;
    }

    @JsonIgnore
    public boolean isSpell() {
        return type == CardType.SPELL;
    }

    @JsonIgnore
    public boolean isTrap() {
        return type == CardType.TRAP;
    }

    @JsonIgnore
    public boolean isQuickPlay() {
        return spellType == SpellType.QUICK_PLAY;
    }

    @JsonIgnore
    public boolean isFieldSpell() {
        return spellType == SpellType.FIELD;
    }

    @JsonIgnore
    public boolean isEquipSpell() {
        return spellType == SpellType.EQUIP;
    }

    /**
     * Whether the card remains face-up on the field once its activation resolves.
     */
    @JsonIgnore
    public boolean staysOnField() {
        if (type == CardType.SPELL) {
            return spellType.staysOnField();
        }
        return type == CardType.TRAP && trapType == TrapType.CONTINUOUS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CardDefinition other)) {
            return false;
        }
        return attack == other.attack && defense == other.defense && level == other.level
                && id.equals(other.id) && name.equals(other.name) && type == other.type
                && rarity == other.rarity && Objects.equals(description, other.description)
                && Objects.equals(archetype, other.archetype) && spellType == other.spellType
                && trapType == other.trapType && effects.equals(other.effects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, level, attack, defense, effects);
    }

    @Override
    public String toString() {
        return "CardDefinition{" + id + ", " + type.getJsonValue() + "}";
    }
}
