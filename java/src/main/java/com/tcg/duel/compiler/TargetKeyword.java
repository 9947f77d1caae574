package com.tcg.duel.compiler;

import com.tcg.duel.card.CardType;
import com.tcg.duel.card.TargetFilter;
import com.tcg.duel.card.TargetFilter.Owner;
import com.tcg.duel.card.Zone;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Target keywords in priority order. Only an ability's first target keyword is consulted,
 * and the first entry here that claims it decides the filter.
 */
enum TargetKeyword {
    /** The activating player. */
    SELF(Set.of("self"), new TargetFilter(Owner.SELF, null, null), null),
    /** The opposing player. */
    OPPONENT(Set.of("opponent"), new TargetFilter(Owner.OPPONENT, null, null), null),
    /** Either player. */
    BOTH_PLAYERS(Set.of("bothPlayers", "allPlayers"), new TargetFilter(Owner.ANY, null, null), null),
    /** Own monsters; archetype names are treated the same way. */
    ALLIED_MONSTERS(Set.of("alliedStereotypes", "Dropouts", "Preps", "Geeks", "Geek", "Freaks", "Nerds",
            "Nerd", "Goodies"), new TargetFilter(Owner.SELF, null, CardType.MONSTER), null),
    /** Every monster. */
    ALL_MONSTERS(Set.of("allStereotypes"), new TargetFilter(Owner.ANY, null, CardType.MONSTER), null),
    /** Any spell card. */
    SPELLS(Set.of("spells", "spell"), new TargetFilter(Owner.ANY, null, CardType.SPELL), null),
    /** Any trap card. */
    TRAPS(Set.of("traps", "trap"), new TargetFilter(Owner.ANY, null, CardType.TRAP), null),
    /** The whole board; matched case-insensitively. */
    FIELD(Set.of("field", "environment"), new TargetFilter(Owner.ANY, Zone.BOARD, null), null),
    /** A single opposing card. */
    SINGLE_OPPONENT_CARD(Set.of("attacker", "opponentCard", "targetCard", "destroyedCard"),
            new TargetFilter(Owner.OPPONENT, null, null), 1);

    private final Set<String> keywords;
    private final TargetFilter filter;
    private final Integer targetCount;

    TargetKeyword(Set<String> keywords, TargetFilter filter, Integer targetCount) {
        this.keywords = keywords;
        this.filter = filter;
        this.targetCount = targetCount;
    }

    TargetFilter filter() {
        return filter;
    }

    Integer targetCount() {
        return targetCount;
    }

    private boolean matches(String keyword) {
        if (this == FIELD) {
            return keywords.contains(keyword.toLowerCase(Locale.ROOT));
        }
        return keywords.contains(keyword);
    }

    static Optional<TargetKeyword> lookup(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (TargetKeyword candidate : values()) {
            if (candidate.matches(keyword)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
