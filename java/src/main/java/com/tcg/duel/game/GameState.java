package com.tcg.duel.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcg.duel.card.CardDefinition;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.game.zones.BoardCard;
import com.tcg.duel.game.zones.PlayerZones;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a duel. Every fold produces a new instance; callers may keep old ones.
 * <p>
 * {@code cards} and {@code instances} are shared, read-only maps fixed when the duel is created.
 *
 * @param cards     definition id to card definition
 * @param instances card instance id to definition id
 */
public record GameState(
    @JsonProperty("config") EngineConfig config,
    @JsonProperty("cards") Map<String, CardDefinition> cards,
    @JsonProperty("instances") Map<String, String> instances,
    @JsonProperty("host") PlayerZones host,
    @JsonProperty("away") PlayerZones away,
    @JsonProperty("current_turn_player") Seat currentTurnPlayer,
    @JsonProperty("turn_number") int turnNumber,
    @JsonProperty("current_phase") Phase currentPhase,
    @JsonProperty("current_chain") List<ChainLink> currentChain,
    @JsonProperty("negated_links") Set<Integer> negatedLinks,
    @JsonProperty("current_priority_player") Seat currentPriorityPlayer,
    @JsonProperty("current_chain_passer") Seat currentChainPasser,
    @JsonProperty("temporary_modifiers") List<TemporaryModifier> temporaryModifiers,
    @JsonProperty("turn_restrictions") List<TurnRestriction> turnRestrictions,
    @JsonProperty("cost_modifiers") List<CostModifier> costModifiers,
    @JsonProperty("top_deck_views") List<TopDeckView> topDeckViews,
    @JsonProperty("opt_used_this_turn") Set<String> optUsedThisTurn,
    @JsonProperty("hopt_used_effects") Set<String> hoptUsedEffects,
    @JsonProperty("game_over") boolean gameOver,
    @JsonProperty("winner") Seat winner,
    @JsonProperty("win_reason") WinReason winReason
) {
    public GameState {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(cards, "cards");
        Objects.requireNonNull(instances, "instances");
        currentChain = List.copyOf(currentChain);
        negatedLinks = Collections.unmodifiableSet(new TreeSet<>(negatedLinks));
        temporaryModifiers = List.copyOf(temporaryModifiers);
        turnRestrictions = List.copyOf(turnRestrictions);
        costModifiers = List.copyOf(costModifiers);
        topDeckViews = List.copyOf(topDeckViews);
        optUsedThisTurn = Collections.unmodifiableSet(new TreeSet<>(optUsedThisTurn));
        hoptUsedEffects = Collections.unmodifiableSet(new TreeSet<>(hoptUsedEffects));
    }

    // ==================== SEATS ====================

    public PlayerZones player(Seat seat) {
        return seat == Seat.HOST ? host : away;
    }

    public GameState withPlayer(Seat seat, PlayerZones zones) {
        Builder builder = toBuilder();
        if (seat == Seat.HOST) {
            builder.host(zones);
        } else {
            builder.away(zones);
        }
        return builder.build();
    }

    // ==================== CARD LOOKUPS ====================

    /**
     * Definition behind a card instance, or null for unknown ids.
     */
    public CardDefinition definitionOf(String cardId) {
        if (cardId == null) {
            return null;
        }
        String definitionId = instances.get(cardId);
        return definitionId != null ? cards.get(definitionId) : null;
    }

    /**
     * Seat whose board holds the card, host first.
     */
    public Optional<Seat> boardOwner(String cardId) {
        for (Seat seat : Seat.values()) {
            if (player(seat).findBoardCard(cardId).isPresent()) {
                return Optional.of(seat);
            }
        }
        return Optional.empty();
    }

    public Optional<BoardCard> findBoardCard(String cardId) {
        return boardOwner(cardId).flatMap(seat -> player(seat).findBoardCard(cardId));
    }

    /**
     * Seat holding the card in any zone, host first.
     */
    public Optional<Seat> ownerOf(String cardId) {
        for (Seat seat : Seat.values()) {
            if (player(seat).locate(cardId).isPresent()) {
                return Optional.of(seat);
            }
        }
        return Optional.empty();
    }

    // ==================== CHAIN & RESTRICTIONS ====================

    @JsonIgnore
    public boolean isChainOpen() {
        return !currentChain.isEmpty();
    }

    public boolean hasRestriction(Seat seat, EffectAction.Restriction restriction) {
        return turnRestrictions.stream()
                .anyMatch(r -> r.seat() == seat && r.restriction() == restriction);
    }

    /**
     * Cost of a card for a seat once every active cost modifier has been applied in order.
     */
    public int effectiveCost(Seat seat, CardDefinition card, int baseCost) {
        int cost = baseCost;
        for (CostModifier modifier : costModifiers) {
            if (modifier.seat() != seat) {
                continue;
            }
            EffectAction.CostCardType type = modifier.cardType();
            if (type == EffectAction.CostCardType.ALL
                    || type.getJsonValue().equals(card.getType().getJsonValue())) {
                cost = modifier.apply(cost);
            }
        }
        return cost;
    }

    public Optional<TopDeckView> topDeckView(Seat seat) {
        return topDeckViews.stream().filter(v -> v.seat() == seat).findFirst();
    }

    // ==================== BUILDER ====================

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(EngineConfig config, Map<String, CardDefinition> cards,
                                  Map<String, String> instances) {
        return new Builder(config, cards, instances);
    }

    /**
     * Mutable staging area for producing the next snapshot.
     */
    public static final class Builder {
        private EngineConfig config;
        private Map<String, CardDefinition> cards;
        private Map<String, String> instances;
        private PlayerZones host;
        private PlayerZones away;
        private Seat currentTurnPlayer = Seat.HOST;
        private int turnNumber = 1;
        private Phase currentPhase = Phase.DRAW;
        private List<ChainLink> currentChain = List.of();
        private Set<Integer> negatedLinks = Set.of();
        private Seat currentPriorityPlayer;
        private Seat currentChainPasser;
        private List<TemporaryModifier> temporaryModifiers = List.of();
        private List<TurnRestriction> turnRestrictions = List.of();
        private List<CostModifier> costModifiers = List.of();
        private List<TopDeckView> topDeckViews = List.of();
        private Set<String> optUsedThisTurn = Set.of();
        private Set<String> hoptUsedEffects = Set.of();
        private boolean gameOver;
        private Seat winner;
        private WinReason winReason;

        private Builder(EngineConfig config, Map<String, CardDefinition> cards, Map<String, String> instances) {
            this.config = config;
            this.cards = cards;
            this.instances = instances;
        }

        private Builder(GameState s) {
            this.config = s.config;
            this.cards = s.cards;
            this.instances = s.instances;
            this.host = s.host;
            this.away = s.away;
            this.currentTurnPlayer = s.currentTurnPlayer;
            this.turnNumber = s.turnNumber;
            this.currentPhase = s.currentPhase;
            this.currentChain = s.currentChain;
            this.negatedLinks = s.negatedLinks;
            this.currentPriorityPlayer = s.currentPriorityPlayer;
            this.currentChainPasser = s.currentChainPasser;
            this.temporaryModifiers = s.temporaryModifiers;
            this.turnRestrictions = s.turnRestrictions;
            this.costModifiers = s.costModifiers;
            this.topDeckViews = s.topDeckViews;
            this.optUsedThisTurn = s.optUsedThisTurn;
            this.hoptUsedEffects = s.hoptUsedEffects;
            this.gameOver = s.gameOver;
            this.winner = s.winner;
            this.winReason = s.winReason;
        }

        public Builder host(PlayerZones host) {
            this.host = host;
            return this;
        }

        public Builder away(PlayerZones away) {
            this.away = away;
            return this;
        }

        public Builder player(Seat seat, PlayerZones zones) {
            return seat == Seat.HOST ? host(zones) : away(zones);
        }

        public Builder currentTurnPlayer(Seat seat) {
            this.currentTurnPlayer = seat;
            return this;
        }

        public Builder turnNumber(int turnNumber) {
            this.turnNumber = turnNumber;
            return this;
        }

        public Builder currentPhase(Phase phase) {
            this.currentPhase = phase;
            return this;
        }

        public Builder currentChain(List<ChainLink> chain) {
            this.currentChain = chain;
            return this;
        }

        public Builder negatedLinks(Set<Integer> negatedLinks) {
            this.negatedLinks = negatedLinks;
            return this;
        }

        public Builder currentPriorityPlayer(Seat seat) {
            this.currentPriorityPlayer = seat;
            return this;
        }

        public Builder currentChainPasser(Seat seat) {
            this.currentChainPasser = seat;
            return this;
        }

        public Builder temporaryModifiers(List<TemporaryModifier> modifiers) {
            this.temporaryModifiers = modifiers;
            return this;
        }

        public Builder turnRestrictions(List<TurnRestriction> restrictions) {
            this.turnRestrictions = restrictions;
            return this;
        }

        public Builder costModifiers(List<CostModifier> modifiers) {
            this.costModifiers = modifiers;
            return this;
        }

        public Builder topDeckViews(List<TopDeckView> views) {
            this.topDeckViews = views;
            return this;
        }

        public Builder optUsedThisTurn(Set<String> used) {
            this.optUsedThisTurn = used;
            return this;
        }

        public Builder hoptUsedEffects(Set<String> used) {
            this.hoptUsedEffects = used;
            return this;
        }

        public Builder gameOver(Seat winner, WinReason reason) {
            this.gameOver = true;
            this.winner = winner;
            this.winReason = reason;
            return this;
        }

        public GameState build() {
            return new GameState(config, cards, instances, host, away, currentTurnPlayer, turnNumber,
                    currentPhase, currentChain, negatedLinks, currentPriorityPlayer, currentChainPasser,
                    temporaryModifiers, turnRestrictions, costModifiers, topDeckViews, optUsedThisTurn,
                    hoptUsedEffects, gameOver, winner, winReason);
        }
    }
}
