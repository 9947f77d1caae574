package com.tcg.duel.compiler;

import com.tcg.duel.card.Amount;
import com.tcg.duel.card.Duration;
import com.tcg.duel.card.EffectAction;
import com.tcg.duel.card.Recipient;
import com.tcg.duel.card.Zone;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one {@code KEYWORD: text} operation string into an action. Operations with no
 * engine counterpart compile to nothing.
 */
final class OperationParser {
    static final int DISCARD_ALL = 99;

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)");
    private static final Pattern SIGNED_AMOUNT = Pattern.compile("^([+\\-*])(\\d+)");
    private static final Pattern LEADING_SIGN = Pattern.compile("^([+\\-])");
    private static final Pattern PLUS_AMOUNT = Pattern.compile("\\+(\\d+)");
    private static final Pattern ANY_NUMBER = Pattern.compile("(\\d+)");
    private static final Pattern PERCENT = Pattern.compile("(\\d+)%");

    private static final int IMMUNITY_DEFENSE = 9999;
    private static final int DEFAULT_RANDOM_GAIN = 500;
    private static final int DEFAULT_SET_STAT = 1000;
    private static final int DEFAULT_REDUCE_PERCENT = 50;

    private OperationParser() {
        // Utility class - prevent instantiation
    }

    static Optional<EffectAction> parse(String operation) {
        if (operation == null) {
            return Optional.empty();
        }
        String op = operation.trim();

        if (op.startsWith("MODIFY_STAT:")) {
            return parseModifyStat(body(op, "MODIFY_STAT:"));
        }
        if (op.startsWith("CONDITIONAL_MODIFY_STAT:")) {
            return parseModifyStat(body(op, "CONDITIONAL_MODIFY_STAT:"));
        }
        if (op.startsWith("RANDOM_MODIFY_STAT:")) {
            return parseModifyStat(body(op, "RANDOM_MODIFY_STAT:"));
        }
        if (op.startsWith("DRAW:")) {
            return Optional.of(new EffectAction.Draw(leadingNumber(body(op, "DRAW:"), 1)));
        }
        if (op.startsWith("CONDITIONAL_DRAW:")) {
            return Optional.of(new EffectAction.Draw(leadingNumber(body(op, "CONDITIONAL_DRAW:"), 1)));
        }
        if (op.startsWith("DISCARD:")) {
            return Optional.of(parseDiscard(body(op, "DISCARD:")));
        }
        if (op.startsWith("DESTROY:")) {
            return Optional.of(parseDestroy(body(op, "DESTROY:")));
        }
        if (op.startsWith("NEGATE") || op.equals("RANDOM_NEGATE")) {
            return Optional.of(new EffectAction.Negate());
        }
        if (op.startsWith("MOVE_TO_ZONE:")) {
            return Optional.of(parseMoveToZone(body(op, "MOVE_TO_ZONE:")));
        }
        if (op.startsWith("GRANT_IMMUNITY:")) {
            return Optional.of(new EffectAction.BoostDefense(Amount.of(IMMUNITY_DEFENSE), Duration.TURN));
        }
        if (op.startsWith("RANDOM_GAIN:")) {
            int amount = firstMatch(PLUS_AMOUNT, op, DEFAULT_RANDOM_GAIN);
            return Optional.of(new EffectAction.Damage(Amount.of(amount), Recipient.OPPONENT));
        }
        if (op.startsWith("FORCE_ATTACK") || op.equals("CHANGE_ATTACK_TARGET") || op.startsWith("FORCE_TARGET:")) {
            return Optional.of(new EffectAction.ChangePosition());
        }
        if (op.startsWith("SKIP_") || op.startsWith("DISABLE_")) {
            return Optional.of(new EffectAction.BoostDefense(Amount.of(0), Duration.TURN));
        }
        if (op.startsWith("SET_STAT:")) {
            int amount = firstMatch(ANY_NUMBER, op, DEFAULT_SET_STAT);
            return Optional.of(new EffectAction.Heal(Amount.of(amount), Recipient.SELF));
        }
        if (op.startsWith("RANDOM_CARD:") || op.startsWith("COPY_LAST_SPELL_EFFECT")) {
            return Optional.of(new EffectAction.Draw(1));
        }
        if (op.startsWith("STEAL:")) {
            return Optional.of(new EffectAction.SpecialSummon(Zone.HAND));
        }
        if (op.startsWith("REDUCE_DAMAGE:")) {
            int percent = firstMatch(PERCENT, op, DEFAULT_REDUCE_PERCENT);
            return Optional.of(new EffectAction.BoostDefense(Amount.of(percent * 10), Duration.TURN));
        }
        if (op.startsWith("REMOVE_COUNTERS:")) {
            return Optional.of(new EffectAction.RemoveVice(1));
        }
        // MODIFY_COST, VIEW_TOP_CARDS, REARRANGE_CARDS, REVEAL_HAND, SHUFFLE and free text
        return Optional.empty();
    }

    // ==================== STAT CHANGES ====================

    /**
     * reputation maps to attack, stability to defense. A positive change boosts the stat,
     * a negative one damages the opponent.
     */
    private static Optional<EffectAction> parseModifyStat(String body) {
        boolean attack = body.startsWith("reputation");
        boolean defense = body.startsWith("stability");
        if (!attack && !defense) {
            return Optional.empty();
        }
        String rest = body.substring(attack ? "reputation".length() : "stability".length()).trim();

        Matcher numeric = SIGNED_AMOUNT.matcher(rest);
        if (numeric.find()) {
            Amount amount = Amount.of(Integer.parseInt(numeric.group(2)));
            if (numeric.group(1).equals("-")) {
                return Optional.of(new EffectAction.Damage(amount, Recipient.OPPONENT));
            }
            return Optional.of(boost(attack, amount));
        }

        Matcher sign = LEADING_SIGN.matcher(rest);
        boolean positive = !sign.find() || sign.group(1).equals("+");
        Amount amount = variableAmount(rest);
        return Optional.of(positive ? boost(attack, amount) : new EffectAction.Damage(amount, Recipient.OPPONENT));
    }

    private static EffectAction boost(boolean attack, Amount amount) {
        return attack
                ? new EffectAction.BoostAttack(amount, Duration.PERMANENT)
                : new EffectAction.BoostDefense(amount, Duration.PERMANENT);
    }

    /**
     * Amount for phrasing without a literal number, e.g. "+X equal to cards in your graveyard".
     */
    static Amount variableAmount(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (!lower.contains("graveyard")) {
            return new Amount.Mirror();
        }
        if (lower.contains("both") || lower.contains("all graveyard")) {
            return new Amount.GraveyardCount(Recipient.BOTH);
        }
        if (lower.contains("opponent")) {
            return new Amount.GraveyardCount(Recipient.OPPONENT);
        }
        return new Amount.GraveyardCount(Recipient.SELF);
    }

    // ==================== CARD MOVEMENT ====================

    private static EffectAction parseDiscard(String body) {
        if (body.equals("all") || body.equals("all from both hands")) {
            return new EffectAction.Discard(DISCARD_ALL, Recipient.OPPONENT);
        }
        return new EffectAction.Discard(leadingNumber(body, 1), Recipient.OPPONENT);
    }

    private static EffectAction parseDestroy(String body) {
        if (body.contains("all traps") || body.contains("all spells")) {
            return new EffectAction.Destroy(EffectAction.DestroyTarget.ALL_SPELLS_TRAPS);
        }
        if (body.equals("alliedStereotypes")) {
            return new EffectAction.Destroy(EffectAction.DestroyTarget.ALL_OPPONENT_MONSTERS);
        }
        return new EffectAction.Destroy(EffectAction.DestroyTarget.SELECTED);
    }

    private static EffectAction parseMoveToZone(String body) {
        if (!body.contains("to hand") && body.contains("to deck")) {
            return new EffectAction.Banish();
        }
        return new EffectAction.ReturnToHand();
    }

    // ==================== HELPERS ====================

    private static String body(String op, String keyword) {
        return op.substring(keyword.length()).trim();
    }

    private static int leadingNumber(String text, int fallback) {
        return firstMatch(LEADING_NUMBER, text, fallback);
    }

    private static int firstMatch(Pattern pattern, String text, int fallback) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return fallback;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
