package com.tcg.duel.match;

public class NotParticipantException extends MatchException {
    public NotParticipantException(String message) {
        super(message);
    }
}
