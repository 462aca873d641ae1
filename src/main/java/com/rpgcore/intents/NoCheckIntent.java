package com.rpgcore.intents;

public class NoCheckIntent extends ActionIntent {
    private final String reason;

    public NoCheckIntent(String reason) {
        super(Kind.NO_CHECK);
        this.reason = reason;
    }

    public String getReason() { return reason; }
}
