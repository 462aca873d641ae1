package com.rpgcore.intents;

public class ImpossibleIntent extends ActionIntent {
    private final String reason;

    public ImpossibleIntent(String reason) {
        super(Kind.IMPOSSIBLE);
        this.reason = reason;
    }

    public String getReason() { return reason; }
}
