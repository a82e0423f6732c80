package com.polybot.mm.strategy.model;

public record QuoteValidation(boolean allowed, String reason) {

    private static final QuoteValidation OK = new QuoteValidation(true, "ok");

    public static QuoteValidation ok() {
        return OK;
    }

    public static QuoteValidation reject(String reason) {
        return new QuoteValidation(false, reason);
    }
}
