package com.polybot.mm.strategy.risk;

public record DrawdownStatus(boolean triggered, double drawdownPct) {
}
