package com.polybot.mm.domain;

/**
 * Outcome leg of a binary market. A YES share and a NO share together redeem for one unit of collateral.
 */
public enum TokenLeg {
  YES,
  NO
}
