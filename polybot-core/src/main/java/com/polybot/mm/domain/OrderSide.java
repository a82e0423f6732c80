package com.polybot.mm.domain;

public enum OrderSide {
  BUY,
  SELL
}
