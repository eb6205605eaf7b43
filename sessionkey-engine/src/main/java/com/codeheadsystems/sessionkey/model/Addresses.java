package com.codeheadsystems.sessionkey.model;

import java.util.Locale;

/**
 * Utility methods for hex account and contract addresses.
 */
public class Addresses {

  private Addresses() {
  }

  /**
   * Normalizes an address for comparison. Hex addresses are case-insensitive (EIP-55 only
   * encodes a checksum in the casing), so allow-lists and targets are compared in lower case.
   *
   * @param address the address, with or without checksum casing
   * @return the trimmed lower-case address
   * @throws IllegalArgumentException if the address is null or blank
   */
  public static String normalize(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("Address must not be blank");
    }
    return address.trim().toLowerCase(Locale.ROOT);
  }
}
