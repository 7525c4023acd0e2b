package com.convo.backend.room.store;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

/** Upper-case alphanumeric codes, e.g. {@code K3Q9ZT}. */
public class RandomRoomCodeGenerator implements RoomCodeGenerator {

  private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

  private final RandomGenerator random;
  private final int length;

  public RandomRoomCodeGenerator(int length) {
    this(new SecureRandom(), length);
  }

  RandomRoomCodeGenerator(RandomGenerator random, int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("length must be positive");
    }
    this.random = random;
    this.length = length;
  }

  @Override
  public String nextCode() {
    char[] code = new char[length];
    for (int i = 0; i < length; i++) {
      code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    }
    return new String(code);
  }
}
