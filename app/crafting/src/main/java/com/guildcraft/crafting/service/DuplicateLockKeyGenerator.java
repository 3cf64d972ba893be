/*
 * Where: crafting service layer
 * What: Derives a 64-bit advisory lock key from a submission tuple
 * Why: hashtext() is only 32 bits; colliding keys would serialize unrelated submissions
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.DuplicateKey;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class DuplicateLockKeyGenerator {

  // First 8 bytes of SHA-256 form the lock key.
  static final int LOCK_KEY_BYTES = 8;

  public long generate(DuplicateKey key) {
    final byte[] hashed = hash(key.canonical());
    // ByteBuffer is big-endian by default; keep it so keys match across runtimes.
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String canonical) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
