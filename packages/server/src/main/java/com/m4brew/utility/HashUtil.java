package com.m4brew.utility;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** SHA-256 helpers used to fingerprint persisted documents. */
public final class HashUtil {

  private HashUtil() {}

  /** @return lowercase hex SHA-256 digest of {@code content} */
  public static String sha256Hex(byte[] content) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      StringBuilder sb = new StringBuilder();
      for (byte b : md.digest(content)) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
