package com.m4brew.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.*;

class HashUtilTest {

  @Test
  void computesLowercaseHexDigest() {
    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        HashUtil.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
  }
}
