package io.mixforge.security;

/** How a validated path is going to be used. */
public enum PathMode {
  READ,
  WRITE
}
