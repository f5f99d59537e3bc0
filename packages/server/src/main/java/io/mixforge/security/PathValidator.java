package io.mixforge.security;

/**
 * Boundary check applied to every filesystem path before the job or upload pipeline trusts it. A
 * rejected path must never be read or written.
 */
public interface PathValidator {
  PathValidation validate(String path, PathMode mode);
}
