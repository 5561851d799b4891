/**
 * Shared byte-level utilities for all key file modules.
 *
 * <p>Contains {@link com.libragraph.keyfile.util.SensitiveBytes} (scoped zeroing),
 * {@link com.libragraph.keyfile.util.KeyDigest} (SHA-256 via commons-codec) and
 * {@link com.libragraph.keyfile.util.LittleEndian}.
 * No framework dependencies.
 */
package com.libragraph.keyfile.util;
