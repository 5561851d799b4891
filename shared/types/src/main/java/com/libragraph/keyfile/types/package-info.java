/**
 * Pure Java value types shared across all key file modules.
 *
 * <p>Byte-level helpers (zeroing, digests) live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.keyfile.types;
