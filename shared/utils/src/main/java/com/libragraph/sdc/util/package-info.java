/**
 * Shared utilities for all SDC modules.
 *
 * <p>Contains {@link com.libragraph.sdc.util.ContentHash} (SHA-256) and
 * {@link com.libragraph.sdc.util.Timestamps}.
 * No framework dependencies.
 */
package com.libragraph.sdc.util;
