/**
 * Pure Java value types shared across all SDC modules.
 *
 * <p>Item addressing ({@link com.libragraph.sdc.types.ItemName}) and the root
 * of the error taxonomy. No framework dependencies.
 */
package com.libragraph.sdc.types;
