/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Column layout detected on a raw sheet.
 */
public enum SchemaLayout
{
    /** One timestamp column per axis: {@code t(x), x, t(y), y, t(z), z}. */
    PER_AXIS,
    /** A single shared timestamp column plus {@code x, y, z}. */
    SHARED
}
