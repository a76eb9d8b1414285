/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Machine mounting orientation as declared by the operator.
 *
 * <p>Informational only. It is echoed back in results and never consulted by
 * any classifier.
 */
public enum Orientation
{
    HORIZONTAL,
    VERTICAL
}
