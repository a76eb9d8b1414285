/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Why a sheet was left out of a workbook summary.
 */
public enum SkipReason
{
    INVALID_SCHEMA,
    PROCESSING_ERROR
}
