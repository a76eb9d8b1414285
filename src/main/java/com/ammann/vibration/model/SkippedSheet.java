/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.SkipReason;

/**
 * A workbook sheet that was excluded from the summary, with the reason why.
 */
public record SkippedSheet(String sheetName, SkipReason reason, String detail)
{
}
