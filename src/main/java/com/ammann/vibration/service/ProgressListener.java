/* (C)2026 */
package com.ammann.vibration.service;

/**
 * Receives progress updates while a workbook is diagnosed sheet by sheet.
 */
@FunctionalInterface
public interface ProgressListener
{
    ProgressListener NONE = (processed, total, sheetName) -> { };

    /**
     * Called after each sheet, whether it was diagnosed or skipped.
     *
     * @param processed sheets handled so far, including this one
     * @param total     sheets in the workbook
     * @param sheetName name of the sheet just handled
     */
    void onSheetProcessed(int processed, int total, String sheetName);
}
