/**
 * Spreadsheet adapters that expose workbook sheets as untyped cell grids.
 */
package ca.gc.cra.cot.infrastructure.spreadsheet;
