/**
 * File-based persistence adapters for observation archives.
 */
package ca.gc.cra.cot.infrastructure.persistence;
