/**
 * Batch use cases that move decoded reports into the archive.
 */
package ca.gc.cra.cot.application.pipeline;
