/**
 * Threshold classification of analysis observations into findings, and the
 * analyst-driven finding lifecycle.
 */
package io.scanrelay.anomaly;
