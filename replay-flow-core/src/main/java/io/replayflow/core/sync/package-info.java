/**
 * Single-threaded, pull-based sequences: deferred pipelines, an on-demand replay buffer with
 * immutable cursors, fork/branch sharing and sliding windows.
 */
package io.replayflow.core.sync;
