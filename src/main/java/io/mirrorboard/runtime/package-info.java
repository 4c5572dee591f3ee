/**
 * Runtime orchestration package.
 *
 * <p>{@link io.mirrorboard.runtime.BoardRuntime} wires storage, mirrors and the audit trail for one
 * data root and owns the shared I/O executor; {@link io.mirrorboard.runtime.MessageService} runs
 * the dual-write and merged-read paths used by the CLI and the HTTP API.
 */
package io.mirrorboard.runtime;
