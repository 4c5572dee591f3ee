/**
 * MirrorBoard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.mirrorboard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.mirrorboard.cli.BoardCommand} maps commands to runtime APIs; {@code BoardHttpApi} serves {@code /messages}.</li>
 *   <li>{@code io.mirrorboard.runtime.MessageService} owns the dual-write and merged-read paths.</li>
 *   <li>{@code io.mirrorboard.storage.MessageStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.mirrorboard.mirror.MirrorRegistry} fans reads out across the GitHub mirrors.</li>
 * </ul>
 */
package io.mirrorboard;
