/**
 * Liars Lie source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.liarslie.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.liarslie.cli.GameShell} maps console commands to the game session.</li>
 *   <li>{@code io.liarslie.game.Game} owns the agents of one game and the roster file.</li>
 *   <li>{@code io.liarslie.agent.AgentRuntime} is the listening side of one agent.</li>
 *   <li>{@code io.liarslie.client.GameClient} runs standard and expert rounds.</li>
 * </ul>
 */
package io.liarslie;
