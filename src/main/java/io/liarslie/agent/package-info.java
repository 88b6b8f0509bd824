/**
 * Agent side of the game.
 *
 * <p>{@link io.liarslie.agent.AgentRuntime} accepts connections for one agent and hands each
 * to an {@link io.liarslie.agent.AgentConnectionHandler}, which answers value queries, obeys
 * authenticated kill directives and relays peer values, tampering with them if the agent lies.
 */
package io.liarslie.agent;
