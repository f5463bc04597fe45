package dev.personalagent.core.event;

/**
 * Marker for everything that travels over the {@link EventBus}.
 *
 * <p>
 * The event space is split into seven families, each a nested interface
 * extending this one and declaring its variants as records:
 * <ul>
 * <li>{@link UserEvent}: actions emitted by the UI</li>
 * <li>{@link ChatEvent}: streaming progress of an assistant reply</li>
 * <li>{@link McpEvent}: MCP server lifecycle</li>
 * <li>{@link ProfileEvent}: model profile changes</li>
 * <li>{@link ConversationEvent}: conversation store changes</li>
 * <li>{@link NavigationEvent}: view stack changes</li>
 * <li>{@link SystemEvent}: application lifecycle and system level errors</li>
 * </ul>
 * Every variant is immutable and carries only small values (strings, ids,
 * immutable lists), so one instance can safely be handed to many subscribers.
 */
public interface AppEvent {
}
