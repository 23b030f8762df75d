package me.growmies.assistant.domain.model;

/**
 * Backend mode used to produce a reply.
 */
public enum BackendMode {
    /** Stateful provider-side thread, messages appended and a run polled. */
    THREAD,
    /** Stateless completion, full context resent on each call. */
    CHAT
}
