package io.pglisten;

/**
 * Delivery policy applied to every channel of a listen session.
 *
 * @see io.pglisten.dispatch.Mailbox#forPolicy(ListenPolicy)
 */
public enum ListenPolicy {
    /** Every notification is delivered, in arrival order. */
    ALL,
    /**
     * Only the freshest unconsumed notification is delivered; older ones that
     * arrived while the handler was busy are overwritten.
     */
    LAST
}
