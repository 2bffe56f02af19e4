/**
 * Per-channel buffering and delivery.
 *
 * <p>Each subscribed channel gets one {@link io.pglisten.dispatch.Mailbox} and one
 * {@link io.pglisten.dispatch.ChannelWorker}. The mailbox implementation is chosen by
 * the session's {@link io.pglisten.ListenPolicy}: {@link io.pglisten.dispatch.FifoMailbox}
 * keeps every notification, {@link io.pglisten.dispatch.LatestMailbox} keeps only the
 * freshest one.
 *
 * @see io.pglisten.dispatch.ChannelWorker
 * @see io.pglisten.dispatch.Mailbox
 */
package io.pglisten.dispatch;
