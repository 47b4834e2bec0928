package com.shoprtc.socket.actor;

/**
 * Raised when work is submitted to an actor whose mailbox has been closed.
 */
public class MailboxClosedException extends IllegalStateException {

    public MailboxClosedException(String mailboxName) {
        super("Mailbox " + mailboxName + " is closed");
    }
}
