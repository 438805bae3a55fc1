package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Records how to undo the writes of one wallet call and buffers the notifications it fires.
 * <p>
 * A call made from within another call (e.g. a governance operation run by an execution, or a call into another
 * wallet made by a call target) gets a nested journal. When the nested call succeeds its entries move to the
 * enclosing journal, so a later failure of the enclosing call undoes them too. Notifications are only handed to
 * their wallet's listeners once the outermost call succeeded.
 */
final class CallJournal {

    private final Hash160 contract;
    private final NotificationListener sink;
    private final CallJournal parent;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<PendingNotification> notifications = new ArrayList<>();

    CallJournal(Hash160 contract, NotificationListener sink) {
        this(contract, sink, null);
    }

    private CallJournal(Hash160 contract, NotificationListener sink, CallJournal parent) {
        this.contract = contract;
        this.sink = sink;
        this.parent = parent;
    }

    /**
     * @param contract The wallet making the nested call.
     * @param sink     Where the wallet's notifications go once the outermost call succeeded.
     * @return the journal of the nested call.
     */
    CallJournal nested(Hash160 contract, NotificationListener sink) {
        return new CallJournal(contract, sink, this);
    }

    boolean isNested() {
        return parent != null;
    }

    void onRollback(Runnable undo) {
        undoLog.push(undo);
    }

    /**
     * Registers a write that survives the failure of this call but not the failure of an enclosing call.
     */
    void onEnclosingRollback(Runnable undo) {
        if (parent != null) {
            parent.onRollback(undo);
        }
    }

    void notify(String eventName, Object... state) {
        notifications.add(new PendingNotification(new Notification(contract, eventName, state), sink));
    }

    void rollback() {
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        notifications.clear();
    }

    void mergeIntoParent() {
        // Parent undoes in LIFO order, so the oldest of our entries has to end up deepest.
        while (!undoLog.isEmpty()) {
            parent.undoLog.push(undoLog.pollLast());
        }
        parent.notifications.addAll(notifications);
        notifications.clear();
    }

    /**
     * Delivers the buffered notifications in the order they were fired.
     */
    void publish() {
        for (PendingNotification pending : notifications) {
            pending.sink.onNotification(pending.notification);
        }
        notifications.clear();
    }

    private static final class PendingNotification {
        private final Notification notification;
        private final NotificationListener sink;

        private PendingNotification(Notification notification, NotificationListener sink) {
            this.notification = notification;
            this.sink = sink;
        }
    }
}
