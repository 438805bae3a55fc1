package com.axlabs.neo.multisig;

@FunctionalInterface
public interface NotificationListener {

    void onNotification(Notification notification);
}
