package com.khaounen.botguard.security.alert;

public interface AlertChannel {

    String name();

    void publish(GuardAlert alert);
}
