package com.aquawatch.service.alert;

public interface AlertPublisher {
    void publish(String subject, String message);
}
