package io.meshpager.gateway;

import io.meshpager.model.TextMessage;

@FunctionalInterface
public interface MessageForwarder {
    /** Delivers one message. Never throws; every failure is reported through the result. */
    ForwardResult forward(TextMessage message);
}
