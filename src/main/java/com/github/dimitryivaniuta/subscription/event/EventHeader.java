package com.github.dimitryivaniuta.subscription.event;

public record EventHeader(String key, byte[] value) {
}
